package io.github.riemr.pm.application.dto;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
public class DailyAgenda {
    LocalDate date;
    String heading;
    List<AgendaEntry> entries;
}
