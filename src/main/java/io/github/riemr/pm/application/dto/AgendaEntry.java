package io.github.riemr.pm.application.dto;

import lombok.Value;

@Value
public class AgendaEntry {
    String startTime;
    String endTime;
    int durationMinutes;
    String system;
    String description;
    String referencePage;
}
