package io.github.riemr.pm.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Value
@Builder
public class ScheduledAssignment {
    LocalDate date;
    String description;
    String system;
    int durationMinutes;
    String referencePage;
    LocalDateTime startTime;
    LocalDateTime endTime;
}
