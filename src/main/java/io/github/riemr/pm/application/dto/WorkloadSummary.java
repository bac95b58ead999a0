package io.github.riemr.pm.application.dto;

public record WorkloadSummary(int totalTasks, double totalDurationHours, int uniqueSystems) {
}
