package io.github.riemr.pm.application.dto;

public record MonthlyWorkload(String month, double totalHours) {
}
