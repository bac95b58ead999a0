package io.github.riemr.pm.application.dto;

/**
 * burdenScore = 合計所要時間(分) / 平均周期(月)
 */
public record SystemBurden(String system, long totalDurationMinutes, double averageIntervalMonths, double burdenScore) {
}
