package io.github.riemr.pm.application.dto;

import java.util.List;

public record WorkloadAnalysisResponse(
    WorkloadSummary summary,
    List<SystemBurden> burden,
    List<MonthlyWorkload> annualWorkload
) {
}
