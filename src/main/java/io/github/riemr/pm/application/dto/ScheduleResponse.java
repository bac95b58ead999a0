package io.github.riemr.pm.application.dto;

import io.github.riemr.pm.domain.model.ScheduledAssignment;
import io.github.riemr.pm.domain.model.SchedulingResult;

import java.util.List;

public record ScheduleResponse(
    boolean truncated,
    int unscheduledTaskCount,
    List<ScheduledAssignment> assignments
) {
    public static ScheduleResponse from(SchedulingResult result) {
        return new ScheduleResponse(result.isTruncated(), result.getUnscheduledTaskCount(), result.getAssignments());
    }
}
