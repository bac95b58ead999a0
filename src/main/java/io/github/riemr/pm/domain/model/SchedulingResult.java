package io.github.riemr.pm.domain.model;

import lombok.Value;

import java.util.List;

/**
 * スケジューリング結果。配置順（＝時系列順）の割当リストと、容量不足で打ち切ったかどうか。
 */
@Value
public class SchedulingResult {
    List<ScheduledAssignment> assignments;
    boolean truncated;
    /** 割当できなかった所要時間 0 以外の作業数 */
    int unscheduledTaskCount;

    public SchedulingResult(List<ScheduledAssignment> assignments, boolean truncated, int unscheduledTaskCount) {
        this.assignments = List.copyOf(assignments);
        this.truncated = truncated;
        this.unscheduledTaskCount = unscheduledTaskCount;
    }

    public static SchedulingResult empty() {
        return new SchedulingResult(List.of(), false, 0);
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }
}
