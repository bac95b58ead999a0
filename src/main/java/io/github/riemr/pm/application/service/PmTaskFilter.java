package io.github.riemr.pm.application.service;

import io.github.riemr.pm.domain.model.PmTask;
import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * 周期・System・カテゴリでの絞り込み条件。未指定（null/空）の軸は絞り込まない。
 */
@Value
@Builder
public class PmTaskFilter {
    Set<Integer> intervals;
    Set<String> systems;
    Set<String> categories;

    public static PmTaskFilter none() {
        return PmTaskFilter.builder().build();
    }

    public static PmTaskFilter of(Collection<Integer> intervals, Collection<String> systems, Collection<String> categories) {
        return PmTaskFilter.builder()
                .intervals(intervals == null ? null : Set.copyOf(intervals))
                .systems(systems == null ? null : Set.copyOf(systems))
                .categories(categories == null ? null : Set.copyOf(categories))
                .build();
    }

    public boolean matches(PmTask task) {
        if (intervals != null && !intervals.isEmpty() && !intervals.contains(task.getIntervalMonths())) return false;
        if (systems != null && !systems.isEmpty() && !systems.contains(task.getSystem())) return false;
        if (categories != null && !categories.isEmpty() && !categories.contains(task.getCategory())) return false;
        return true;
    }

    public List<PmTask> apply(List<PmTask> tasks) {
        return tasks.stream().filter(this::matches).toList();
    }
}
