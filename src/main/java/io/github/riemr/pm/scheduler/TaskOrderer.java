package io.github.riemr.pm.scheduler;

import io.github.riemr.pm.domain.model.PmTask;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * 配置優先順位を決める並び替え。
 * system 昇順 → interval 昇順（短周期ほど先）→ 所要時間 降順（大きい作業から詰める）。
 * 同順位は入力順を維持する（安定ソート）。
 */
public class TaskOrderer {

    static final Comparator<PmTask> PLACEMENT_ORDER = Comparator
            .comparing(PmTask::getSystem, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingInt(PmTask::getIntervalMonths)
            .thenComparing(Comparator.comparingInt(PmTask::getDurationMinutes).reversed());

    public List<PmTask> order(Collection<PmTask> tasks) {
        List<PmTask> sorted = new ArrayList<>(tasks);
        sorted.sort(PLACEMENT_ORDER);
        return List.copyOf(sorted);
    }
}
