package io.github.riemr.pm.scheduler;

import io.github.riemr.pm.domain.model.CandidateDay;
import io.github.riemr.pm.domain.model.PmTask;
import io.github.riemr.pm.domain.model.SchedulingResult;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * PM 作業リストと開始日から、日付・時刻つきの割当リストを作る。
 * 並び替え → 候補日生成 → 容量制約つき配置 の順で一方向に処理し、呼び出し間で状態を共有しない。
 * 最適な詰め込みは行わない。一度進めた日付には戻らない。
 */
public class MaintenanceTaskScheduler {

    private final TaskOrderer orderer;
    private final CalendarWindowBuilder windowBuilder;
    private final CapacityConstrainedPlacer placer;

    public MaintenanceTaskScheduler(TaskOrderer orderer,
                                    CalendarWindowBuilder windowBuilder,
                                    CapacityConstrainedPlacer placer) {
        this.orderer = orderer;
        this.windowBuilder = windowBuilder;
        this.placer = placer;
    }

    public static MaintenanceTaskScheduler create(SchedulerSettings settings) {
        return new MaintenanceTaskScheduler(
                new TaskOrderer(),
                new CalendarWindowBuilder(settings),
                new CapacityConstrainedPlacer(settings, new SpreadDateSelector()));
    }

    public SchedulingResult schedule(Collection<PmTask> tasks, LocalDate startDate) {
        Objects.requireNonNull(tasks, "tasks");
        Objects.requireNonNull(startDate, "startDate");
        if (tasks.isEmpty()) {
            return SchedulingResult.empty();
        }
        List<PmTask> ordered = orderer.order(tasks);
        List<CandidateDay> candidates = windowBuilder.build(startDate);
        return placer.place(ordered, candidates);
    }
}
