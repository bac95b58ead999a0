package io.github.riemr.pm.scheduler;

import io.github.riemr.pm.domain.model.CandidateDay;
import io.github.riemr.pm.domain.model.PmTask;
import io.github.riemr.pm.domain.model.ScheduledAssignment;
import io.github.riemr.pm.domain.model.SchedulingResult;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 並び替え済みの作業を、均等に散らした日付へ1日の容量内で貪欲に詰める。
 * 作業は日をまたいで分割しない。1日の容量を超える作業は、何も置いていない日を丸ごと1日使う。
 * 日付が尽きたらその作業以降はすべて打ち切り、truncated を立てる。
 */
public class CapacityConstrainedPlacer {

    private final int dailyCapacityMinutes;
    private final LocalTime dayStart;
    private final SpreadDateSelector dateSelector;

    public CapacityConstrainedPlacer(SchedulerSettings settings, SpreadDateSelector dateSelector) {
        this.dailyCapacityMinutes = settings.getDailyCapacityMinutes();
        this.dayStart = settings.getDayStart();
        this.dateSelector = dateSelector;
    }

    public SchedulingResult place(List<PmTask> orderedTasks, List<CandidateDay> candidates) {
        long totalMinutes = 0;
        int schedulableCount = 0;
        for (PmTask t : orderedTasks) {
            if (t.getDurationMinutes() == 0) continue;
            totalMinutes += t.getDurationMinutes();
            schedulableCount++;
        }
        if (totalMinutes <= 0) {
            return SchedulingResult.empty();
        }

        int workdaysNeeded = workdaysNeeded(totalMinutes);
        List<CandidateDay> selected = dateSelector.select(candidates, workdaysNeeded);
        if (selected.isEmpty()) {
            return new SchedulingResult(List.of(), true, schedulableCount);
        }

        DayCursor cursor = new DayCursor(selected, dailyCapacityMinutes);
        List<ScheduledAssignment> placed = new ArrayList<>();
        for (PmTask task : orderedTasks) {
            int duration = task.getDurationMinutes();
            if (duration == 0) continue;

            // 空いている日なら容量超過の作業でも置く（分割しない）
            while (cursor.remainingMinutes() < duration && !cursor.isFresh()) {
                if (!cursor.advance()) {
                    return new SchedulingResult(placed, true, schedulableCount - placed.size());
                }
            }

            LocalDateTime start = cursor.current().getDate()
                    .atTime(dayStart)
                    .plusMinutes(cursor.elapsedMinutes());
            placed.add(ScheduledAssignment.builder()
                    .date(cursor.current().getDate())
                    .description(task.getDescription())
                    .system(task.getSystem())
                    .durationMinutes(duration)
                    .referencePage(task.getReferencePage())
                    .startTime(start)
                    .endTime(start.plusMinutes(duration))
                    .build());
            cursor.consume(duration);
        }
        return new SchedulingResult(placed, false, 0);
    }

    int workdaysNeeded(long totalMinutes) {
        if (totalMinutes <= 0) return 0;
        return (int) ((totalMinutes + dailyCapacityMinutes - 1) / dailyCapacityMinutes);
    }
}
