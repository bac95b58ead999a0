package io.github.riemr.pm.application.service;

import io.github.riemr.pm.domain.model.PmTask;
import io.github.riemr.pm.domain.model.ScheduledAssignment;
import io.github.riemr.pm.domain.model.SchedulingResult;
import io.github.riemr.pm.scheduler.MaintenanceTaskScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class PmScheduleService {

    private final MaintenanceTaskScheduler scheduler;

    public SchedulingResult schedule(List<PmTask> tasks, PmTaskFilter filter, LocalDate startDate) {
        List<PmTask> selected = filter == null ? tasks : filter.apply(tasks);
        log.info("Scheduling PM tasks: received={}, after filter={}, start={}", tasks.size(), selected.size(), startDate);

        SchedulingResult result = scheduler.schedule(selected, startDate);
        if (result.isTruncated()) {
            log.warn("Total task duration exceeds the capacity of the scheduling window. {} task(s) were not scheduled.",
                    result.getUnscheduledTaskCount());
        }
        log.info("Scheduled {} assignment(s) on {} day(s)", result.getAssignments().size(),
                result.getAssignments().stream().map(ScheduledAssignment::getDate).distinct().count());
        return result;
    }
}
