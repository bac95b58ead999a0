package io.github.riemr.pm.application.service;

import io.github.riemr.pm.domain.model.PmTask;
import io.github.riemr.pm.domain.model.SchedulingResult;
import io.github.riemr.pm.scheduler.MaintenanceTaskScheduler;
import io.github.riemr.pm.scheduler.SchedulerSettings;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PmScheduleServiceTest {

    private static final LocalDate MONDAY = LocalDate.of(2024, 1, 1);

    private static PmTask task(String desc, String system, int duration) {
        return PmTask.builder().description(desc).system(system).intervalMonths(1).durationMinutes(duration).build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void schedule_passesOnlyFilteredTasksToScheduler() {
        MaintenanceTaskScheduler scheduler = Mockito.mock(MaintenanceTaskScheduler.class);
        when(scheduler.schedule(any(), eq(MONDAY))).thenReturn(SchedulingResult.empty());
        PmScheduleService service = new PmScheduleService(scheduler);

        service.schedule(List.of(task("a", "LINAC", 10), task("b", "XVI", 10)),
                PmTaskFilter.of(null, List.of("XVI"), null), MONDAY);

        ArgumentCaptor<Collection<PmTask>> captor = ArgumentCaptor.forClass(Collection.class);
        verify(scheduler).schedule(captor.capture(), eq(MONDAY));
        assertThat(captor.getValue()).extracting(PmTask::getDescription).containsExactly("b");
    }

    @Test
    void schedule_returnsTruncatedResultWithoutThrowing() {
        PmScheduleService service = new PmScheduleService(MaintenanceTaskScheduler.create(SchedulerSettings.defaults()));

        SchedulingResult result = service.schedule(
                List.of(task("a", "LINAC", 200), task("b", "LINAC", 200), task("c", "LINAC", 200)),
                PmTaskFilter.none(), MONDAY);

        assertThat(result.isTruncated()).isTrue();
        assertThat(result.getAssignments()).hasSize(2);
    }

    @Test
    void schedule_nullFilter_usesAllTasks() {
        PmScheduleService service = new PmScheduleService(MaintenanceTaskScheduler.create(SchedulerSettings.defaults()));

        SchedulingResult result = service.schedule(List.of(task("a", "LINAC", 30), task("b", "XVI", 30)), null, MONDAY);

        assertThat(result.getAssignments()).hasSize(2);
    }
}
