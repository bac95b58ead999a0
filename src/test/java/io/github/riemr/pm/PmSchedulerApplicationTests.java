package io.github.riemr.pm;

import io.github.riemr.pm.domain.model.PmTask;
import io.github.riemr.pm.domain.model.SchedulingResult;
import io.github.riemr.pm.scheduler.MaintenanceTaskScheduler;
import io.github.riemr.pm.scheduler.SchedulerSettings;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "pm.scheduler.day-start=08:30")
class PmSchedulerApplicationTests {

    @Autowired
    SchedulerSettings settings;

    @Autowired
    MaintenanceTaskScheduler scheduler;

    @Test
    void contextLoads_withConfiguredSettings() {
        assertThat(settings.getDailyCapacityMinutes()).isEqualTo(300);
        assertThat(settings.getDayStart()).isEqualTo(LocalTime.of(8, 30));

        SchedulingResult result = scheduler.schedule(
                List.of(PmTask.builder().description("Check beam").system("LINAC").durationMinutes(60).build()),
                LocalDate.of(2024, 1, 1));

        assertThat(result.getAssignments().get(0).getStartTime()).isEqualTo(LocalDate.of(2024, 1, 1).atTime(8, 30));
    }
}
