package io.github.riemr.pm.config;

import io.github.riemr.pm.scheduler.MaintenanceTaskScheduler;
import io.github.riemr.pm.scheduler.SchedulerSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.LocalTime;

@Configuration
@Slf4j
public class SchedulerConfig {

    @Value("${pm.scheduler.daily-capacity-minutes:300}")
    private int dailyCapacityMinutes;

    @Value("${pm.scheduler.day-start:16:00}")
    private String dayStart;

    @Value("${pm.scheduler.max-candidate-days:60}")
    private int maxCandidateDays;

    @Value("${pm.scheduler.max-lookahead-days:90}")
    private int maxLookaheadDays;

    @Bean
    public SchedulerSettings schedulerSettings() {
        SchedulerSettings settings = new SchedulerSettings(
                dailyCapacityMinutes, LocalTime.parse(dayStart), maxCandidateDays, maxLookaheadDays);
        log.info("PM scheduler configured: {}", settings);
        return settings;
    }

    @Bean
    public MaintenanceTaskScheduler maintenanceTaskScheduler(SchedulerSettings settings) {
        return MaintenanceTaskScheduler.create(settings);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
