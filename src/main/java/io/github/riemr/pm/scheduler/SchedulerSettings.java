package io.github.riemr.pm.scheduler;

import java.time.LocalTime;

/**
 * スケジューラの固定パラメータ。既定は 16:00 開始・1日 300 分（16:00-21:00 の作業枠）、
 * 候補平日は最大 60 日、探索は暦日で最大 90 日。
 */
public final class SchedulerSettings {

    public static final int DEFAULT_DAILY_CAPACITY_MINUTES = 300;
    public static final LocalTime DEFAULT_DAY_START = LocalTime.of(16, 0);
    public static final int DEFAULT_MAX_CANDIDATE_DAYS = 60;
    public static final int DEFAULT_MAX_LOOKAHEAD_DAYS = 90;

    private final int dailyCapacityMinutes;
    private final LocalTime dayStart;
    private final int maxCandidateDays;
    private final int maxLookaheadDays;

    public SchedulerSettings(int dailyCapacityMinutes, LocalTime dayStart, int maxCandidateDays, int maxLookaheadDays) {
        if (dailyCapacityMinutes <= 0) {
            throw new IllegalArgumentException("dailyCapacityMinutes must be positive: " + dailyCapacityMinutes);
        }
        if (dayStart == null) {
            throw new IllegalArgumentException("dayStart is required");
        }
        if (maxCandidateDays < 0 || maxLookaheadDays < 0) {
            throw new IllegalArgumentException("Invalid window: candidates=" + maxCandidateDays + ", lookahead=" + maxLookaheadDays);
        }
        this.dailyCapacityMinutes = dailyCapacityMinutes;
        this.dayStart = dayStart;
        this.maxCandidateDays = maxCandidateDays;
        this.maxLookaheadDays = maxLookaheadDays;
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(DEFAULT_DAILY_CAPACITY_MINUTES, DEFAULT_DAY_START,
                DEFAULT_MAX_CANDIDATE_DAYS, DEFAULT_MAX_LOOKAHEAD_DAYS);
    }

    public int getDailyCapacityMinutes() {
        return dailyCapacityMinutes;
    }

    public LocalTime getDayStart() {
        return dayStart;
    }

    public int getMaxCandidateDays() {
        return maxCandidateDays;
    }

    public int getMaxLookaheadDays() {
        return maxLookaheadDays;
    }

    @Override
    public String toString() {
        return "SchedulerSettings{capacity=" + dailyCapacityMinutes + "min, start=" + dayStart
                + ", candidates=" + maxCandidateDays + ", lookahead=" + maxLookaheadDays + "}";
    }
}
