package io.github.riemr.pm.scheduler;

import io.github.riemr.pm.domain.model.CandidateDay;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 開始日（当日含む）から1日ずつ進め、平日のみを候補日として集める。
 * 候補が maxCandidateDays 件に達するか、暦日で maxLookaheadDays 日を調べ終えた時点で終了。
 */
public class CalendarWindowBuilder {

    private final int maxCandidateDays;
    private final int maxLookaheadDays;

    public CalendarWindowBuilder(SchedulerSettings settings) {
        this.maxCandidateDays = settings.getMaxCandidateDays();
        this.maxLookaheadDays = settings.getMaxLookaheadDays();
    }

    public List<CandidateDay> build(LocalDate startDate) {
        Objects.requireNonNull(startDate, "startDate");
        List<CandidateDay> days = new ArrayList<>();
        for (int i = 0; i < maxLookaheadDays; i++) {
            if (days.size() >= maxCandidateDays) {
                break;
            }
            LocalDate d = startDate.plusDays(i);
            if (isWeekday(d)) {
                days.add(new CandidateDay(d));
            }
        }
        return List.copyOf(days);
    }

    static boolean isWeekday(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
    }
}
