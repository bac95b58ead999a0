package io.github.riemr.pm.domain.model;

import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * 作業を受け入れ可能な平日。
 */
@Value
public class CandidateDay {
    LocalDate date;

    public CandidateDay(LocalDate date) {
        if (date.getDayOfWeek() == DayOfWeek.SATURDAY || date.getDayOfWeek() == DayOfWeek.SUNDAY) {
            throw new IllegalArgumentException("Candidate day must be a weekday: " + date);
        }
        this.date = date;
    }
}
