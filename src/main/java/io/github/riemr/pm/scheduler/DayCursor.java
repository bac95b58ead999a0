package io.github.riemr.pm.scheduler;

import io.github.riemr.pm.domain.model.CandidateDay;

import java.util.List;

/**
 * 選定済み日付リスト上のカーソルと当日の残り容量。前方向にしか進まない（後戻りしない）。
 */
class DayCursor {

    private final List<CandidateDay> days;
    private final int dailyCapacityMinutes;
    private int index;
    private int remainingMinutes;
    private int placedToday;

    DayCursor(List<CandidateDay> days, int dailyCapacityMinutes) {
        this.days = List.copyOf(days);
        this.dailyCapacityMinutes = dailyCapacityMinutes;
        this.index = 0;
        this.remainingMinutes = days.isEmpty() ? 0 : dailyCapacityMinutes;
    }

    boolean hasDay() {
        return index < days.size();
    }

    CandidateDay current() {
        if (!hasDay()) {
            throw new IllegalStateException("No scheduling day available");
        }
        return days.get(index);
    }

    int remainingMinutes() {
        return remainingMinutes;
    }

    int elapsedMinutes() {
        return dailyCapacityMinutes - remainingMinutes;
    }

    /** 当日にまだ1件も配置していない */
    boolean isFresh() {
        return placedToday == 0;
    }

    /**
     * 次の日付へ進め、容量を満タンに戻す。次がなければ false（カーソルは末尾を越えた状態になる）。
     */
    boolean advance() {
        if (!hasDay()) {
            return false;
        }
        index++;
        placedToday = 0;
        if (!hasDay()) {
            remainingMinutes = 0;
            return false;
        }
        remainingMinutes = dailyCapacityMinutes;
        return true;
    }

    void consume(int minutes) {
        remainingMinutes -= minutes;
        placedToday++;
    }
}
