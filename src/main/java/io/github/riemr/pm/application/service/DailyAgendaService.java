package io.github.riemr.pm.application.service;

import io.github.riemr.pm.application.dto.AgendaEntry;
import io.github.riemr.pm.application.dto.DailyAgenda;
import io.github.riemr.pm.domain.model.ScheduledAssignment;
import io.github.riemr.pm.domain.model.SchedulingResult;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * 割当を日付ごとにまとめた日次アジェンダ。日内は配置順（開始時刻順）のまま。
 */
@Service
public class DailyAgendaService {

    private static final DateTimeFormatter HEADING = DateTimeFormatter.ofPattern("EEEE, MMMM dd, yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("hh:mm a", Locale.ENGLISH);
    static final String NO_PAGE = "N/A";

    public List<DailyAgenda> build(SchedulingResult result) {
        Map<LocalDate, List<AgendaEntry>> byDate = new TreeMap<>();
        for (ScheduledAssignment a : result.getAssignments()) {
            byDate.computeIfAbsent(a.getDate(), k -> new ArrayList<>()).add(new AgendaEntry(
                    a.getStartTime().format(TIME),
                    a.getEndTime().format(TIME),
                    a.getDurationMinutes(),
                    a.getSystem(),
                    a.getDescription(),
                    a.getReferencePage() == null ? NO_PAGE : a.getReferencePage()));
        }
        List<DailyAgenda> days = new ArrayList<>(byDate.size());
        for (var e : byDate.entrySet()) {
            days.add(new DailyAgenda(e.getKey(), e.getKey().format(HEADING), List.copyOf(e.getValue())));
        }
        return days;
    }
}
