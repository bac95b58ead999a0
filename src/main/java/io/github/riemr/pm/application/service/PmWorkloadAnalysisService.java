package io.github.riemr.pm.application.service;

import io.github.riemr.pm.application.dto.MonthlyWorkload;
import io.github.riemr.pm.application.dto.SystemBurden;
import io.github.riemr.pm.application.dto.WorkloadAnalysisResponse;
import io.github.riemr.pm.application.dto.WorkloadSummary;
import io.github.riemr.pm.domain.model.PmTask;
import org.springframework.stereotype.Service;

import java.time.Month;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public class PmWorkloadAnalysisService {

    public WorkloadAnalysisResponse analyze(List<PmTask> tasks) {
        return new WorkloadAnalysisResponse(summarize(tasks), burdenBySystem(tasks), annualWorkload(tasks));
    }

    public WorkloadSummary summarize(List<PmTask> tasks) {
        long totalMinutes = tasks.stream().mapToLong(PmTask::getDurationMinutes).sum();
        int systems = (int) tasks.stream().map(PmTask::getSystem).distinct().count();
        return new WorkloadSummary(tasks.size(), totalMinutes / 60.0, systems);
    }

    /**
     * System ごとの保守負荷。平均周期が 0 の System は負荷 0 として残す。
     */
    public List<SystemBurden> burdenBySystem(List<PmTask> tasks) {
        Map<String, long[]> acc = new LinkedHashMap<>(); // [0]=所要合計, [1]=周期合計, [2]=件数
        for (PmTask t : tasks) {
            long[] a = acc.computeIfAbsent(t.getSystem(), k -> new long[3]);
            a[0] += t.getDurationMinutes();
            a[1] += t.getIntervalMonths();
            a[2]++;
        }
        List<SystemBurden> res = new ArrayList<>();
        for (var e : acc.entrySet()) {
            long[] a = e.getValue();
            double avgInterval = (double) a[1] / a[2];
            double score = avgInterval == 0 ? 0 : a[0] / avgInterval;
            res.add(new SystemBurden(e.getKey(), a[0], avgInterval, score));
        }
        res.sort(Comparator.comparingDouble(SystemBurden::burdenScore).reversed());
        return res;
    }

    /**
     * 年間の月別作業時間。周期 N ヶ月の作業は 1月, 1+N月, 1+2N月 ... に計上する。
     */
    public List<MonthlyWorkload> annualWorkload(List<PmTask> tasks) {
        double[] hours = new double[12];
        for (PmTask t : tasks) {
            int interval = t.getIntervalMonths();
            if (interval <= 0) continue;
            for (int m = 1; m <= 12; m += interval) {
                hours[m - 1] += t.getDurationMinutes() / 60.0;
            }
        }
        List<MonthlyWorkload> res = new ArrayList<>(12);
        for (int m = 1; m <= 12; m++) {
            res.add(new MonthlyWorkload(Month.of(m).getDisplayName(TextStyle.SHORT, Locale.ENGLISH), hours[m - 1]));
        }
        return res;
    }
}
