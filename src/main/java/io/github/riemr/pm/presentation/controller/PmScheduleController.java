package io.github.riemr.pm.presentation.controller;

import io.github.riemr.pm.application.dto.ScheduleRequest;
import io.github.riemr.pm.application.dto.ScheduleResponse;
import io.github.riemr.pm.application.dto.WorkloadAnalysisResponse;
import io.github.riemr.pm.application.export.ScheduleCsvExporter;
import io.github.riemr.pm.application.export.ScheduleIcsExporter;
import io.github.riemr.pm.application.service.PmScheduleService;
import io.github.riemr.pm.application.service.PmTaskCsvImportService;
import io.github.riemr.pm.application.service.PmTaskFilter;
import io.github.riemr.pm.application.service.PmWorkloadAnalysisService;
import io.github.riemr.pm.domain.model.PmTask;
import io.github.riemr.pm.domain.model.SchedulingResult;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/pm")
@RequiredArgsConstructor
public class PmScheduleController {

    private final PmTaskCsvImportService importService;
    private final PmScheduleService scheduleService;
    private final PmWorkloadAnalysisService analysisService;
    private final ScheduleCsvExporter csvExporter;
    private final ScheduleIcsExporter icsExporter;

    @PostMapping(path = "/schedule", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> schedule(@RequestBody ScheduleRequest req) {
        if (req.getStartDate() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "startDate is required"));
        }
        if (req.getTasks() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "tasks is required"));
        }
        List<PmTask> tasks = req.getTasks().stream().map(ScheduleRequest.TaskItem::toTask).toList();
        PmTaskFilter filter = PmTaskFilter.of(req.getIntervals(), req.getSystems(), req.getCategories());
        SchedulingResult result = scheduleService.schedule(tasks, filter, req.getStartDate());
        return ResponseEntity.ok(ScheduleResponse.from(result));
    }

    @PostMapping(path = "/schedule/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ScheduleResponse scheduleUpload(@RequestParam("file") MultipartFile file,
                                           @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
                                           @RequestParam(name = "intervals", required = false) List<Integer> intervals,
                                           @RequestParam(name = "systems", required = false) List<String> systems,
                                           @RequestParam(name = "categories", required = false) List<String> categories) throws IOException {
        return ScheduleResponse.from(scheduleFromUpload(file, startDate, intervals, systems, categories));
    }

    @PostMapping(path = "/schedule/export/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public void exportCsv(@RequestParam("file") MultipartFile file,
                          @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
                          @RequestParam(name = "intervals", required = false) List<Integer> intervals,
                          @RequestParam(name = "systems", required = false) List<String> systems,
                          @RequestParam(name = "categories", required = false) List<String> categories,
                          HttpServletResponse response) throws IOException {
        SchedulingResult result = scheduleFromUpload(file, startDate, intervals, systems, categories);
        response.setContentType("text/csv; charset=UTF-8");
        response.setHeader("Content-Disposition", "attachment; filename=pm_schedule.csv");
        csvExporter.write(result, response.getWriter());
    }

    @PostMapping(path = "/schedule/export/ics", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public void exportIcs(@RequestParam("file") MultipartFile file,
                          @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
                          @RequestParam(name = "intervals", required = false) List<Integer> intervals,
                          @RequestParam(name = "systems", required = false) List<String> systems,
                          @RequestParam(name = "categories", required = false) List<String> categories,
                          HttpServletResponse response) throws IOException {
        SchedulingResult result = scheduleFromUpload(file, startDate, intervals, systems, categories);
        response.setContentType("text/calendar; charset=UTF-8");
        response.setHeader("Content-Disposition", "attachment; filename=pm_schedule.ics");
        icsExporter.write(result, response.getWriter());
    }

    @PostMapping(path = "/analysis", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public WorkloadAnalysisResponse analyze(@RequestParam("file") MultipartFile file,
                                            @RequestParam(name = "intervals", required = false) List<Integer> intervals,
                                            @RequestParam(name = "systems", required = false) List<String> systems,
                                            @RequestParam(name = "categories", required = false) List<String> categories) throws IOException {
        List<PmTask> tasks = importService.readTasks(file.getInputStream());
        return analysisService.analyze(PmTaskFilter.of(intervals, systems, categories).apply(tasks));
    }

    private SchedulingResult scheduleFromUpload(MultipartFile file, LocalDate startDate,
                                                List<Integer> intervals, List<String> systems, List<String> categories) throws IOException {
        List<PmTask> tasks = importService.readTasks(file.getInputStream());
        return scheduleService.schedule(tasks, PmTaskFilter.of(intervals, systems, categories), startDate);
    }
}
