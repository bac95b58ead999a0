package io.github.riemr.pm.presentation.controller;

import io.github.riemr.pm.application.exception.TaskCsvFormatException;
import io.github.riemr.pm.application.service.DailyAgendaService;
import io.github.riemr.pm.application.service.PmScheduleService;
import io.github.riemr.pm.application.service.PmTaskCsvImportService;
import io.github.riemr.pm.application.service.PmTaskFilter;
import io.github.riemr.pm.domain.model.PmTask;
import io.github.riemr.pm.domain.model.SchedulingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

@Controller
@RequestMapping("/pm/agenda")
@RequiredArgsConstructor
@Slf4j
public class AgendaPageController {

    private final PmTaskCsvImportService importService;
    private final PmScheduleService scheduleService;
    private final DailyAgendaService agendaService;

    @GetMapping
    public String view() {
        return "pm/agenda";
    }

    /**
     * 画面からの投稿なので、入力不備も JSON ではなく画面上のメッセージで返す。
     */
    @PostMapping
    public String upload(@RequestParam(name = "file", required = false) MultipartFile file,
                         @RequestParam(name = "startDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
                         @RequestParam(name = "systems", required = false) List<String> systems,
                         Model model) {
        model.addAttribute("startDate", startDate);
        if (startDate == null) {
            return failure(model, "Start date is required");
        }
        if (file == null || file.isEmpty()) {
            return failure(model, "Task file is required");
        }
        try {
            List<PmTask> tasks = importService.readTasks(file.getInputStream());
            SchedulingResult result = scheduleService.schedule(tasks, PmTaskFilter.of(null, systems, null), startDate);
            model.addAttribute("agenda", agendaService.build(result));
            model.addAttribute("truncated", result.isTruncated());
            model.addAttribute("unscheduledTaskCount", result.getUnscheduledTaskCount());
            model.addAttribute("success", true);
        } catch (IOException | TaskCsvFormatException e) {
            log.warn("Agenda upload failed: {}", e.getMessage());
            return failure(model, "Failed to read task file: " + e.getMessage());
        }
        return "pm/agenda";
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public String handleTypeMismatch(MethodArgumentTypeMismatchException e, Model model) {
        log.warn("Agenda upload rejected: invalid {}", e.getName());
        return failure(model, "Invalid value for " + e.getName());
    }

    private String failure(Model model, String message) {
        model.addAttribute("message", message);
        model.addAttribute("success", false);
        return "pm/agenda";
    }
}
