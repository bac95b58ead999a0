package io.github.riemr.pm.presentation.controller;

import io.github.riemr.pm.application.dto.AgendaEntry;
import io.github.riemr.pm.application.dto.DailyAgenda;
import io.github.riemr.pm.application.exception.TaskCsvFormatException;
import io.github.riemr.pm.application.service.DailyAgendaService;
import io.github.riemr.pm.application.service.PmScheduleService;
import io.github.riemr.pm.application.service.PmTaskCsvImportService;
import io.github.riemr.pm.domain.model.SchedulingResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = AgendaPageController.class)
@AutoConfigureMockMvc(addFilters = false)
class AgendaPageControllerTest {

    @SpringBootConfiguration
    @Import({AgendaPageController.class, GlobalExceptionHandler.class})
    static class TestApplication {}

    private static final LocalDate MONDAY = LocalDate.of(2024, 1, 1);

    @Autowired
    MockMvc mockMvc;

    @MockBean
    PmTaskCsvImportService importService;

    @MockBean
    PmScheduleService scheduleService;

    @MockBean
    DailyAgendaService agendaService;

    private final MockMultipartFile file = new MockMultipartFile("file", "tasks.csv", "text/csv", "x".getBytes());

    @BeforeEach
    void setup() {
        Mockito.reset(importService, scheduleService, agendaService);
    }

    @Test
    void view_rendersUploadForm() throws Exception {
        mockMvc.perform(get("/pm/agenda"))
                .andExpect(status().isOk())
                .andExpect(view().name("pm/agenda"));
    }

    @Test
    void upload_rendersAgendaWithTruncationWarning() throws Exception {
        SchedulingResult result = new SchedulingResult(List.of(), true, 2);
        when(importService.readTasks(any())).thenReturn(List.of());
        when(scheduleService.schedule(any(), any(), eq(MONDAY))).thenReturn(result);
        when(agendaService.build(result)).thenReturn(List.of(new DailyAgenda(MONDAY, "Monday, January 01, 2024",
                List.of(new AgendaEntry("04:00 PM", "06:00 PM", 120, "LINAC", "Check beam", "N/A")))));

        mockMvc.perform(multipart("/pm/agenda").file(file).param("startDate", "2024-01-01"))
                .andExpect(status().isOk())
                .andExpect(view().name("pm/agenda"))
                .andExpect(model().attribute("truncated", true))
                .andExpect(model().attribute("unscheduledTaskCount", 2))
                .andExpect(content().string(containsString("Monday, January 01, 2024")))
                .andExpect(content().string(containsString("04:00 PM - 06:00 PM (120 mins)")))
                .andExpect(content().string(containsString("2 task(s) were not scheduled")));
    }

    @Test
    void upload_showsMessageWhenCsvIsInvalid() throws Exception {
        when(importService.readTasks(any())).thenThrow(new TaskCsvFormatException("CSV has no header row"));

        mockMvc.perform(multipart("/pm/agenda").file(file).param("startDate", "2024-01-01"))
                .andExpect(status().isOk())
                .andExpect(model().attribute("success", false))
                .andExpect(content().string(containsString("CSV has no header row")));
        verifyNoInteractions(scheduleService);
    }

    @Test
    void upload_withoutStartDate_rendersPageWithMessage() throws Exception {
        mockMvc.perform(multipart("/pm/agenda").file(file))
                .andExpect(status().isOk())
                .andExpect(view().name("pm/agenda"))
                .andExpect(model().attribute("success", false))
                .andExpect(content().string(containsString("Start date is required")));
        verifyNoInteractions(importService, scheduleService);
    }

    @Test
    void upload_withMalformedStartDate_rendersPageWithMessage() throws Exception {
        mockMvc.perform(multipart("/pm/agenda").file(file).param("startDate", "01/02/2024"))
                .andExpect(status().isOk())
                .andExpect(view().name("pm/agenda"))
                .andExpect(content().string(containsString("Invalid value for startDate")));
        verifyNoInteractions(importService, scheduleService);
    }

    @Test
    void upload_withoutFile_rendersPageWithMessage() throws Exception {
        mockMvc.perform(multipart("/pm/agenda").param("startDate", "2024-01-01"))
                .andExpect(status().isOk())
                .andExpect(model().attribute("success", false))
                .andExpect(content().string(containsString("Task file is required")));
        verifyNoInteractions(importService, scheduleService);
    }
}
