package io.github.riemr.pm.application.dto;

import io.github.riemr.pm.domain.model.PmTask;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.LocalDate;
import java.util.List;

@Data
@NoArgsConstructor
public class ScheduleRequest {

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate startDate;
    private List<TaskItem> tasks;
    private List<Integer> intervals;
    private List<String> systems;
    private List<String> categories;

    @Data
    @NoArgsConstructor
    public static class TaskItem {
        private String description;
        private String system;
        private Integer durationMinutes;
        private Integer intervalMonths;
        private String category;
        private String referencePage;

        public PmTask toTask() {
            return PmTask.builder()
                    .description(description)
                    .system(system)
                    .durationMinutes(durationMinutes == null ? 0 : durationMinutes)
                    .intervalMonths(intervalMonths == null ? 0 : intervalMonths)
                    .category(category)
                    .referencePage(referencePage)
                    .build();
        }
    }
}
