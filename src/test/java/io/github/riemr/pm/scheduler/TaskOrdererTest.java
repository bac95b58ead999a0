package io.github.riemr.pm.scheduler;

import io.github.riemr.pm.domain.model.PmTask;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TaskOrdererTest {

    private final TaskOrderer orderer = new TaskOrderer();

    private static PmTask task(String desc, String system, int interval, int duration) {
        return PmTask.builder().description(desc).system(system).intervalMonths(interval).durationMinutes(duration).build();
    }

    @Test
    void order_sortsBySystemThenIntervalThenLongestFirst() {
        List<PmTask> input = List.of(
                task("xvi-12m", "XVI", 12, 30),
                task("linac-6m-short", "LINAC", 6, 15),
                task("linac-1m", "LINAC", 1, 10),
                task("linac-6m-long", "LINAC", 6, 90),
                task("couch-3m", "COUCH", 3, 20));

        List<PmTask> ordered = orderer.order(input);

        assertThat(ordered).extracting(PmTask::getDescription)
                .containsExactly("couch-3m", "linac-1m", "linac-6m-long", "linac-6m-short", "xvi-12m");
    }

    @Test
    void order_keepsInputOrderForFullTies() {
        List<PmTask> input = List.of(
                task("first", "LINAC", 6, 30),
                task("second", "LINAC", 6, 30),
                task("third", "LINAC", 6, 30));

        assertThat(orderer.order(input)).extracting(PmTask::getDescription)
                .containsExactly("first", "second", "third");
    }

    @Test
    void order_doesNotMutateInput() {
        List<PmTask> input = new ArrayList<>(List.of(task("b", "B", 1, 1), task("a", "A", 1, 1)));

        orderer.order(input);

        assertThat(input).extracting(PmTask::getDescription).containsExactly("b", "a");
    }

    @Test
    void order_emptyInput_returnsEmpty() {
        assertThat(orderer.order(List.of())).isEmpty();
    }
}
