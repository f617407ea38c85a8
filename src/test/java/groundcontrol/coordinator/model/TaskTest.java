package groundcontrol.coordinator.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    @Test
    void builderDefaults() {
        Task task = Task.builder().id("t1").runId("run-1").title("work").build();

        assertEquals(TaskStatus.PENDING, task.status());
        assertEquals("", task.description());
        assertEquals(0, task.priority());
        assertTrue(task.dependencies().isEmpty());
        assertFalse(task.isTerminal());
    }

    @Test
    void dependenciesAreCopied() {
        List<String> deps = new ArrayList<>(List.of("a"));
        Task task = Task.builder().id("t1").runId("run-1").title("work").dependencies(deps).build();

        deps.add("b");

        assertEquals(List.of("a"), task.dependencies());
        assertThrows(UnsupportedOperationException.class, () -> task.dependencies().add("c"));
    }

    @Test
    void requiredFields() {
        assertThrows(NullPointerException.class, () -> Task.builder().runId("r").title("x").build());
        assertThrows(NullPointerException.class, () -> Task.builder().id("t").title("x").build());
    }

    @Test
    void statusClassification() {
        assertTrue(TaskStatus.COMPLETED.isTerminal());
        assertTrue(TaskStatus.FAILED.isTerminal());
        assertTrue(TaskStatus.SKIPPED.isTerminal());
        assertFalse(TaskStatus.QUEUED.isTerminal());
        assertTrue(TaskStatus.QUEUED.isInFlight());
        assertTrue(TaskStatus.RUNNING.isInFlight());
        assertFalse(TaskStatus.PENDING.isInFlight());
    }

    @Test
    void equalityById() {
        Task a = Task.builder().id("t1").runId("run-1").title("one").build();
        Task b = a.toBuilder().title("renamed").status(TaskStatus.RUNNING).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
