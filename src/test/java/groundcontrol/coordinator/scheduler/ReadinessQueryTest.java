package groundcontrol.coordinator.scheduler;

import groundcontrol.coordinator.model.Task;
import groundcontrol.coordinator.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReadinessQueryTest {

    private static Task task(String id, TaskStatus status, String... deps) {
        return Task.builder().id(id).runId("run-1").title(id).status(status).dependsOn(deps).build();
    }

    private static List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::id).toList();
    }

    @Test
    void pendingWithoutDependenciesIsReady() {
        List<Task> snapshot = List.of(
                task("a", TaskStatus.PENDING),
                task("b", TaskStatus.RUNNING),
                task("c", TaskStatus.COMPLETED));

        assertEquals(List.of("a"), ids(ReadinessQuery.readyTasks(snapshot)));
    }

    @Test
    void readyOnlyWhenAllDependenciesCompleted() {
        List<Task> snapshot = List.of(
                task("a", TaskStatus.COMPLETED),
                task("b", TaskStatus.RUNNING),
                task("c", TaskStatus.PENDING, "a"),
                task("d", TaskStatus.PENDING, "a", "b"));

        assertEquals(List.of("c"), ids(ReadinessQuery.readyTasks(snapshot)));
    }

    @Test
    void failedSkippedOrUnknownDependencyNeverSatisfies() {
        List<Task> snapshot = List.of(
                task("x", TaskStatus.FAILED),
                task("s", TaskStatus.SKIPPED),
                task("y", TaskStatus.PENDING, "x"),
                task("z", TaskStatus.PENDING, "s"),
                task("w", TaskStatus.PENDING, "missing"));

        assertTrue(ReadinessQuery.readyTasks(snapshot).isEmpty());
    }

    @Test
    void keepsSnapshotOrder() {
        List<Task> snapshot = List.of(
                task("p9", TaskStatus.PENDING),
                task("p5", TaskStatus.PENDING),
                task("p1", TaskStatus.PENDING));

        assertEquals(List.of("p9", "p5", "p1"), ids(ReadinessQuery.readyTasks(snapshot)));
    }

    @Test
    void cycleStarves() {
        List<Task> snapshot = List.of(
                task("a", TaskStatus.PENDING, "b"),
                task("b", TaskStatus.PENDING, "a"));

        assertTrue(ReadinessQuery.readyTasks(snapshot).isEmpty());
    }

    @Test
    void inFlightMeansQueuedOrRunning() {
        assertTrue(ReadinessQuery.hasInFlight(List.of(task("a", TaskStatus.QUEUED))));
        assertTrue(ReadinessQuery.hasInFlight(List.of(task("a", TaskStatus.RUNNING))));
        assertFalse(ReadinessQuery.hasInFlight(List.of(
                task("a", TaskStatus.PENDING),
                task("b", TaskStatus.COMPLETED),
                task("c", TaskStatus.FAILED))));
    }
}
