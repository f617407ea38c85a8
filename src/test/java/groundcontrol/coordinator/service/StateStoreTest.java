package groundcontrol.coordinator.service;

import groundcontrol.coordinator.model.*;
import groundcontrol.coordinator.repository.DuplicateKeyException;
import groundcontrol.coordinator.repository.NotFoundException;
import groundcontrol.coordinator.store.Database;
import groundcontrol.coordinator.store.JdbcExecutionRepository;
import groundcontrol.coordinator.store.JdbcRunRepository;
import groundcontrol.coordinator.store.JdbcTaskLogRepository;
import groundcontrol.coordinator.store.JdbcTaskRepository;
import groundcontrol.coordinator.store.JsonColumns;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StateStoreTest {

    private static Database db;
    private static StateStore store;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-state-store;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 5);
        store = new StateStore(new JdbcRunRepository(db), new JdbcTaskRepository(db),
                new JdbcTaskLogRepository(db), new JdbcExecutionRepository(db));
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM agent_executions");
            st.execute("DELETE FROM task_logs");
            st.execute("DELETE FROM tasks");
            st.execute("DELETE FROM runs");
            conn.commit();
        }
    }

    @Test
    void createRunStoresConfigSnapshotAsJson() {
        Run run = store.createRun("run-1", "shop", Map.of("maxParallel", 3));

        assertEquals(RunStatus.PENDING, run.status());
        assertEquals(3, JsonColumns.readMap(run.configSnapshot()).get("maxParallel"));
    }

    @Test
    void createRunRejectsBlankIds() {
        assertThrows(IllegalArgumentException.class, () -> store.createRun(" ", "shop", null));
        assertThrows(IllegalArgumentException.class, () -> store.createRun("run-1", "", null));
    }

    @Test
    void duplicateRunIsRejected() {
        store.createRun("run-1", "shop", null);
        assertThrows(DuplicateKeyException.class, () -> store.createRun("run-1", "shop", null));
    }

    @Test
    void listRunsDefaultsToTwentyNewest() {
        for (int i = 0; i < 25; i++) {
            store.createRun("run-" + i, i % 2 == 0 ? "shop" : "blog", null);
        }

        assertEquals(StateStore.DEFAULT_RUN_LIMIT, store.listRuns().size());
        assertEquals(13, store.listRuns("shop", 50).size());
    }

    @Test
    void createTaskIsAlwaysPending() {
        store.createRun("run-1", "shop", null);

        Task created = store.createTask(Task.builder()
                .id("t1")
                .runId("run-1")
                .title("Write README")
                .status(TaskStatus.COMPLETED)
                .result("pretend")
                .build());

        assertEquals(TaskStatus.PENDING, created.status());
        assertNull(created.result());
        assertNotNull(created.createdAt());
    }

    @Test
    void createTaskForUnknownRunFails() {
        assertThrows(NotFoundException.class, () -> store.createTask("t1", "ghost", "orphan", ""));
    }

    @Test
    void terminalStatusIsIdempotent() {
        store.createRun("run-1", "shop", null);
        store.createTask("t1", "run-1", "work", "");

        assertTrue(store.setTaskStatus("t1", TaskStatus.COMPLETED, "ok"));
        assertFalse(store.setTaskStatus("t1", TaskStatus.FAILED, "late"));

        Task task = store.getTask("t1").orElseThrow();
        assertEquals(TaskStatus.COMPLETED, task.status());
        assertEquals("ok", task.result());
    }

    @Test
    void setStatusOfUnknownTaskFails() {
        assertThrows(NotFoundException.class, () -> store.setTaskStatus("ghost", TaskStatus.RUNNING));
    }

    @Test
    void readyTasksFollowDependencies() {
        store.createRun("run-1", "shop", null);
        store.createTask(Task.builder().id("a").runId("run-1").title("a").build());
        store.createTask(Task.builder().id("b").runId("run-1").title("b").dependsOn("a").build());

        assertEquals(List.of("a"), store.readyTasks("run-1").stream().map(Task::id).toList());

        store.setTaskStatus("a", TaskStatus.COMPLETED, "ok");
        assertEquals(List.of("b"), store.readyTasks("run-1").stream().map(Task::id).toList());
    }

    @Test
    void logsAndExecutionsAreRecorded() {
        store.createRun("run-1", "shop", null);
        store.createTask("t1", "run-1", "work", "");

        store.appendLog("t1", "hello");
        store.appendLog("t1", "bad", LogLevel.ERROR, "developer", Map.of("k", "v"));

        List<TaskLog> logs = store.getLogs("t1");
        assertEquals(2, logs.size());
        assertEquals(LogLevel.INFO, logs.get(0).level());
        assertEquals("v", logs.get(1).metadata().get("k"));

        long id = store.createExecution("t1", "run-1", "developer", "claude_code");
        store.finishExecution(id, ExecutionStatus.COMPLETED, "out", null, null);

        Execution execution = store.getExecution(id).orElseThrow();
        assertEquals(ExecutionStatus.COMPLETED, execution.status());
        assertEquals(1, store.listExecutions("run-1").size());
        assertEquals(1, store.listTaskExecutions("t1").size());
    }

    @Test
    void summaryCountsEveryStatus() {
        store.createRun("run-1", "shop", null);
        for (String id : List.of("a", "b", "c", "d")) {
            store.createTask(id, "run-1", id, "");
        }
        store.setTaskStatus("a", TaskStatus.COMPLETED, "ok");
        store.setTaskStatus("b", TaskStatus.COMPLETED, "ok");
        store.setTaskStatus("c", TaskStatus.FAILED, "boom");

        RunSummary summary = store.runSummary("run-1");

        assertEquals("run-1", summary.run().id());
        assertEquals(4, summary.totalTasks());
        assertEquals(Map.of(TaskStatus.COMPLETED, 2, TaskStatus.FAILED, 1, TaskStatus.PENDING, 1),
                summary.statusCounts());
        assertEquals(0, summary.count(TaskStatus.RUNNING));
    }

    @Test
    void summaryOfUnknownRunIsEmpty() {
        RunSummary summary = store.runSummary("ghost");

        assertNull(summary.run());
        assertEquals(0, summary.totalTasks());
        assertTrue(summary.statusCounts().isEmpty());
    }
}
