package groundcontrol.coordinator.store;

import groundcontrol.coordinator.config.CoordinatorConfig;
import groundcontrol.coordinator.model.Run;
import groundcontrol.coordinator.model.Task;
import groundcontrol.coordinator.model.TaskStatus;
import groundcontrol.coordinator.repository.DuplicateKeyException;
import groundcontrol.coordinator.repository.NotFoundException;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTaskRepositoryTest {

    private static Database db;
    private static JdbcRunRepository runs;
    private static JdbcTaskRepository repo;

    @BeforeAll
    static void setup() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-tasks;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        runs = new JdbcRunRepository(db);
        repo = new JdbcTaskRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTasks() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM agent_executions");
            st.execute("DELETE FROM task_logs");
            st.execute("DELETE FROM tasks");
            st.execute("DELETE FROM runs");
            conn.commit();
        }
        runs.save(Run.builder().id("run-1").projectName("shop").build());
    }

    @Test
    void saveAndFindById() {
        repo.save(Task.builder()
                .id("task-1")
                .runId("run-1")
                .ticketId("T-7")
                .title("Add login form")
                .description("Email and password")
                .assignedAgent("developer")
                .priority(5)
                .dependsOn("task-0")
                .build());

        Optional<Task> found = repo.findById("task-1");
        assertTrue(found.isPresent());
        Task task = found.get();
        assertEquals("run-1", task.runId());
        assertEquals("T-7", task.ticketId());
        assertEquals("Add login form", task.title());
        assertEquals("Email and password", task.description());
        assertEquals("developer", task.assignedAgent());
        assertEquals(TaskStatus.PENDING, task.status());
        assertEquals(5, task.priority());
        assertEquals(List.of("task-0"), task.dependencies());
        assertNull(task.result());
        assertNotNull(task.createdAt());
    }

    @Test
    void duplicateIdIsRejected() {
        repo.save(Task.builder().id("t1").runId("run-1").title("first").build());

        assertThrows(DuplicateKeyException.class,
                () -> repo.save(Task.builder().id("t1").runId("run-1").title("again").build()));
    }

    @Test
    void saveForUnknownRunThrowsNotFound() {
        NotFoundException e = assertThrows(NotFoundException.class,
                () -> repo.save(Task.builder().id("t1").runId("ghost").title("orphan").build()));
        assertTrue(e.getMessage().contains("ghost"));
    }

    @Test
    void findByRunIdOrdersByPriorityThenCreation() {
        Instant t0 = Instant.parse("2026-01-01T10:00:00Z");
        repo.save(Task.builder().id("low").runId("run-1").title("low").priority(1).createdAt(t0).build());
        repo.save(Task.builder().id("high-late").runId("run-1").title("high late").priority(9)
                .createdAt(t0.plusSeconds(5)).build());
        repo.save(Task.builder().id("high-early").runId("run-1").title("high early").priority(9)
                .createdAt(t0).build());

        List<String> ids = repo.findByRunId("run-1").stream().map(Task::id).toList();
        assertEquals(List.of("high-early", "high-late", "low"), ids);
    }

    @Test
    void sameTimestampFallsBackToInsertionOrder() {
        Instant t0 = Instant.parse("2026-01-01T10:00:00Z");
        for (String id : List.of("c", "a", "b")) {
            repo.save(Task.builder().id(id).runId("run-1").title(id).createdAt(t0).build());
        }

        List<String> ids = repo.findByRunId("run-1").stream().map(Task::id).toList();
        assertEquals(List.of("c", "a", "b"), ids);
    }

    @Test
    void updateStatusKeepsResultWhenNull() {
        repo.save(Task.builder().id("t1").runId("run-1").title("work").build());

        assertTrue(repo.updateStatus("t1", TaskStatus.RUNNING, null));
        assertTrue(repo.updateStatus("t1", TaskStatus.COMPLETED, "done"));

        Task task = repo.findById("t1").orElseThrow();
        assertEquals(TaskStatus.COMPLETED, task.status());
        assertEquals("done", task.result());
    }

    @Test
    void terminalStatusIsNeverLeft() {
        repo.save(Task.builder().id("t1").runId("run-1").title("work").build());
        repo.updateStatus("t1", TaskStatus.FAILED, "boom");

        assertFalse(repo.updateStatus("t1", TaskStatus.RUNNING, null));
        assertFalse(repo.updateStatus("t1", TaskStatus.COMPLETED, "late success"));

        Task task = repo.findById("t1").orElseThrow();
        assertEquals(TaskStatus.FAILED, task.status());
        assertEquals("boom", task.result());
    }

    @Test
    void updateStatusUnknownTaskThrows() {
        assertThrows(NotFoundException.class, () -> repo.updateStatus("ghost", TaskStatus.RUNNING, null));
    }
}
