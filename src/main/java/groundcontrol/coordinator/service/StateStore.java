package groundcontrol.coordinator.service;

import groundcontrol.coordinator.model.*;
import groundcontrol.coordinator.repository.ExecutionRepository;
import groundcontrol.coordinator.repository.RunRepository;
import groundcontrol.coordinator.repository.TaskLogRepository;
import groundcontrol.coordinator.repository.TaskRepository;
import groundcontrol.coordinator.scheduler.ReadinessQuery;
import groundcontrol.coordinator.store.JsonColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable state store for runs, tasks, logs and executions.
 *
 * <p>Every write is committed before the method returns, so a readiness query
 * issued afterwards always observes it. The store does not check run status
 * transitions; task statuses never leave a terminal state.
 */
public class StateStore {

    private static final Logger log = LoggerFactory.getLogger(StateStore.class);

    public static final int DEFAULT_RUN_LIMIT = 20;

    private final RunRepository runRepository;
    private final TaskRepository taskRepository;
    private final TaskLogRepository logRepository;
    private final ExecutionRepository executionRepository;

    public StateStore(RunRepository runRepository, TaskRepository taskRepository,
            TaskLogRepository logRepository, ExecutionRepository executionRepository) {
        this.runRepository = runRepository;
        this.taskRepository = taskRepository;
        this.logRepository = logRepository;
        this.executionRepository = executionRepository;
    }

    // ── Runs ──────────────────────────────────────────────────────────

    /**
     * Create a run in PENDING status.
     *
     * @param configSnapshot any Jackson-serializable value, or null
     */
    public Run createRun(String runId, String projectName, Object configSnapshot) {
        requireId(runId, "runId");
        if (projectName == null || projectName.isBlank()) {
            throw new IllegalArgumentException("projectName is required");
        }

        Run run = Run.builder()
                .id(runId)
                .projectName(projectName)
                .status(RunStatus.PENDING)
                .configSnapshot(JsonColumns.write(configSnapshot))
                .build();
        runRepository.save(run);
        log.info("Created run {} for project {}", runId, projectName);
        return runRepository.findById(runId).orElse(run);
    }

    public void setRunStatus(String runId, RunStatus status) {
        runRepository.updateStatus(runId, status);
        log.info("Run {} status -> {}", runId, status);
    }

    public Optional<Run> getRun(String runId) {
        return runRepository.findById(runId);
    }

    public List<Run> listRuns(String projectName, int limit) {
        return runRepository.findRecent(projectName, limit);
    }

    public List<Run> listRuns() {
        return listRuns(null, DEFAULT_RUN_LIMIT);
    }

    // ── Tasks ─────────────────────────────────────────────────────────

    /**
     * Create a task in PENDING status. Status, result and timestamps of
     * {@code draft} are ignored.
     */
    public Task createTask(Task draft) {
        requireId(draft.id(), "taskId");

        Task task = draft.toBuilder()
                .status(TaskStatus.PENDING)
                .result(null)
                .createdAt(null)
                .updatedAt(null)
                .build();
        taskRepository.save(task);
        return taskRepository.findById(task.id()).orElse(task);
    }

    public Task createTask(String taskId, String runId, String title, String description) {
        return createTask(Task.builder()
                .id(taskId)
                .runId(runId)
                .title(title)
                .description(description)
                .build());
    }

    /**
     * @return false if the task was already terminal and nothing changed
     */
    public boolean setTaskStatus(String taskId, TaskStatus status) {
        return taskRepository.updateStatus(taskId, status, null);
    }

    /**
     * @return false if the task was already terminal and nothing changed
     */
    public boolean setTaskStatus(String taskId, TaskStatus status, String result) {
        return taskRepository.updateStatus(taskId, status, result);
    }

    public Optional<Task> getTask(String taskId) {
        return taskRepository.findById(taskId);
    }

    /**
     * Tasks of a run ordered by priority descending, then creation order.
     */
    public List<Task> listTasks(String runId) {
        return taskRepository.findByRunId(runId);
    }

    /**
     * Pending tasks of a run whose dependencies are all completed, in listing order.
     */
    public List<Task> readyTasks(String runId) {
        return ReadinessQuery.readyTasks(taskRepository.findByRunId(runId));
    }

    // ── Task logs ─────────────────────────────────────────────────────

    public long appendLog(String taskId, String message) {
        return appendLog(taskId, message, LogLevel.INFO, null, null);
    }

    public long appendLog(String taskId, String message, LogLevel level, String agentName,
            Map<String, Object> metadata) {
        return logRepository.append(taskId, level != null ? level : LogLevel.INFO, message, agentName, metadata);
    }

    public List<TaskLog> getLogs(String taskId) {
        return logRepository.findByTaskId(taskId);
    }

    // ── Executions ────────────────────────────────────────────────────

    public long createExecution(String taskId, String runId, String agentName, String implementer) {
        return createExecution(taskId, runId, agentName, implementer, null);
    }

    public long createExecution(String taskId, String runId, String agentName, String implementer,
            String inputPrompt) {
        return executionRepository.create(taskId, runId, agentName, implementer, inputPrompt);
    }

    public void finishExecution(long executionId, ExecutionStatus status, String output, String error,
            Map<String, Object> tokensUsed) {
        executionRepository.finish(executionId, status, output, error, tokensUsed);
    }

    public Optional<Execution> getExecution(long executionId) {
        return executionRepository.findById(executionId);
    }

    public List<Execution> listExecutions(String runId) {
        return executionRepository.findByRunId(runId);
    }

    public List<Execution> listTaskExecutions(String taskId) {
        return executionRepository.findByTaskId(taskId);
    }

    // ── Summary ───────────────────────────────────────────────────────

    /**
     * Read-only accounting of a run, including tasks stuck in PENDING.
     */
    public RunSummary runSummary(String runId) {
        Run run = runRepository.findById(runId).orElse(null);
        return RunSummary.of(run, taskRepository.findByRunId(runId));
    }

    private static void requireId(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
