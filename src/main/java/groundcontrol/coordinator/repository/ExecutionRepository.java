package groundcontrol.coordinator.repository;

import groundcontrol.coordinator.model.Execution;
import groundcontrol.coordinator.model.ExecutionStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for execution records.
 */
public interface ExecutionRepository {

    /**
     * Record the start of an execution. New records are RUNNING.
     *
     * @return generated execution id
     * @throws NotFoundException if the task or run does not exist
     */
    long create(String taskId, String runId, String agentName, String implementer, String inputPrompt);

    /**
     * Record the end of an execution.
     *
     * @throws NotFoundException if the execution does not exist
     */
    void finish(long executionId, ExecutionStatus status, String output, String error,
            Map<String, Object> tokensUsed);

    Optional<Execution> findById(long executionId);

    List<Execution> findByRunId(String runId);

    List<Execution> findByTaskId(String taskId);
}
