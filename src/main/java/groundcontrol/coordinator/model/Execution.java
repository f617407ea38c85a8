package groundcontrol.coordinator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One attempt to carry out a task through an agent/implementer pair.
 * A task may own several of these.
 */
public record Execution(
        long id,
        String taskId,
        String runId,
        String agentName,
        String implementer,
        ExecutionStatus status,
        String inputPrompt,
        String output,
        String error,
        Map<String, Object> tokensUsed,
        Instant startedAt,
        Instant finishedAt) {

    public Execution {
        // values may be null
        tokensUsed = tokensUsed != null ? Collections.unmodifiableMap(new LinkedHashMap<>(tokensUsed)) : Map.of();
    }

    public boolean isFinished() {
        return finishedAt != null;
    }
}
