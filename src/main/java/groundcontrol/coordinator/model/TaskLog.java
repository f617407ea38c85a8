package groundcontrol.coordinator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable note attached to a task. Observability only; never read by the scheduler.
 */
public record TaskLog(
        long id,
        String taskId,
        String agentName,
        LogLevel level,
        String message,
        Map<String, Object> metadata,
        Instant createdAt) {

    public TaskLog {
        // values may be null
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }
}
