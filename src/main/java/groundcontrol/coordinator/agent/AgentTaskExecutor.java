package groundcontrol.coordinator.agent;

import groundcontrol.coordinator.implementer.Implementer;
import groundcontrol.coordinator.implementer.ImplementerRegistry;
import groundcontrol.coordinator.implementer.ImplementerResult;
import groundcontrol.coordinator.model.ExecutionStatus;
import groundcontrol.coordinator.model.LogLevel;
import groundcontrol.coordinator.model.Task;
import groundcontrol.coordinator.model.TaskResult;
import groundcontrol.coordinator.planning.ProjectSettings;
import groundcontrol.coordinator.scheduler.TaskExecutor;
import groundcontrol.coordinator.service.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes a task by handing a prompt built from the assigned agent and the
 * task to that agent's implementer.
 *
 * <p>Each attempt is recorded as an execution with start and end log lines.
 * Implementer faults become a failed execution and a failed result; store
 * faults propagate.
 */
public class AgentTaskExecutor implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(AgentTaskExecutor.class);

    private final StateStore store;
    private final AgentCatalog agents;
    private final ImplementerRegistry implementers;
    private final ProjectSettings settings;
    private final String defaultAgent;
    private final String defaultImplementer;

    public AgentTaskExecutor(StateStore store, AgentCatalog agents, ImplementerRegistry implementers,
            ProjectSettings settings, String defaultAgent, String defaultImplementer) {
        this.store = store;
        this.agents = agents;
        this.implementers = implementers;
        this.settings = settings;
        this.defaultAgent = defaultAgent;
        this.defaultImplementer = defaultImplementer;
    }

    @Override
    public TaskResult execute(Task task) {
        String agentName = task.assignedAgent() != null ? task.assignedAgent() : defaultAgent;

        Optional<AgentDefinition> found = agents.find(agentName);
        if (found.isEmpty()) {
            log.warn("Task {} assigned to unknown agent '{}'", task.id(), agentName);
            return TaskResult.failure(task.id(), "Agent '" + agentName + "' not found");
        }
        AgentDefinition agent = found.get();

        String implementerName = resolveImplementer(agent);
        String prompt = buildPrompt(task, agent);

        long executionId = store.createExecution(task.id(), task.runId(), agentName, implementerName, prompt);
        store.appendLog(task.id(),
                "Starting execution with agent '" + agentName + "' via '" + implementerName + "'",
                LogLevel.INFO, agentName, Map.of("executionId", executionId));

        ImplementerResult result;
        try {
            Implementer implementer = implementers.get(implementerName);
            result = implementer.execute(prompt, settings.repoPath(), context(task, agent));
            if (result == null) {
                result = ImplementerResult.fail("Implementer '" + implementerName + "' returned no result");
            }
        } catch (RuntimeException e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("Implementer {} failed on task {}: {}", implementerName, task.id(), error);
            store.finishExecution(executionId, ExecutionStatus.FAILED, null, error, null);
            store.appendLog(task.id(), "Execution error: " + error, LogLevel.ERROR, agentName, null);
            return TaskResult.failure(task.id(), error);
        }

        store.finishExecution(executionId,
                result.success() ? ExecutionStatus.COMPLETED : ExecutionStatus.FAILED,
                result.output(), result.error(), null);
        store.appendLog(task.id(),
                "Execution " + (result.success() ? "completed" : "failed"),
                result.success() ? LogLevel.INFO : LogLevel.ERROR, agentName, null);

        return new TaskResult(task.id(), result.success(), result.output(), result.error());
    }

    private String resolveImplementer(AgentDefinition agent) {
        if (agent.implementer() != null) {
            return agent.implementer();
        }
        return settings.implementer() != null ? settings.implementer() : defaultImplementer;
    }

    /**
     * Agent instructions, a separator, then the task and project details.
     */
    String buildPrompt(Task task, AgentDefinition agent) {
        List<String> parts = new ArrayList<>();
        parts.add(agent.systemPrompt());
        parts.add("");
        parts.add("---");
        parts.add("");
        parts.add("## Task: " + task.title());
        parts.add("");
        parts.add(task.description());
        parts.add("");
        parts.add("**Project path:** " + settings.repoPath());
        parts.add("**Language:** " + settings.language());
        if (settings.framework() != null) {
            parts.add("**Framework:** " + settings.framework());
        }
        if (settings.testRunner() != null) {
            parts.add("**Test runner:** " + settings.testRunner());
        }
        return String.join("\n", parts);
    }

    private Map<String, Object> context(Task task, AgentDefinition agent) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("task", task);
        context.put("agent", agent.name());
        context.put("project", settings.name());
        return context;
    }
}
