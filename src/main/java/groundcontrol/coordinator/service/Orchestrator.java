package groundcontrol.coordinator.service;

import groundcontrol.coordinator.agent.AgentCatalog;
import groundcontrol.coordinator.agent.AgentDefinition;
import groundcontrol.coordinator.agent.AgentTaskExecutor;
import groundcontrol.coordinator.config.CoordinatorConfig;
import groundcontrol.coordinator.implementer.ImplementerRegistry;
import groundcontrol.coordinator.model.RunStatus;
import groundcontrol.coordinator.model.Task;
import groundcontrol.coordinator.model.TaskResult;
import groundcontrol.coordinator.planning.PlannedTask;
import groundcontrol.coordinator.planning.Planner;
import groundcontrol.coordinator.planning.PlanningException;
import groundcontrol.coordinator.planning.ProjectSettings;
import groundcontrol.coordinator.scheduler.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;

/**
 * Drives one run end to end: plan, persist the tasks, execute them, record
 * the final run status.
 */
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final StateStore store;
    private final AgentCatalog agents;
    private final ImplementerRegistry implementers;
    private final CoordinatorConfig config;

    public Orchestrator(StateStore store, AgentCatalog agents, ImplementerRegistry implementers,
            CoordinatorConfig config) {
        this.store = store;
        this.agents = agents;
        this.implementers = implementers;
        this.config = config;
    }

    /**
     * Execute a full run for a project.
     *
     * @return the new run id
     * @throws PlanningException if the planner throws a checked exception; the run is marked FAILED
     */
    public String run(ProjectSettings settings, Planner planner) {
        String runId = newRunId();
        log.info("Starting run {} for project '{}' at {}", runId, settings.name(), settings.repoPath());

        store.createRun(runId, settings.name(), settings);

        // Planning
        store.setRunStatus(runId, RunStatus.PLANNING);
        List<PlannedTask> planned = plan(runId, settings, planner);
        log.info("Run {}: planned {} task(s)", runId, planned.size());

        if (planned.isEmpty()) {
            store.setRunStatus(runId, RunStatus.COMPLETED);
            log.info("Run {}: nothing to do", runId);
            return runId;
        }

        for (PlannedTask pt : planned) {
            store.createTask(Task.builder()
                    .id(pt.id())
                    .runId(runId)
                    .ticketId(pt.ticketId())
                    .title(pt.title())
                    .description(pt.description())
                    .assignedAgent(pt.assignedAgent())
                    .priority(pt.priority())
                    .dependencies(pt.dependencies())
                    .build());
        }

        // Execution
        store.setRunStatus(runId, RunStatus.RUNNING);
        log.info("Run {}: executing tasks (max parallel {})", runId, settings.maxParallel());

        AgentTaskExecutor executor = new AgentTaskExecutor(
                store, agents, implementers, settings, config.defaultAgent(), config.defaultImplementer());
        List<TaskResult> results;
        try (TaskQueue queue = new TaskQueue(store, settings.maxParallel(), config.pollInterval())) {
            results = queue.executeAll(runId, executor);
        }

        long failed = results.stream().filter(r -> !r.success()).count();
        RunStatus finalStatus = failed == 0 ? RunStatus.COMPLETED : RunStatus.FAILED;
        store.setRunStatus(runId, finalStatus);

        log.info("Run {} {}: {} succeeded, {} failed", runId, finalStatus,
                results.size() - failed, failed);
        return runId;
    }

    private List<PlannedTask> plan(String runId, ProjectSettings settings, Planner planner) {
        try {
            List<PlannedTask> planned = planner.plan(settings, offeredAgents(settings));
            return planned != null ? planned : List.of();
        } catch (RuntimeException e) {
            markFailed(runId, e);
            throw e;
        } catch (Exception e) {
            markFailed(runId, e);
            throw new PlanningException("Planning failed for run " + runId, e);
        }
    }

    private List<AgentDefinition> offeredAgents(ProjectSettings settings) {
        if (settings.agents().isEmpty()) {
            return agents.list();
        }
        return settings.agents().stream().map(agents::get).toList();
    }

    private void markFailed(String runId, Exception cause) {
        log.error("Planning failed for run {}", runId, cause);
        store.setRunStatus(runId, RunStatus.FAILED);
    }

    static String newRunId() {
        return "run-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
