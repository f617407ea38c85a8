package groundcontrol.coordinator.config;

import groundcontrol.coordinator.agent.AgentCatalog;
import groundcontrol.coordinator.implementer.ImplementerRegistry;
import groundcontrol.coordinator.repository.ExecutionRepository;
import groundcontrol.coordinator.repository.RunRepository;
import groundcontrol.coordinator.repository.TaskLogRepository;
import groundcontrol.coordinator.repository.TaskRepository;
import groundcontrol.coordinator.scheduler.TaskQueue;
import groundcontrol.coordinator.service.Orchestrator;
import groundcontrol.coordinator.service.StateStore;
import groundcontrol.coordinator.store.Database;
import groundcontrol.coordinator.store.JdbcExecutionRepository;
import groundcontrol.coordinator.store.JdbcRunRepository;
import groundcontrol.coordinator.store.JdbcTaskLogRepository;
import groundcontrol.coordinator.store.JdbcTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv())) {
 *     String runId = deps.orchestrator().run(settings, planner);
 *     RunSummary summary = deps.stateStore().runSummary(runId);
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Database database;
    private final RunRepository runRepository;
    private final TaskRepository taskRepository;
    private final TaskLogRepository taskLogRepository;
    private final ExecutionRepository executionRepository;
    private final StateStore stateStore;
    private final AgentCatalog agentCatalog;
    private final ImplementerRegistry implementerRegistry;
    private final Orchestrator orchestrator;

    private Dependencies(CoordinatorConfig config, AgentCatalog agents, ImplementerRegistry implementers) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.runRepository = new JdbcRunRepository(database);
        this.taskRepository = new JdbcTaskRepository(database);
        this.taskLogRepository = new JdbcTaskLogRepository(database);
        this.executionRepository = new JdbcExecutionRepository(database);

        // Services
        this.stateStore = new StateStore(runRepository, taskRepository, taskLogRepository, executionRepository);
        this.agentCatalog = agents;
        this.implementerRegistry = implementers;
        this.orchestrator = new Orchestrator(stateStore, agentCatalog, implementerRegistry, config);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the stock agents and implementers.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return create(config, AgentCatalog.withDefaults(),
                ImplementerRegistry.defaults(config.implementerTimeout()));
    }

    public static Dependencies create(CoordinatorConfig config, AgentCatalog agents,
            ImplementerRegistry implementers) {
        return new Dependencies(config, agents, implementers);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    public CoordinatorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public RunRepository runRepository() {
        return runRepository;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public TaskLogRepository taskLogRepository() {
        return taskLogRepository;
    }

    public ExecutionRepository executionRepository() {
        return executionRepository;
    }

    public StateStore stateStore() {
        return stateStore;
    }

    public AgentCatalog agentCatalog() {
        return agentCatalog;
    }

    public ImplementerRegistry implementerRegistry() {
        return implementerRegistry;
    }

    public Orchestrator orchestrator() {
        return orchestrator;
    }

    /**
     * New task queue bounded by the configured parallelism. The caller closes it.
     */
    public TaskQueue taskQueue() {
        return new TaskQueue(stateStore, config);
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");
        database.close();
        log.info("Dependencies closed");
    }
}
