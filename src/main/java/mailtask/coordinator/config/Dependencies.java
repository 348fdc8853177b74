package mailtask.coordinator.config;

import mailtask.coordinator.agent.Agent;
import mailtask.coordinator.agent.MockAgent;
import mailtask.coordinator.agent.ScriptAgent;
import mailtask.coordinator.api.v1.HealthController;
import mailtask.coordinator.api.v1.TaskController;
import mailtask.coordinator.report.LoggingTaskReporter;
import mailtask.coordinator.report.TaskReporter;
import mailtask.coordinator.repository.TaskQueue;
import mailtask.coordinator.scheduler.Scheduler;
import mailtask.coordinator.server.CoordinatorServer;
import mailtask.coordinator.server.RouterHandler;
import mailtask.coordinator.service.TaskService;
import mailtask.coordinator.store.JsonFileTaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv(), agent);
 * deps.startScheduler(); // start polling
 * deps.startServer();    // optional status API
 * // ... run ...
 * deps.close(); // drain and cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final TaskQueue taskQueue;
    private final Agent agent;
    private final TaskReporter reporter;
    private final TaskService taskService;
    private final TaskController taskController;

    // Lazy-initialized
    private Scheduler scheduler;
    private RouterHandler routerHandler;
    private CoordinatorServer server;

    private Dependencies(CoordinatorConfig config, Agent agent, TaskReporter reporter) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        this.taskQueue = new JsonFileTaskQueue(config);
        this.taskQueue.initialize();

        this.agent = agent;
        this.reporter = reporter;
        this.taskService = new TaskService(taskQueue, config);
        this.taskController = new TaskController(taskService);

        log.info("Dependencies initialized successfully (agent: {})", agent.name());
    }

    /**
     * Create dependencies with the given config and agent; reports go to the log.
     */
    public static Dependencies create(CoordinatorConfig config, Agent agent) {
        return create(config, agent, new LoggingTaskReporter());
    }

    public static Dependencies create(CoordinatorConfig config, Agent agent, TaskReporter reporter) {
        return new Dependencies(config, agent, reporter);
    }

    /**
     * Pick the agent: the mock when asked for or when no command is configured, the script agent otherwise.
     */
    public static Agent createAgent(CoordinatorConfig config, boolean forceMock) {
        if (forceMock || !config.hasAgentCommand()) {
            return new MockAgent();
        }
        return ScriptAgent.fromCommandLine(config.agentCommand());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public TaskQueue taskQueue() {
        return taskQueue;
    }

    public Agent agent() {
        return agent;
    }

    public TaskReporter reporter() {
        return reporter;
    }

    public TaskService taskService() {
        return taskService;
    }

    public TaskController taskController() {
        return taskController;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(taskQueue, agent, reporter, config);
        }
        return scheduler;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * The health endpoint reports the scheduler only if it was created before this call.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(new HealthController(taskService, scheduler))
                    .registerController(taskController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    public synchronized CoordinatorServer server() {
        if (server == null) {
            server = new CoordinatorServer(config.serverHost(), config.serverPort(), routerHandler());
        }
        return server;
    }

    public void startScheduler() {
        scheduler().start();
    }

    public void stopScheduler() {
        Scheduler s;
        synchronized (this) {
            s = scheduler;
        }
        if (s != null) {
            s.stop();
        }
    }

    public void startServer() {
        server().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first so running tasks can still record their outcome
        try {
            stopScheduler();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        CoordinatorServer s;
        synchronized (this) {
            s = server;
        }
        if (s != null) {
            try {
                s.stop();
            } catch (Exception e) {
                log.warn("Error stopping server: {}", e.getMessage());
            }
        }

        log.info("Dependencies closed");
    }
}
