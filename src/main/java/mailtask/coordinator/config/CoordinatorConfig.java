package mailtask.coordinator.config;

import mailtask.coordinator.store.lock.LockOptions;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for the queue, the scheduler and the status server.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    // Queue settings
    private Path queuePath = Path.of("data", "tasks.json");
    private int defaultMaxRetries = 3;

    // Lock settings
    private Duration lockStale = Duration.ofSeconds(10);
    private int lockRetries = 15;
    private Duration lockMinBackoff = Duration.ofMillis(50);
    private Duration lockMaxBackoff = Duration.ofMillis(500);

    // Scheduler settings
    private boolean schedulerEnabled = true;
    private Duration pollInterval = Duration.ofSeconds(5);
    private int maxConcurrent = 1;
    private Duration taskTimeout = Duration.ofMinutes(5);
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private boolean hardTimeout = false;

    // Reaper settings (disabled unless a threshold is set)
    private Duration taskStuckThreshold = null;
    private Duration taskReaperInterval = Duration.ofSeconds(30);

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "127.0.0.1";

    // Agent settings
    private String agentCommand = null;

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Build a config from an environment map. Unset or blank variables keep their default.
     *
     * @throws IllegalArgumentException if a numeric variable cannot be parsed
     */
    public static CoordinatorConfig fromEnv(Map<String, String> env) {
        CoordinatorConfig config = new CoordinatorConfig();

        String queuePath = value(env, "TASK_QUEUE_PATH");
        if (queuePath != null) {
            config.queuePath = Path.of(queuePath);
        }

        config.defaultMaxRetries = intValue(env, "TASK_MAX_RETRIES", config.defaultMaxRetries);
        config.lockStale = millis(env, "TASK_LOCK_STALE_MS", config.lockStale);
        config.lockRetries = intValue(env, "TASK_LOCK_RETRIES", config.lockRetries);
        config.lockMinBackoff = millis(env, "TASK_LOCK_MIN_BACKOFF_MS", config.lockMinBackoff);
        config.lockMaxBackoff = millis(env, "TASK_LOCK_MAX_BACKOFF_MS", config.lockMaxBackoff);

        String enabled = value(env, "SCHEDULER_ENABLED");
        if (enabled != null) {
            config.schedulerEnabled = !"false".equalsIgnoreCase(enabled);
        }
        config.pollInterval = millis(env, "SCHEDULER_POLL_INTERVAL", config.pollInterval);
        config.maxConcurrent = intValue(env, "SCHEDULER_MAX_CONCURRENT", config.maxConcurrent);
        config.taskTimeout = millis(env, "SCHEDULER_TASK_TIMEOUT", config.taskTimeout);
        config.shutdownTimeout = millis(env, "SCHEDULER_SHUTDOWN_TIMEOUT", config.shutdownTimeout);
        config.hardTimeout = "true".equalsIgnoreCase(value(env, "SCHEDULER_HARD_TIMEOUT"));

        config.taskStuckThreshold = millis(env, "TASK_STUCK_THRESHOLD", null);
        config.taskReaperInterval = millis(env, "TASK_REAPER_INTERVAL", config.taskReaperInterval);

        config.serverPort = intValue(env, "MAILTASK_PORT", config.serverPort);
        String host = value(env, "MAILTASK_HOST");
        if (host != null) {
            config.serverHost = host;
        }

        config.agentCommand = value(env, "AGENT_COMMAND");

        config.validate();
        return config;
    }

    private void validate() {
        if (defaultMaxRetries < 1) {
            throw new IllegalArgumentException("TASK_MAX_RETRIES must be at least 1");
        }
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("SCHEDULER_MAX_CONCURRENT must be at least 1");
        }
        if (pollInterval.isZero()) {
            throw new IllegalArgumentException("SCHEDULER_POLL_INTERVAL must be positive");
        }
    }

    private static String value(Map<String, String> env, String name) {
        String v = env.get(name);
        return v == null || v.isBlank() ? null : v.trim();
    }

    private static int intValue(Map<String, String> env, String name, int fallback) {
        String v = value(env, name);
        if (v == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + name + ": '" + v + "'", e);
        }
    }

    private static Duration millis(Map<String, String> env, String name, Duration fallback) {
        String v = value(env, name);
        if (v == null) {
            return fallback;
        }
        try {
            long ms = Long.parseLong(v);
            if (ms < 0) {
                throw new IllegalArgumentException("Invalid value for " + name + ": must not be negative");
            }
            return Duration.ofMillis(ms);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + name + ": '" + v + "'", e);
        }
    }

    // Getters
    public Path queuePath() {
        return queuePath;
    }

    public int defaultMaxRetries() {
        return defaultMaxRetries;
    }

    public LockOptions lockOptions() {
        return LockOptions.defaults()
                .withStale(lockStale)
                .withRetries(lockRetries)
                .withBackoff(lockMinBackoff, lockMaxBackoff);
    }

    public boolean schedulerEnabled() {
        return schedulerEnabled;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public Duration taskTimeout() {
        return taskTimeout;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    public boolean hardTimeout() {
        return hardTimeout;
    }

    public Duration taskStuckThreshold() {
        return taskStuckThreshold;
    }

    public boolean reaperEnabled() {
        return taskStuckThreshold != null && !taskStuckThreshold.isZero();
    }

    public Duration taskReaperInterval() {
        return taskReaperInterval;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String agentCommand() {
        return agentCommand;
    }

    public boolean hasAgentCommand() {
        return agentCommand != null && !agentCommand.isBlank();
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withQueuePath(Path path) {
        this.queuePath = path;
        return this;
    }

    public CoordinatorConfig withMaxRetries(int retries) {
        this.defaultMaxRetries = retries;
        return this;
    }

    public CoordinatorConfig withLockStale(Duration stale) {
        this.lockStale = stale;
        return this;
    }

    public CoordinatorConfig withSchedulerEnabled(boolean enabled) {
        this.schedulerEnabled = enabled;
        return this;
    }

    public CoordinatorConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public CoordinatorConfig withMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
        return this;
    }

    public CoordinatorConfig withTaskTimeout(Duration timeout) {
        this.taskTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withShutdownTimeout(Duration timeout) {
        this.shutdownTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withHardTimeout(boolean hardTimeout) {
        this.hardTimeout = hardTimeout;
        return this;
    }

    public CoordinatorConfig withTaskStuckThreshold(Duration threshold) {
        this.taskStuckThreshold = threshold;
        return this;
    }

    public CoordinatorConfig withTaskReaperInterval(Duration interval) {
        this.taskReaperInterval = interval;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public CoordinatorConfig withAgentCommand(String command) {
        this.agentCommand = command;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "queuePath='" + queuePath + '\'' +
                ", maxRetries=" + defaultMaxRetries +
                ", schedulerEnabled=" + schedulerEnabled +
                ", pollInterval=" + pollInterval.toMillis() + "ms" +
                ", maxConcurrent=" + maxConcurrent +
                ", taskTimeout=" + taskTimeout.toMillis() + "ms" +
                ", hardTimeout=" + hardTimeout +
                ", reaper=" + (reaperEnabled() ? taskStuckThreshold.toMillis() + "ms" : "off") +
                ", server=" + serverHost + ":" + serverPort +
                ", agentCommandSet=" + hasAgentCommand() +
                '}';
    }
}
