package mailtask.coordinator.agent;

import mailtask.coordinator.model.Task;
import mailtask.coordinator.model.TaskResult;
import mailtask.coordinator.model.TodoItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Agent that simulates work: waits, then returns a canned result or fails on demand.
 * Used for local runs without a real agent and for tests.
 */
public class MockAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(MockAgent.class);

    private final Duration delay;
    private final boolean shouldFail;
    private final double failRate;

    public MockAgent(Duration delay, boolean shouldFail, double failRate) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        if (failRate < 0.0 || failRate > 1.0) {
            throw new IllegalArgumentException("failRate must be within [0, 1]");
        }
        this.delay = delay;
        this.shouldFail = shouldFail;
        this.failRate = failRate;
    }

    public MockAgent(Duration delay) {
        this(delay, false, 0.0);
    }

    public MockAgent() {
        this(Duration.ofSeconds(1));
    }

    @Override
    public String name() {
        return "MockAgent";
    }

    @Override
    public TaskResult processTask(Task task, ProcessOptions options) throws Exception {
        log.debug("MockAgent processing task {} (delay {}ms)", task.id(), delay.toMillis());
        options.progress().onProgress(AgentProgress.of(0, "start", "Start processing"));

        // Returns early when the token is cancelled
        if (options.token().await(delay)) {
            throw new TaskCancelledException(options.token().reason());
        }

        if (shouldFail || ThreadLocalRandom.current().nextDouble() < failRate) {
            throw new IllegalStateException("Simulated processing failure");
        }

        options.progress().onProgress(AgentProgress.of(100, "done", "Complete processing"));

        String subject = task.subject();
        return new TaskResult(
                null,
                null,
                "Processed email: " + subject,
                List.of(new TodoItem("1", "Process: " + subject, "pending", "medium", null)),
                "Mock Agent processed task " + task.id(),
                List.of("Start processing", "Analyze email content", "Generate todos", "Complete processing"));
    }
}
