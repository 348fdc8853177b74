package mailtask.coordinator;

import mailtask.coordinator.config.CoordinatorConfig;
import mailtask.coordinator.model.EmailContent;
import mailtask.coordinator.store.JsonFileTaskQueue;
import mailtask.coordinator.store.lock.LockFileMutex;
import mailtask.coordinator.store.lock.LockOptions;

import java.nio.file.Path;
import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Shared helpers for tests.
 */
public final class TestSupport {

    private TestSupport() {
    }

    public static JsonFileTaskQueue newQueue(Path dir, int maxRetries) {
        JsonFileTaskQueue queue = new JsonFileTaskQueue(dir.resolve("tasks.json"), maxRetries,
                new LockFileMutex(fastLock()));
        queue.initialize();
        return queue;
    }

    public static LockOptions fastLock() {
        return LockOptions.defaults()
                .withRetries(200)
                .withBackoff(Duration.ofMillis(1), Duration.ofMillis(20));
    }

    /** Config with fast polling, suited to scheduler tests. */
    public static CoordinatorConfig fastConfig(Path dir) {
        return CoordinatorConfig.defaults()
                .withQueuePath(dir.resolve("tasks.json"))
                .withPollInterval(Duration.ofMillis(20))
                .withTaskTimeout(Duration.ofSeconds(10))
                .withShutdownTimeout(Duration.ofSeconds(5));
    }

    public static EmailContent mail(String subject) {
        return EmailContent.of(subject, "r@x.com", "body of " + subject);
    }

    public static void waitUntil(String what, Duration timeout, BooleanSupplier condition) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() - deadline >= 0) {
                fail("Timed out waiting for: " + what);
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted waiting for: " + what);
            }
        }
    }
}
