package mailtask.coordinator.scheduler;

import mailtask.coordinator.model.Task;
import mailtask.coordinator.model.TaskStatus;
import mailtask.coordinator.repository.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Background task that recovers tasks stuck in processing.
 *
 * Tasks get stuck when the process running them dies before recording an outcome.
 * The reaper:
 * 1. Finds processing tasks started longer ago than the threshold
 * 2. Skips tasks this process is still running
 * 3. Fails each of the others, which retries it or fails it permanently
 */
public class TaskReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskReaper.class);

    private final TaskQueue queue;
    private final Duration stuckThreshold;
    private final Predicate<String> runningLocally;
    private final Consumer<Task> onTerminal;

    /**
     * @param queue          queue to scan
     * @param stuckThreshold how long a task may stay in processing
     * @param runningLocally true for task ids this process is still working on
     * @param onTerminal     receives tasks the reaper failed permanently
     */
    public TaskReaper(TaskQueue queue, Duration stuckThreshold,
                      Predicate<String> runningLocally, Consumer<Task> onTerminal) {
        this.queue = queue;
        this.stuckThreshold = stuckThreshold;
        this.runningLocally = runningLocally;
        this.onTerminal = onTerminal;
    }

    @Override
    public void run() {
        try {
            reapStuckTasks();
        } catch (Exception e) {
            log.error("Task reaper error", e);
        }
    }

    /**
     * Find and recover stuck processing tasks.
     *
     * @return number of tasks recovered
     */
    public int reapStuckTasks() {
        Instant cutoff = Instant.now().minus(stuckThreshold);

        List<Task> stuck = queue.getTasksByStatus(TaskStatus.PROCESSING).stream()
                .filter(t -> t.startedAt() != null && t.startedAt().isBefore(cutoff))
                .filter(t -> !runningLocally.test(t.id()))
                .toList();

        if (stuck.isEmpty()) {
            log.debug("No stuck tasks found");
            return 0;
        }

        int retried = 0;
        int failed = 0;

        for (Task task : stuck) {
            try {
                Optional<Task> updated = queue.failTask(task.id(),
                        "Task stuck in processing for more than " + stuckThreshold.toMillis() + "ms");
                if (updated.isEmpty()) {
                    continue;
                }
                Task t = updated.get();
                if (t.status() == TaskStatus.FAILED) {
                    failed++;
                    log.warn("Task {} permanently failed after {} attempts (stuck in processing)",
                            t.id(), t.retries());
                    onTerminal.accept(t);
                } else {
                    retried++;
                    log.info("Reaped task {} for retry (attempt {} of {})",
                            t.id(), t.retries(), t.maxRetries());
                }
            } catch (Exception e) {
                log.error("Failed to reap task {}", task.id(), e);
            }
        }

        log.info("Task reaper: {} retried, {} failed, {} total stuck",
                retried, failed, stuck.size());

        return retried + failed;
    }
}
