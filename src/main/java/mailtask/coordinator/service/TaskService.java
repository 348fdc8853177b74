package mailtask.coordinator.service;

import mailtask.coordinator.agent.Agent;
import mailtask.coordinator.agent.CancellationToken;
import mailtask.coordinator.agent.ProcessOptions;
import mailtask.coordinator.config.CoordinatorConfig;
import mailtask.coordinator.model.EmailContent;
import mailtask.coordinator.model.Task;
import mailtask.coordinator.model.TaskResult;
import mailtask.coordinator.model.TaskStats;
import mailtask.coordinator.model.TaskStatus;
import mailtask.coordinator.repository.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Service layer for task operations outside the scheduler:
 * manual enqueue, lookup, listing, cleanup and one-off processing.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    public static final int DEFAULT_LIST_LIMIT = 10;
    public static final int DEFAULT_CLEANUP_DAYS = 7;

    private final TaskQueue queue;
    private final CoordinatorConfig config;

    public TaskService(TaskQueue queue, CoordinatorConfig config) {
        this.queue = queue;
        this.config = config;
    }

    /**
     * Enqueue a task as if it had arrived by mail.
     *
     * @param subject mail subject, required
     * @param from    sender address, required; also the reporter
     * @param text    plain-text body, optional
     * @param html    html body, optional
     */
    public Task enqueue(String subject, String from, String text, String html) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject is required");
        }
        if (from == null || from.isBlank()) {
            throw new IllegalArgumentException("from is required");
        }
        String address = from.trim();
        if (!address.contains("@")) {
            throw new IllegalArgumentException("from must be an email address: " + from);
        }

        Instant now = Instant.now();
        EmailContent prompt = new EmailContent(
                "manual-" + now.toEpochMilli(),
                subject,
                new EmailContent.Address(address, address.substring(0, address.indexOf('@'))),
                List.of(),
                now,
                text,
                html,
                null);

        Task task = queue.addTask(prompt, address);
        log.info("Task {} enqueued manually by {}", task.id(), address);
        return task;
    }

    /**
     * Find a task by full id, or by an id prefix that matches exactly one task.
     *
     * @throws IllegalArgumentException if the prefix matches more than one task
     */
    public Optional<Task> findTask(String idOrPrefix) {
        if (idOrPrefix == null || idOrPrefix.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        String key = idOrPrefix.trim();

        Optional<Task> exact = queue.getTask(key);
        if (exact.isPresent()) {
            return exact;
        }

        List<Task> matches = queue.getAllTasks().stream()
                .filter(t -> t.id().startsWith(key))
                .toList();
        if (matches.size() > 1) {
            throw new IllegalArgumentException("Ambiguous task id prefix '" + key + "' matches "
                    + matches.size() + " tasks");
        }
        return matches.stream().findFirst();
    }

    /**
     * The most recent tasks in queue order, optionally filtered by status.
     */
    public List<Task> listTasks(TaskStatus status, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        List<Task> tasks = status == null ? queue.getAllTasks() : queue.getTasksByStatus(status);
        if (tasks.size() <= limit) {
            return tasks;
        }
        return tasks.subList(tasks.size() - limit, tasks.size());
    }

    public TaskStats stats() {
        return queue.getStats();
    }

    /**
     * Remove completed and failed tasks that finished more than {@code days} days ago.
     *
     * @return number of tasks removed
     */
    public int cleanup(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("days must not be negative");
        }
        int removed = queue.cleanup(Duration.ofDays(days));
        log.info("Cleanup with {} day(s) retention removed {} tasks", days, removed);
        return removed;
    }

    /**
     * Run one task through the agent on the calling thread, bypassing the scheduler.
     * The outcome is recorded like a scheduled attempt.
     *
     * @return the task after the attempt
     * @throws IllegalArgumentException if no task matches
     * @throws IllegalStateException    if the task is not pending
     */
    public Task processNow(String idOrPrefix, Agent agent) {
        Task found = findTask(idOrPrefix)
                .orElseThrow(() -> new IllegalArgumentException("Task not found: " + idOrPrefix));
        Task task = queue.claimTask(found.id())
                .orElseThrow(() -> new IllegalStateException("Task " + found.id() + " is not pending"));

        log.info("Processing task {} manually with {}", task.id(), agent.name());
        try {
            TaskResult result = agent.processTask(task,
                    ProcessOptions.of(CancellationToken.none(), config.taskTimeout()));
            queue.completeTask(task.id(), result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            queue.failTask(task.id(), "Interrupted");
        } catch (Exception e) {
            log.error("Manual processing of task {} failed", task.id(), e);
            queue.failTask(task.id(), e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }

        return queue.getTask(task.id())
                .orElseThrow(() -> new IllegalStateException("Task disappeared: " + task.id()));
    }

    /**
     * Run a throwaway task through the agent without touching the queue.
     */
    public static TaskResult testAgent(Agent agent, String message, Duration timeout) throws Exception {
        if (!agent.isReady()) {
            throw new IllegalStateException("Agent is not ready: " + agent.name());
        }
        Instant now = Instant.now();
        Task probe = Task.builder()
                .id("test-" + now.toEpochMilli())
                .status(TaskStatus.PROCESSING)
                .prompt(new EmailContent(
                        "test",
                        "Test email",
                        new EmailContent.Address("test@example.com", "Test User"),
                        List.of(EmailContent.Address.of("mailtask@example.com")),
                        now,
                        message,
                        null,
                        null))
                .reporterEmail("test@example.com")
                .createdAt(now)
                .startedAt(now)
                .updatedAt(now)
                .build();
        return agent.processTask(probe, ProcessOptions.of(CancellationToken.none(), timeout));
    }
}
