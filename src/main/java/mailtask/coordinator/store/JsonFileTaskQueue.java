package mailtask.coordinator.store;

import com.fasterxml.jackson.databind.JsonNode;
import mailtask.coordinator.config.CoordinatorConfig;
import mailtask.coordinator.model.EmailContent;
import mailtask.coordinator.model.LogLevel;
import mailtask.coordinator.model.Task;
import mailtask.coordinator.model.TaskLog;
import mailtask.coordinator.model.TaskResult;
import mailtask.coordinator.model.TaskStats;
import mailtask.coordinator.model.TaskStatus;
import mailtask.coordinator.repository.TaskQueue;
import mailtask.coordinator.store.lock.LockFileMutex;
import mailtask.coordinator.store.lock.StoreLock;
import mailtask.coordinator.store.model.StoreDocument;
import mailtask.coordinator.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * JSON file implementation of TaskQueue.
 *
 * <p>Each operation locks the store, reads the whole document, applies its change to an
 * in-memory copy of the task list and writes the whole list back before unlocking.
 * Read-only operations and no-ops on unknown ids skip the write.
 */
public class JsonFileTaskQueue implements TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(JsonFileTaskQueue.class);

    private final Path filePath;
    private final int maxRetries;
    private final StoreLock lock;
    private final Clock clock;
    private volatile boolean initialized = false;

    public JsonFileTaskQueue(Path filePath, int maxRetries, StoreLock lock, Clock clock) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        this.filePath = filePath.toAbsolutePath().normalize();
        this.maxRetries = maxRetries;
        this.lock = lock;
        this.clock = clock;
    }

    public JsonFileTaskQueue(Path filePath, int maxRetries, StoreLock lock) {
        this(filePath, maxRetries, lock, Clock.systemUTC());
    }

    public JsonFileTaskQueue(CoordinatorConfig config) {
        this(config.queuePath(), config.defaultMaxRetries(), new LockFileMutex(config.lockOptions()));
    }

    public Path filePath() {
        return filePath;
    }

    @Override
    public void initialize() {
        if (initialized) {
            return;
        }
        try {
            Path dir = filePath.getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            if (!Files.exists(filePath)) {
                try (StoreLock.Release ignored = lock.acquire(filePath)) {
                    // Another process may have created it while we waited
                    if (!Files.exists(filePath)) {
                        write(List.of());
                        log.info("Task queue file created: {}", filePath);
                    }
                }
            } else if (!Files.isWritable(filePath)) {
                throw new StorageException("Task queue file is not writable: " + filePath);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to initialize task queue at " + filePath, e);
        }
        initialized = true;
        log.info("Task queue initialized: {}", filePath);
    }

    @Override
    public Task addTask(EmailContent prompt, String reporterEmail) {
        if (prompt == null) {
            throw new IllegalArgumentException("prompt is required");
        }
        Instant now = clock.instant();
        Task task = Task.builder()
                .id(UUID.randomUUID().toString())
                .status(TaskStatus.PENDING)
                .prompt(prompt)
                .reporterEmail(reporterEmail)
                .retries(0)
                .maxRetries(maxRetries)
                .createdAt(now)
                .updatedAt(now)
                .log(now, LogLevel.INFO, "Task created")
                .build();

        atomicUpdate(tasks -> {
            tasks.add(task);
            return Mutation.changed(task);
        });

        log.info("New task added: {} (subject: {})", task.id(), task.subject());
        return task;
    }

    @Override
    public Optional<Task> pickTask() {
        return atomicUpdate(tasks -> claim(tasks, indexOfFirst(tasks, TaskStatus.PENDING)));
    }

    @Override
    public Optional<Task> claimTask(String taskId) {
        return atomicUpdate(tasks -> {
            int index = indexOf(tasks, taskId);
            if (index >= 0 && tasks.get(index).status() != TaskStatus.PENDING) {
                log.debug("Task {} is {}, not claiming", taskId, tasks.get(index).status());
                return Mutation.unchanged(Optional.empty());
            }
            return claim(tasks, index);
        });
    }

    private Mutation<Optional<Task>> claim(List<Task> tasks, int index) {
        if (index < 0) {
            return Mutation.unchanged(Optional.empty());
        }

        Instant now = clock.instant();
        Task picked = tasks.get(index).toBuilder()
                .status(TaskStatus.PROCESSING)
                .startedAt(now)
                .updatedAt(now)
                .log(now, LogLevel.INFO, "Task processing started")
                .build();
        tasks.set(index, picked);

        log.info("Task picked: {}", picked.id());
        return Mutation.changed(Optional.of(picked));
    }

    @Override
    public boolean completeTask(String taskId, TaskResult result) {
        return atomicUpdate(tasks -> {
            int index = indexOf(tasks, taskId);
            if (index < 0) {
                log.warn("Task not found: {}", taskId);
                return Mutation.unchanged(false);
            }

            Instant now = clock.instant();
            Task completed = tasks.get(index).toBuilder()
                    .status(TaskStatus.COMPLETED)
                    .result(result)
                    .error(null)
                    .completedAt(now)
                    .updatedAt(now)
                    .log(now, LogLevel.INFO, "Task processing completed")
                    .build();
            tasks.set(index, completed);

            log.info("Task completed: {}", taskId);
            return Mutation.changed(true);
        });
    }

    @Override
    public Optional<Task> failTask(String taskId, String error) {
        return atomicUpdate(tasks -> {
            int index = indexOf(tasks, taskId);
            if (index < 0) {
                log.warn("Task not found: {}", taskId);
                return Mutation.unchanged(Optional.empty());
            }

            Instant now = clock.instant();
            Task current = tasks.get(index);
            int retries = current.retries() + 1;
            Task.Builder builder = current.toBuilder()
                    .retries(retries)
                    .updatedAt(now)
                    .log(now, LogLevel.ERROR, "Task processing failed: " + error);

            if (retries < current.maxRetries()) {
                builder.status(TaskStatus.PENDING)
                        .startedAt(null)
                        .log(now, LogLevel.INFO, "Task will retry (" + retries + "/" + current.maxRetries() + ")");
                log.warn("Task will retry: {} ({}/{})", taskId, retries, current.maxRetries());
            } else {
                builder.status(TaskStatus.FAILED)
                        .error(error)
                        .completedAt(now);
                log.error("Task failed permanently: {} ({})", taskId, error);
            }

            Task updated = builder.build();
            tasks.set(index, updated);
            return Mutation.changed(Optional.of(updated));
        });
    }

    @Override
    public Optional<Task> getTask(String taskId) {
        return atomicUpdate(tasks -> {
            int index = indexOf(tasks, taskId);
            return Mutation.unchanged(index < 0 ? Optional.<Task>empty() : Optional.of(tasks.get(index)));
        });
    }

    @Override
    public List<Task> getAllTasks() {
        return atomicUpdate(tasks -> Mutation.unchanged(List.copyOf(tasks)));
    }

    @Override
    public List<Task> getTasksByStatus(TaskStatus status) {
        return atomicUpdate(tasks -> Mutation.unchanged(
                tasks.stream().filter(t -> t.status() == status).toList()));
    }

    @Override
    public boolean addTaskLog(String taskId, LogLevel level, String message, JsonNode data) {
        return atomicUpdate(tasks -> {
            int index = indexOf(tasks, taskId);
            if (index < 0) {
                log.debug("Ignoring log for unknown task {}", taskId);
                return Mutation.unchanged(false);
            }

            Instant now = clock.instant();
            Task updated = tasks.get(index).toBuilder()
                    .log(new TaskLog(now, level, message, data))
                    .updatedAt(now)
                    .build();
            tasks.set(index, updated);
            return Mutation.changed(true);
        });
    }

    @Override
    public TaskStats getStats() {
        return TaskStats.of(getAllTasks());
    }

    @Override
    public int cleanup(Duration maxAge) {
        if (maxAge == null || maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must not be negative");
        }
        Instant now = clock.instant();

        return atomicUpdate(tasks -> {
            int before = tasks.size();
            tasks.removeIf(task -> {
                if (!task.isTerminal()) {
                    return false;
                }
                Instant finishedAt = task.completedAt() != null ? task.completedAt() : now;
                return Duration.between(finishedAt, now).compareTo(maxAge) >= 0;
            });

            int removed = before - tasks.size();
            if (removed == 0) {
                return Mutation.unchanged(0);
            }
            log.info("Cleaned up {} old tasks", removed);
            return Mutation.changed(removed);
        });
    }

    /**
     * Lock, read, apply, write if changed, unlock.
     */
    private <T> T atomicUpdate(Function<List<Task>, Mutation<T>> updater) {
        initialize();
        try (StoreLock.Release ignored = lock.acquire(filePath)) {
            List<Task> tasks = new ArrayList<>(read().toTasks());
            Mutation<T> mutation = updater.apply(tasks);
            if (mutation.changed()) {
                write(tasks);
            }
            return mutation.result();
        }
    }

    private StoreDocument read() {
        try {
            if (Files.size(filePath) == 0) {
                return StoreDocument.empty(clock.instant());
            }
            return Jsons.mapper().readValue(filePath.toFile(), StoreDocument.class);
        } catch (IOException e) {
            throw new StorageException("Failed to read task queue: " + filePath, e);
        }
    }

    private void write(List<Task> tasks) {
        Path tmp = filePath.resolveSibling(filePath.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Jsons.prettyWriter().writeValue(tmp.toFile(), StoreDocument.of(tasks, clock.instant()));
            try {
                Files.move(tmp, filePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, filePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new StorageException("Failed to write task queue: " + filePath, e);
        }
    }

    private static int indexOf(List<Task> tasks, String taskId) {
        for (int i = 0; i < tasks.size(); i++) {
            if (tasks.get(i).id().equals(taskId)) {
                return i;
            }
        }
        return -1;
    }

    private static int indexOfFirst(List<Task> tasks, TaskStatus status) {
        for (int i = 0; i < tasks.size(); i++) {
            if (tasks.get(i).status() == status) {
                return i;
            }
        }
        return -1;
    }

    private record Mutation<T>(T result, boolean changed) {
        static <T> Mutation<T> changed(T result) {
            return new Mutation<>(result, true);
        }

        static <T> Mutation<T> unchanged(T result) {
            return new Mutation<>(result, false);
        }
    }
}
