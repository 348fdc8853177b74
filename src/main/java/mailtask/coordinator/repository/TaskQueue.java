package mailtask.coordinator.repository;

import com.fasterxml.jackson.databind.JsonNode;
import mailtask.coordinator.model.EmailContent;
import mailtask.coordinator.model.LogLevel;
import mailtask.coordinator.model.Task;
import mailtask.coordinator.model.TaskResult;
import mailtask.coordinator.model.TaskStats;
import mailtask.coordinator.model.TaskStatus;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Persistent task queue.
 * Every operation is one atomic transaction against the store, also across processes.
 * I/O and lock failures surface as {@link mailtask.coordinator.store.StorageException}.
 */
public interface TaskQueue {

    /**
     * Make sure the store exists, creating an empty one if needed. Idempotent.
     */
    void initialize();

    /**
     * Append a new PENDING task.
     *
     * @param prompt        the producer's payload
     * @param reporterEmail who receives the report
     * @return the stored task
     */
    Task addTask(EmailContent prompt, String reporterEmail);

    /**
     * Claim the first PENDING task in stored order and move it to PROCESSING.
     *
     * @return the claimed task, or empty if nothing is pending
     */
    Optional<Task> pickTask();

    /**
     * Claim one specific task, only if it is PENDING.
     *
     * @return the claimed task, or empty if unknown or not pending
     */
    Optional<Task> claimTask(String taskId);

    /**
     * Mark a task COMPLETED with the agent's result.
     *
     * @return true if the task exists
     */
    boolean completeTask(String taskId, TaskResult result);

    /**
     * Record a failed attempt. Re-queues as PENDING while retries remain, otherwise FAILED.
     *
     * @return the updated task, or empty if unknown
     */
    Optional<Task> failTask(String taskId, String error);

    Optional<Task> getTask(String taskId);

    List<Task> getAllTasks();

    List<Task> getTasksByStatus(TaskStatus status);

    /**
     * Append a log entry stamped with the current time.
     *
     * @return true if the task exists
     */
    boolean addTaskLog(String taskId, LogLevel level, String message, JsonNode data);

    default boolean addTaskLog(String taskId, LogLevel level, String message) {
        return addTaskLog(taskId, level, message, null);
    }

    TaskStats getStats();

    /**
     * Remove COMPLETED and FAILED tasks finished at least {@code maxAge} ago.
     * PENDING and PROCESSING tasks are never removed.
     *
     * @return number of tasks removed
     */
    int cleanup(Duration maxAge);
}
