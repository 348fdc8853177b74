package mailtask.coordinator.agent;

import mailtask.coordinator.model.Task;
import mailtask.coordinator.model.TaskResult;

/**
 * Pluggable processing capability. The scheduler calls {@link #processTask} once per attempt.
 *
 * <p>Implementations should watch {@link ProcessOptions#token()} and stop promptly when it is
 * cancelled. Any exception fails the attempt; the message becomes the task's error.
 */
public interface Agent {

    /** Name shown in logs and status output. */
    default String name() {
        return getClass().getSimpleName();
    }

    TaskResult processTask(Task task, ProcessOptions options) throws Exception;

    /** Checked once before the scheduler starts. */
    default boolean isReady() {
        return true;
    }

    /** Release resources. Called when the scheduler stops. */
    default void destroy() {
    }
}
