package mailtask.coordinator.report;

import mailtask.coordinator.model.Task;

/**
 * Receives a task once it reaches completed or failed.
 * Failures are logged by the caller and never change the task.
 */
@FunctionalInterface
public interface TaskReporter {

    TaskReporter NONE = task -> {
    };

    void sendTaskReport(Task task) throws Exception;
}
