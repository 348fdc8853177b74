package mailtask.coordinator.agent;

/**
 * Thrown by an agent that stops because its {@link CancellationToken} was cancelled.
 */
public class TaskCancelledException extends Exception {

    public TaskCancelledException(String message) {
        super(message);
    }
}
