package mailtask.coordinator.store;

/**
 * Lock acquisition or file I/O failure of a single queue operation.
 * Raised only after the bounded lock retries are exhausted.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
