package mailtask.coordinator.store.lock;

import java.nio.file.Path;

/**
 * Exclusive, cross-process lock guarding one store file.
 * Implementations may use lock files, OS advisory locks or an external lease service.
 */
public interface StoreLock {

    /**
     * Acquire the lock for the given store file, retrying with backoff.
     *
     * @param target the store file being protected
     * @return handle that releases the lock when closed
     * @throws mailtask.coordinator.store.StorageException if the lock cannot be acquired
     */
    Release acquire(Path target);

    /**
     * Held lock. Closing it more than once is harmless.
     */
    @FunctionalInterface
    interface Release extends AutoCloseable {
        @Override
        void close();
    }
}
