package mailtask.coordinator.store.lock;

import mailtask.coordinator.store.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lock-file mutex: the lock is a directory {@code <target>.lock} next to the store file.
 *
 * <p>Directory creation is atomic on every local file system, so it serializes threads of
 * this JVM and other processes alike. The holder touches the directory every
 * {@link LockOptions#update()}; a lock whose modification time is older than
 * {@link LockOptions#stale()} belonged to a crashed holder and is reclaimed.
 */
public final class LockFileMutex implements StoreLock {

    private static final Logger log = LoggerFactory.getLogger(LockFileMutex.class);

    private static final ScheduledExecutorService REFRESHER = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "mailtask-lock-refresh");
        t.setDaemon(true);
        return t;
    });

    private final LockOptions options;

    public LockFileMutex(LockOptions options) {
        this.options = options;
    }

    public LockFileMutex() {
        this(LockOptions.defaults());
    }

    public LockOptions options() {
        return options;
    }

    public static Path lockPathFor(Path target) {
        return target.resolveSibling(target.getFileName().toString() + ".lock");
    }

    @Override
    public Release acquire(Path target) {
        Path lockDir = lockPathFor(target);
        int attempt = 0;
        int reclaims = 0;

        while (true) {
            try {
                Files.createDirectory(lockDir);
                return hold(lockDir);
            } catch (FileAlreadyExistsException e) {
                if (reclaims <= options.retries() && reclaimIfStale(lockDir)) {
                    reclaims++;
                    continue;
                }
                if (attempt >= options.retries()) {
                    throw new StorageException("Lock file is already being held: " + lockDir
                            + " (gave up after " + (attempt + 1) + " attempts)");
                }
                sleep(options.backoffMillis(attempt, ThreadLocalRandom.current().nextDouble()), lockDir);
                attempt++;
            } catch (NoSuchFileException e) {
                throw new StorageException("Store directory does not exist: " + lockDir.getParent(), e);
            } catch (IOException e) {
                throw new StorageException("Failed to acquire lock: " + lockDir, e);
            }
        }
    }

    /**
     * Remove the lock if its holder stopped refreshing it.
     *
     * @return true if the caller should retry immediately
     */
    private boolean reclaimIfStale(Path lockDir) {
        try {
            Duration age = ageOf(lockDir);
            if (age.compareTo(options.stale()) < 0) {
                return false;
            }
            log.warn("Reclaiming stale lock {} (untouched for {}ms)", lockDir, age.toMillis());
            return reclaim(lockDir);
        } catch (NoSuchFileException e) {
            // released between our attempt and the check
            return true;
        } catch (IOException e) {
            log.warn("Failed to inspect lock {}: {}", lockDir, e.getMessage());
            return false;
        }
    }

    /**
     * Removes a lock directory already judged stale. The directory is renamed to a tombstone
     * first and its age checked again there: another process may have reclaimed and re-acquired
     * the lock between the staleness check and the rename, in which case the fresh lock is put
     * back and the reclaim counts as lost.
     */
    boolean reclaim(Path lockDir) throws IOException {
        Path tombstone = lockDir.resolveSibling(lockDir.getFileName() + "." + UUID.randomUUID() + ".stale");
        try {
            Files.move(lockDir, tombstone, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.deleteIfExists(lockDir);
            return true;
        }

        Duration age = ageOf(tombstone);
        if (age.compareTo(options.stale()) >= 0) {
            Files.deleteIfExists(tombstone);
            return true;
        }

        log.warn("Lock {} was re-acquired while reclaiming it, restoring", lockDir);
        try {
            Files.move(tombstone, lockDir, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            // someone created a new lock in the gap; theirs wins
            log.warn("Could not restore lock {}: {}", lockDir, e.getMessage());
            Files.deleteIfExists(tombstone);
        }
        return false;
    }

    private static Duration ageOf(Path path) throws IOException {
        FileTime modified = Files.getLastModifiedTime(path);
        return Duration.between(modified.toInstant(), Instant.now());
    }

    private Release hold(Path lockDir) {
        long updateMs = Math.max(1L, options.update().toMillis());
        ScheduledFuture<?> refresh = REFRESHER.scheduleAtFixedRate(
                () -> touch(lockDir), updateMs, updateMs, TimeUnit.MILLISECONDS);
        AtomicBoolean released = new AtomicBoolean(false);

        return () -> {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            refresh.cancel(false);
            try {
                Files.deleteIfExists(lockDir);
            } catch (IOException e) {
                log.warn("Failed to release lock {}: {}", lockDir, e.getMessage());
            }
        };
    }

    private static void touch(Path lockDir) {
        try {
            Files.setLastModifiedTime(lockDir, FileTime.from(Instant.now()));
        } catch (IOException e) {
            log.warn("Failed to refresh lock {}: {}", lockDir, e.getMessage());
        }
    }

    private static void sleep(long millis, Path lockDir) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while waiting for lock: " + lockDir, e);
        }
    }
}
