package mailtask.coordinator.store.lock;

import java.time.Duration;
import java.util.Objects;

/**
 * Staleness and backoff parameters for {@link LockFileMutex}.
 *
 * @param stale      a lock untouched for this long is considered abandoned and may be reclaimed
 * @param update     how often the holder refreshes the lock; must be below {@code stale}
 * @param retries    acquisition retries after the first attempt
 * @param factor     exponential backoff factor
 * @param minTimeout first backoff delay
 * @param maxTimeout backoff cap
 * @param randomize  multiply each delay by a random factor in [1, 2)
 */
public record LockOptions(
        Duration stale,
        Duration update,
        int retries,
        double factor,
        Duration minTimeout,
        Duration maxTimeout,
        boolean randomize) {

    public static final Duration DEFAULT_STALE = Duration.ofSeconds(10);

    public LockOptions {
        Objects.requireNonNull(stale, "stale");
        Objects.requireNonNull(minTimeout, "minTimeout");
        Objects.requireNonNull(maxTimeout, "maxTimeout");
        if (stale.toMillis() < 2) {
            throw new IllegalArgumentException("stale must be at least 2ms");
        }
        if (update == null || update.isZero() || update.isNegative() || update.compareTo(stale) >= 0) {
            update = stale.dividedBy(2);
        }
        if (retries < 0) {
            throw new IllegalArgumentException("retries must not be negative");
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("factor must be >= 1");
        }
        if (maxTimeout.compareTo(minTimeout) < 0) {
            throw new IllegalArgumentException("maxTimeout must be >= minTimeout");
        }
    }

    public static LockOptions defaults() {
        return new LockOptions(DEFAULT_STALE, null, 15, 1.5,
                Duration.ofMillis(50), Duration.ofMillis(500), true);
    }

    public LockOptions withStale(Duration value) {
        return new LockOptions(value, null, retries, factor, minTimeout, maxTimeout, randomize);
    }

    public LockOptions withRetries(int value) {
        return new LockOptions(stale, update, value, factor, minTimeout, maxTimeout, randomize);
    }

    public LockOptions withBackoff(Duration min, Duration max) {
        return new LockOptions(stale, update, retries, factor, min, max, randomize);
    }

    /**
     * Delay before retry number {@code attempt} (0-based).
     *
     * @param random value in [0, 1), ignored unless {@link #randomize()}
     */
    public long backoffMillis(int attempt, double random) {
        double base = minTimeout.toMillis() * Math.pow(factor, attempt);
        if (randomize) {
            base = base * (1.0 + random);
        }
        return Math.min(maxTimeout.toMillis(), Math.round(base));
    }
}
