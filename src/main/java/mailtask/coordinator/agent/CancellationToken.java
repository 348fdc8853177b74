package mailtask.coordinator.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal shared between the scheduler and an agent call.
 *
 * <p>Cancelling never interrupts anything on its own; agents poll {@link #isCancelled()},
 * block on {@link #await(Duration)} or register an {@link #onCancel(Runnable)} hook.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile String reason;

    /** A token nobody will cancel, for manual runs. */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * Cancel the token. Only the first call has any effect.
     *
     * @return true if this call cancelled the token
     */
    public boolean cancel(String reason) {
        synchronized (this) {
            if (this.reason != null) {
                return false;
            }
            this.reason = reason == null ? "cancelled" : reason;
        }
        latch.countDown();
        for (Runnable listener : listeners) {
            runListener(listener);
        }
        return true;
    }

    public boolean isCancelled() {
        return reason != null;
    }

    /** Why the token was cancelled, or null while it is not. */
    public String reason() {
        return reason;
    }

    public void throwIfCancelled() throws TaskCancelledException {
        String r = reason;
        if (r != null) {
            throw new TaskCancelledException(r);
        }
    }

    /**
     * Block until the token is cancelled or the duration elapses.
     *
     * @return true if the token was cancelled
     */
    public boolean await(Duration duration) throws InterruptedException {
        return latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Run the listener once the token is cancelled; immediately if it already is.
     */
    public void onCancel(Runnable listener) {
        AtomicBoolean ran = new AtomicBoolean(false);
        Runnable once = () -> {
            if (ran.compareAndSet(false, true)) {
                listener.run();
            }
        };
        listeners.add(once);
        if (isCancelled()) {
            runListener(once);
        }
    }

    private static void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation listener failed: {}", e.getMessage(), e);
        }
    }
}
