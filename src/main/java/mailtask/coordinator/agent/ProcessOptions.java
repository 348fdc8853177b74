package mailtask.coordinator.agent;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-call options handed to {@link Agent#processTask}.
 *
 * @param token    cancelled on timeout or shutdown
 * @param timeout  how long the caller is willing to wait; a hint only
 * @param progress receives progress updates, never null
 */
public record ProcessOptions(CancellationToken token, Duration timeout, ProgressListener progress) {

    public ProcessOptions {
        Objects.requireNonNull(token, "token");
        progress = progress == null ? ProgressListener.NONE : progress;
    }

    public static ProcessOptions of(CancellationToken token, Duration timeout) {
        return new ProcessOptions(token, timeout, ProgressListener.NONE);
    }

    /** Options for a call nobody cancels. */
    public static ProcessOptions unbounded() {
        return new ProcessOptions(CancellationToken.none(), null, ProgressListener.NONE);
    }
}
