package eu.virtualparadox.passagesearch.rag.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock deadline of a query. Checked between stages only.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(null, null);

    private final Clock clock;
    private final Instant expiresAt;

    private Deadline(final Clock clock, final Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static Deadline none() {
        return NONE;
    }

    /**
     * @param timeout time budget; {@code null} means no deadline
     */
    public static Deadline after(final Duration timeout) {
        return after(timeout, Clock.systemUTC());
    }

    public static Deadline after(final Duration timeout, final Clock clock) {
        if (timeout == null) {
            return NONE;
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be negative");
        }
        return new Deadline(clock, clock.instant().plus(timeout));
    }

    public boolean isExpired() {
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return expiresAt == null ? "Deadline[none]" : "Deadline[" + expiresAt + "]";
    }
}
