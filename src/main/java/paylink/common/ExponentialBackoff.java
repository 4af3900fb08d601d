package paylink.common;

/**
 * Capped exponential backoff: {@code min(initial * 2^attempt, max)}.
 * Shared by the transaction poller and the circuit breaker.
 *
 * @since 19/10/2026
 */
public final class ExponentialBackoff {
    private final long initialMillis;
    private final long maxMillis;

    public ExponentialBackoff(long initialMillis, long maxMillis) {
        if (initialMillis <= 0) {
            throw new IllegalArgumentException("Initial backoff must be positive");
        }
        if (maxMillis < initialMillis) {
            throw new IllegalArgumentException("Max backoff must not be lower than initial backoff");
        }
        this.initialMillis = initialMillis;
        this.maxMillis = maxMillis;
    }

    /**
     * Delay for the given zero-based attempt
     */
    public long delayMillis(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt must not be negative");
        }
        if (attempt >= 31) {
            return maxMillis;
        }
        return Math.min(initialMillis * (1L << attempt), maxMillis);
    }

    @Override
    public String toString() {
        return String.format("ExponentialBackoff{initial=%dms, max=%dms}", initialMillis, maxMillis);
    }
}
