package paylink.domain.breaker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paylink.common.ExponentialBackoff;
import paylink.dal.CircuitBreakerConfig;
import paylink.domain.error.ETerminalError;
import paylink.domain.error.TerminalException;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Circuit breaker of one terminal.
 *
 * <p>Gated calls (submit, cancel) take a {@link Permit} with {@link #acquire()} and report its outcome.
 * While OPEN every acquire fails with CIRCUIT_OPEN until {@code nextProbeAt}; then exactly one trial
 * permit is granted (HALF_OPEN). A successful trial closes the breaker and forgets the open history,
 * a failed one re-opens it with the next backoff {@code min(base * 2^(openCount-1), max)}.</p>
 *
 * <p>Polls are not gated; their outcomes are reported with {@link #recordSuccess()} and
 * {@link #recordFailure()} and only change the state while CLOSED.</p>
 */
public class CircuitBreaker {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String terminalId;
    private final int failureThreshold;
    private final ExponentialBackoff backoff;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private EBreakerState state = EBreakerState.CLOSED;
    private int consecutiveFailures;
    private int openCount;
    private Instant openedAt;
    private Instant nextProbeAt;
    private boolean trialInFlight;

    public CircuitBreaker(String terminalId, CircuitBreakerConfig config, Clock clock) {
        this.terminalId = terminalId;
        this.failureThreshold = config.failureThreshold();
        this.backoff = new ExponentialBackoff(config.baseBackoffMs(), config.maxBackoffMs());
        this.clock = clock;
    }

    /**
     * Ask to make a gated call
     * @throws TerminalException CIRCUIT_OPEN if the call must not touch the network
     */
    public Permit acquire() throws TerminalException {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return new Permit(false);
                case OPEN:
                    if (clock.instant().isBefore(nextProbeAt)) {
                        throw rejected();
                    }
                    state = EBreakerState.HALF_OPEN;
                    trialInFlight = true;
                    logger.info("Circuit breaker for terminal {} half-open, allowing one trial call", terminalId);
                    return new Permit(true);
                case HALF_OPEN:
                default:
                    if (trialInFlight) {
                        throw rejected();
                    }
                    trialInFlight = true;
                    return new Permit(true);
            }
        } finally {
            lock.unlock();
        }
    }

    private TerminalException rejected() {
        return new TerminalException(ETerminalError.CIRCUIT_OPEN, terminalId,
                "Circuit open for terminal " + terminalId + " until " + nextProbeAt);
    }

    /**
     * True if a gated call made now would be refused
     */
    public boolean isRejecting() {
        lock.lock();
        try {
            return (state == EBreakerState.OPEN && clock.instant().isBefore(nextProbeAt))
                    || (state == EBreakerState.HALF_OPEN && trialInFlight);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Passive success (poll answered)
     */
    public void recordSuccess() {
        lock.lock();
        try {
            if (state == EBreakerState.CLOSED) {
                consecutiveFailures = 0;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Passive failure (poll transport error)
     */
    public void recordFailure() {
        lock.lock();
        try {
            consecutiveFailures++;
            if (state == EBreakerState.CLOSED && consecutiveFailures >= failureThreshold) {
                open();
            }
        } finally {
            lock.unlock();
        }
    }

    private void onSuccess(boolean trial) {
        lock.lock();
        try {
            if (trial) {
                trialInFlight = false;
                state = EBreakerState.CLOSED;
                consecutiveFailures = 0;
                openCount = 0;
                nextProbeAt = null;
                logger.info("Circuit breaker for terminal {} closed after successful trial", terminalId);
            } else if (state == EBreakerState.CLOSED) {
                consecutiveFailures = 0;
            }
        } finally {
            lock.unlock();
        }
    }

    private void onFailure(boolean trial) {
        lock.lock();
        try {
            consecutiveFailures++;
            if (trial) {
                trialInFlight = false;
                open();
            } else if (state == EBreakerState.CLOSED && consecutiveFailures >= failureThreshold) {
                open();
            }
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private void open() {
        openCount++;
        openedAt = clock.instant();
        nextProbeAt = openedAt.plusMillis(backoffMillis(openCount));
        state = EBreakerState.OPEN;
        logger.warn("Circuit breaker for terminal {} OPEN after {} consecutive failures (open #{}, next probe at {})",
                terminalId, consecutiveFailures, openCount, nextProbeAt);
    }

    /**
     * Backoff before the trial after the n-th consecutive opening (n >= 1)
     */
    public long backoffMillis(int n) {
        return backoff.delayMillis(Math.max(0, n - 1));
    }

    /**
     * Start OPEN, as of the given time - used when the recent history shows a dead terminal
     */
    void restoreOpen(int restoredOpenCount, Instant lastFailureAt) {
        lock.lock();
        try {
            state = EBreakerState.OPEN;
            consecutiveFailures = failureThreshold;
            openCount = Math.max(1, restoredOpenCount);
            openedAt = lastFailureAt;
            nextProbeAt = lastFailureAt.plusMillis(backoffMillis(openCount));
            logger.warn("Circuit breaker for terminal {} restored OPEN from history, next probe at {}", terminalId, nextProbeAt);
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return new CircuitBreakerState(terminalId, state, consecutiveFailures, openCount, openedAt, nextProbeAt);
        } finally {
            lock.unlock();
        }
    }

    public String getTerminalId() {
        return terminalId;
    }

    /**
     * Permission for one gated call. Exactly one outcome is counted, later reports are ignored.
     */
    public final class Permit {
        private final boolean trial;
        private final AtomicBoolean reported = new AtomicBoolean(false);

        private Permit(boolean trial) {
            this.trial = trial;
        }

        public void success() {
            if (reported.compareAndSet(false, true)) {
                onSuccess(trial);
            }
        }

        public void failure() {
            if (reported.compareAndSet(false, true)) {
                onFailure(trial);
            }
        }

        public boolean isTrial() {
            return trial;
        }
    }
}
