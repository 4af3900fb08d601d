package paylink.domain.breaker;

import java.time.Instant;

/**
 * Snapshot of one terminal's circuit breaker
 *
 * @param openedAt last time the breaker opened, null if never
 * @param nextProbeAt earliest time a trial call is allowed, null while CLOSED
 */
public record CircuitBreakerState(
        String terminalId,
        EBreakerState state,
        int consecutiveFailures,
        int openCount,
        Instant openedAt,
        Instant nextProbeAt) {
}
