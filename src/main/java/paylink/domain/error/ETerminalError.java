package paylink.domain.error;

/**
 * Error taxonomy of the terminal integration.
 * Transient kinds are handled locally (breaker bookkeeping, rediscovery); the rest are outcomes.
 */
public enum ETerminalError {
    NO_TERMINAL(true),          // discovery and cache empty
    UNREACHABLE(true),          // connect failed, nothing was delivered
    TIMEOUT(true),              // request may have been delivered, no answer in time
    CIRCUIT_OPEN(true),         // breaker refused the call without touching the network
    MALFORMED_RESPONSE(true),   // protocol violation
    DECLINED(false),            // terminal-reported business outcome
    TIMED_OUT(false),           // polling gave up, outcome unknown
    FAILED(false),
    OUTCOME_UNKNOWN(false);     // charge refused until a timed-out attempt is reconciled

    private final boolean transientError;

    ETerminalError(boolean transientError) {
        this.transientError = transientError;
    }

    public boolean isTransient() {
        return transientError;
    }
}
