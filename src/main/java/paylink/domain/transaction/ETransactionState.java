package paylink.domain.transaction;

/**
 * Lifecycle states of a card transaction.
 * <pre>
 * CREATED -> SENT -> POLLING -> {COMPLETED | DECLINED | FAILED | TIMED_OUT | CANCELLED}
 * RECOVERY_PENDING is entered only when an unresolved record is found after a restart.
 * </pre>
 */
public enum ETransactionState {
    CREATED(false),
    SENT(false),
    POLLING(false),
    RECOVERY_PENDING(false),
    COMPLETED(true),
    DECLINED(true),
    FAILED(true),
    TIMED_OUT(true),
    CANCELLED(true);

    private final boolean terminal;

    ETransactionState(boolean terminal) {
        this.terminal = terminal;
    }

    /**
     * True for states that admit no further transition
     */
    public boolean isTerminal() {
        return terminal;
    }

    public boolean isInFlight() {
        return !terminal;
    }

    /**
     * Legal transition graph. Local cancellation is further restricted to CREATED/SENT by the manager;
     * POLLING -> CANCELLED only happens when the terminal itself reports the cancellation.
     */
    public boolean canTransitionTo(ETransactionState target) {
        if (target == null || terminal) {
            return false;
        }
        switch (this) {
            case CREATED:
                return target == SENT || target == FAILED || target == CANCELLED || target == RECOVERY_PENDING;
            case SENT:
                return target == POLLING || target == RECOVERY_PENDING || target.isTerminal();
            case POLLING:
                return target == RECOVERY_PENDING || target.isTerminal();
            case RECOVERY_PENDING:
                return target == POLLING || target.isTerminal();
            default:
                return false;
        }
    }

    /**
     * States from which a local cancel request may be attempted
     */
    public boolean isCancellable() {
        return this == CREATED || this == SENT;
    }
}
