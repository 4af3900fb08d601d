package paylink.domain.terminal.transport.dto;

import paylink.domain.transaction.ETransactionState;

/**
 * Transaction status as reported by the terminal
 */
public enum ERemoteStatus {
    PROCESSING("processing"),
    COMPLETED("completed"),
    DECLINED("declined"),
    CANCELLED("cancelled"),
    NOT_FOUND(null);        // HTTP 404, the terminal does not know the id

    private final String wireName;

    ERemoteStatus(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Parse the wire value, null if it is not a known status
     */
    public static ERemoteStatus fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (ERemoteStatus status : values()) {
            if (status.wireName != null && status.wireName.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return null;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * True for statuses that end the transaction on the terminal
     */
    public boolean isFinal() {
        return this == COMPLETED || this == DECLINED || this == CANCELLED;
    }

    /**
     * Local final state for a final terminal status
     */
    public ETransactionState toTransactionState() {
        switch (this) {
            case COMPLETED:
                return ETransactionState.COMPLETED;
            case DECLINED:
                return ETransactionState.DECLINED;
            case CANCELLED:
                return ETransactionState.CANCELLED;
            default:
                throw new IllegalStateException("Status " + this + " is not final");
        }
    }
}
