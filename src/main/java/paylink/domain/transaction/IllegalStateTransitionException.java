package paylink.domain.transaction;

/**
 * Thrown when a transition is not on the transaction state graph (including any transition out of a terminal state)
 */
public class IllegalStateTransitionException extends IllegalStateException {
    private final String transactionId;
    private final ETransactionState from;
    private final ETransactionState to;

    public IllegalStateTransitionException(String transactionId, ETransactionState from, ETransactionState to) {
        super(String.format("Illegal transition %s -> %s for transaction %s", from, to, transactionId));
        this.transactionId = transactionId;
        this.from = from;
        this.to = to;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public ETransactionState getFrom() {
        return from;
    }

    public ETransactionState getTo() {
        return to;
    }
}
