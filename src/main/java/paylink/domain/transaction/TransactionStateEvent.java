package paylink.domain.transaction;

import java.time.Instant;

/**
 * Observable event for a transaction state change
 */
public class TransactionStateEvent {
    private final TransactionRecord record;
    private final ETransactionState previousState;
    private final Instant timestamp;

    public TransactionStateEvent(TransactionRecord record, ETransactionState previousState) {
        this.record = record;
        this.previousState = previousState;
        this.timestamp = record.updatedAt();
    }

    public TransactionRecord getRecord() {
        return record;
    }

    public ETransactionState getPreviousState() {
        return previousState;
    }

    public ETransactionState getState() {
        return record.state();
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "TransactionStateEvent [tx=" + record.id() + ", " + previousState + " -> " + record.state()
                + ", timestamp=" + timestamp + "]";
    }
}
