package paylink.domain.error;

import paylink.domain.transaction.TransactionRecord;

/**
 * Failure returned to the POS domain by the charge API.
 * Carries the classified reason and, where one was written, the affected record.
 */
public class PaymentException extends RuntimeException {
    private final ETerminalError kind;
    private final transient TransactionRecord record;

    public PaymentException(ETerminalError kind, String message) {
        this(kind, message, null, null);
    }

    public PaymentException(ETerminalError kind, String message, TransactionRecord record) {
        this(kind, message, record, null);
    }

    public PaymentException(ETerminalError kind, String message, TransactionRecord record, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.record = record;
    }

    public ETerminalError getKind() {
        return kind;
    }

    /**
     * Record written before the failure, or null if none was created
     */
    public TransactionRecord getRecord() {
        return record;
    }
}
