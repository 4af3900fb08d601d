package paylink.dal.store;

/**
 * A durable write or read of the transaction log failed.
 * The operation that triggered it is aborted before any network call.
 */
public class TransactionStoreException extends RuntimeException {

    public TransactionStoreException(String message) {
        super(message);
    }

    public TransactionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
