package paylink.dal.store;

import paylink.domain.transaction.TransactionRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable store of transaction records.
 * Every write is durable when the method returns.
 */
public interface ITransactionStore extends AutoCloseable {

    /**
     * Persist a new record
     * @throws TransactionStoreException if the id already exists or the write fails
     */
    void insert(TransactionRecord record);

    /**
     * Replace the record with the same id
     * @throws TransactionStoreException if the id is unknown or the write fails
     */
    void update(TransactionRecord record);

    Optional<TransactionRecord> findById(String id);

    /**
     * Latest attempt (highest attempt number, then newest) for an idempotency key
     */
    Optional<TransactionRecord> findLatestByIdempotencyKey(String idempotencyKey);

    /**
     * Records not in a terminal state, oldest first
     */
    List<TransactionRecord> findUnresolved();

    /**
     * Most recent records of a terminal, newest first
     */
    List<TransactionRecord> findRecentByTerminal(String terminalId, int limit);

    List<TransactionRecord> findAll();

    /**
     * Drop superseded record versions from durable storage. Stores without a log have nothing to drop.
     * @throws TransactionStoreException if the rewrite fails
     */
    default void compact() {
    }

    @Override
    void close();
}
