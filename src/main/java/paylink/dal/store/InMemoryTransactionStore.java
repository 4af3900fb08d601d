package paylink.dal.store;

import paylink.domain.transaction.TransactionRecord;

/**
 * Volatile store for tests and the Dummy terminal mode
 */
public class InMemoryTransactionStore extends AbstractTransactionStore {

    @Override
    protected void persist(TransactionRecord record) {
        // in memory only
    }

    @Override
    public void close() {
    }
}
