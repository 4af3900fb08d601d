package paylink.dal.store;

import paylink.domain.transaction.TransactionRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Base class for record stores - index in memory, persistence in the subclass.
 * The subclass persists a version before it becomes visible in the index.
 */
public abstract class AbstractTransactionStore implements ITransactionStore {
    private static final Comparator<TransactionRecord> NEWEST_FIRST =
            Comparator.comparing(TransactionRecord::updatedAt).reversed();

    protected final Map<String, TransactionRecord> records = new LinkedHashMap<>();
    protected final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Make one record version durable
     */
    protected abstract void persist(TransactionRecord record);

    @Override
    public void insert(TransactionRecord record) {
        lock.writeLock().lock();
        try {
            if (records.containsKey(record.id())) {
                throw new TransactionStoreException("Transaction " + record.id() + " already exists");
            }
            persist(record);
            records.put(record.id(), record);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void update(TransactionRecord record) {
        lock.writeLock().lock();
        try {
            if (!records.containsKey(record.id())) {
                throw new TransactionStoreException("Transaction " + record.id() + " does not exist");
            }
            persist(record);
            records.put(record.id(), record);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<TransactionRecord> findById(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(records.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<TransactionRecord> findLatestByIdempotencyKey(String idempotencyKey) {
        lock.readLock().lock();
        try {
            return records.values().stream()
                    .filter(r -> idempotencyKey.equals(r.idempotencyKey()))
                    .max(Comparator.comparingInt(TransactionRecord::attempt)
                            .thenComparing(TransactionRecord::createdAt));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<TransactionRecord> findUnresolved() {
        lock.readLock().lock();
        try {
            return records.values().stream()
                    .filter(TransactionRecord::isInFlight)
                    .sorted(Comparator.comparing(TransactionRecord::createdAt))
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<TransactionRecord> findRecentByTerminal(String terminalId, int limit) {
        lock.readLock().lock();
        try {
            return records.values().stream()
                    .filter(r -> terminalId.equals(r.terminalId()))
                    .sorted(NEWEST_FIRST)
                    .limit(limit)
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<TransactionRecord> findAll() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(records.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
