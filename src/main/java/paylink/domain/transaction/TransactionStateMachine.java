package paylink.domain.transaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paylink.dal.store.ITransactionStore;
import paylink.domain.terminal.transport.dto.ERemoteStatus;
import paylink.domain.terminal.transport.dto.StatusResponse;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Lifecycle of one transaction record.
 *
 * <p>Every change is written to the store before it becomes visible through {@link #current()}
 * and before its event is published. Reaching a terminal state completes {@link #completion()}.</p>
 */
public class TransactionStateMachine {
    private static final Logger logger = LoggerFactory.getLogger(TransactionStateMachine.class);

    private final ITransactionStore store;
    private final Clock clock;
    private final Consumer<TransactionStateEvent> eventSink;
    private final ReentrantLock lock = new ReentrantLock();
    private final CompletableFuture<TransactionRecord> completion = new CompletableFuture<>();

    private volatile TransactionRecord record;

    TransactionStateMachine(TransactionRecord record, ITransactionStore store, Clock clock,
                            Consumer<TransactionStateEvent> eventSink) {
        this.record = record;
        this.store = store;
        this.clock = clock;
        this.eventSink = eventSink;
        if (record.isTerminal()) {
            completion.complete(record);
        }
    }

    /**
     * Move to the target state
     * @param lastError error to record with the transition, null keeps the current one
     * @throws IllegalStateTransitionException if the transition is not on the state graph
     */
    public TransactionRecord transition(ETransactionState target, String lastError) {
        return apply(target, r -> lastError == null ? r : r.withLastError(lastError, clock.instant()));
    }

    /**
     * Apply a status reported by the terminal. A final status finalizes the record with its card slip.
     * The first non-final answer moves SENT to POLLING; from RECOVERY_PENDING only "processing" does.
     * Ignored once the record is final.
     */
    public TransactionRecord applyRemoteStatus(StatusResponse status) {
        lock.lock();
        try {
            if (isFinal()) {
                return record;
            }
            ERemoteStatus remoteStatus = status.getRemoteStatus();
            if (remoteStatus != null && remoteStatus.isFinal()) {
                return apply(remoteStatus.toTransactionState(), r -> r.withSlip(status.toCardSlip()));
            }
            ETransactionState state = record.state();
            boolean answered = remoteStatus == ERemoteStatus.PROCESSING || remoteStatus == ERemoteStatus.NOT_FOUND;
            if ((answered && state == ETransactionState.SENT)
                    || (remoteStatus == ERemoteStatus.PROCESSING && state == ETransactionState.RECOVERY_PENDING)) {
                return apply(ETransactionState.POLLING, UnaryOperator.identity());
            }
            return record;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Give up waiting: TIMED_OUT with the outcome flagged unknown. Ignored once the record is final.
     */
    public TransactionRecord timeOut(String lastError) {
        lock.lock();
        try {
            if (isFinal()) {
                return record;
            }
            return apply(ETransactionState.TIMED_OUT, r -> r.withLastError(lastError, clock.instant()).withOutcomeUnknown(true));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Persist an error without changing the state (poll transport failures)
     */
    public TransactionRecord noteError(String lastError) {
        lock.lock();
        try {
            if (isFinal()) {
                return record;
            }
            TransactionRecord updated = record.withLastError(lastError, clock.instant());
            store.update(updated);
            record = updated;
            return updated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop tracking after a failure that prevents recording the outcome (store write failed)
     */
    public void abort(Throwable cause) {
        logger.error("Transaction {} aborted in state {}: {}", record.id(), record.state(), cause.getMessage());
        completion.completeExceptionally(cause);
    }

    private TransactionRecord apply(ETransactionState target, UnaryOperator<TransactionRecord> change) {
        TransactionRecord finished;
        ETransactionState from;
        lock.lock();
        try {
            from = record.state();
            if (!from.canTransitionTo(target)) {
                throw new IllegalStateTransitionException(record.id(), from, target);
            }
            Instant now = clock.instant();
            TransactionRecord updated = change.apply(record.withState(target, now));
            store.update(updated);
            record = updated;
            logger.info("Transaction {} {} -> {}{}", updated.id(), from, target,
                    updated.lastError() == null ? "" : " (" + updated.lastError() + ")");
            eventSink.accept(new TransactionStateEvent(updated, from));
            finished = updated;
        } finally {
            lock.unlock();
        }
        if (finished.isTerminal()) {
            completion.complete(finished);
        }
        return finished;
    }

    /**
     * Lock serializing local decisions on this transaction (submit, cancel, poll results)
     */
    public ReentrantLock getLock() {
        return lock;
    }

    public TransactionRecord current() {
        return record;
    }

    public String getId() {
        return record.id();
    }

    public boolean isFinal() {
        return record.isTerminal();
    }

    /**
     * Completes with the final record
     */
    public CompletableFuture<TransactionRecord> completion() {
        return completion;
    }
}
