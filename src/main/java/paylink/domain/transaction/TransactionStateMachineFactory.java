package paylink.domain.transaction;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.subjects.PublishSubject;
import io.reactivex.rxjava3.subjects.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paylink.dal.store.ITransactionStore;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Clock;

/**
 * Creates state machines and owns the stream of their state changes
 */
@Singleton
public class TransactionStateMachineFactory {
    private static final Logger logger = LoggerFactory.getLogger(TransactionStateMachineFactory.class);

    private final ITransactionStore store;
    private final Clock clock;
    private final Subject<TransactionStateEvent> eventBus = PublishSubject.<TransactionStateEvent>create().toSerialized();

    @Inject
    public TransactionStateMachineFactory(ITransactionStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Persist a new CREATED record and track it
     */
    public TransactionStateMachine create(TransactionRecord record) {
        if (record.state() != ETransactionState.CREATED) {
            throw new IllegalArgumentException("New transaction must be CREATED, got " + record.state());
        }
        store.insert(record);
        logger.info("Transaction {} CREATED: {}", record.id(), record);
        publish(new TransactionStateEvent(record, null));
        return new TransactionStateMachine(record, store, clock, this::publish);
    }

    /**
     * Track a record loaded from the store
     */
    public TransactionStateMachine resume(TransactionRecord record) {
        return new TransactionStateMachine(record, store, clock, this::publish);
    }

    public void publish(TransactionStateEvent event) {
        eventBus.onNext(event);
    }

    public Observable<TransactionStateEvent> getStateChanges() {
        return eventBus.hide();
    }

    public Observable<TransactionStateEvent> getFinalStateChanges() {
        return eventBus.filter(e -> e.getState().isTerminal());
    }

    public void complete() {
        eventBus.onComplete();
    }
}
