package paylink.domain.transaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transactions in flight, by idempotency key and by id.
 *
 * <p>A charge first claims its idempotency key. The owner of the claim registers the state machine
 * it creates, or abandons the claim when it creates none; everybody else waits on the claim.
 * Entries are removed when the transaction reaches a terminal state.</p>
 */
@Singleton
public class InFlightIndex {
    private static final Logger logger = LoggerFactory.getLogger(InFlightIndex.class);

    private final Map<String, CompletableFuture<TransactionStateMachine>> byKey = new ConcurrentHashMap<>();
    private final Map<String, TransactionStateMachine> byId = new ConcurrentHashMap<>();

    /**
     * Claim an idempotency key
     * @return empty if the caller now owns the key, else the claim of the current owner
     */
    public Optional<CompletableFuture<TransactionStateMachine>> claim(String idempotencyKey) {
        CompletableFuture<TransactionStateMachine> claim = new CompletableFuture<>();
        CompletableFuture<TransactionStateMachine> existing = byKey.putIfAbsent(idempotencyKey, claim);
        return Optional.ofNullable(existing);
    }

    /**
     * Attach the owner's state machine to its claim
     */
    public void register(String idempotencyKey, TransactionStateMachine stateMachine) {
        CompletableFuture<TransactionStateMachine> claim = byKey.get(idempotencyKey);
        if (claim == null) {
            throw new IllegalStateException("Idempotency key " + idempotencyKey + " is not claimed");
        }
        byId.put(stateMachine.getId(), stateMachine);
        releaseOnCompletion(idempotencyKey, claim, stateMachine);
        claim.complete(stateMachine);
    }

    /**
     * Give up a claim without a transaction; waiting callers see null and claim again
     */
    public void abandon(String idempotencyKey) {
        CompletableFuture<TransactionStateMachine> claim = byKey.get(idempotencyKey);
        if (claim != null && !claim.isDone() && byKey.remove(idempotencyKey, claim)) {
            claim.complete(null);
        }
    }

    /**
     * Track a transaction resumed from the store
     * @return false if the id or its key is already tracked
     */
    public boolean track(TransactionStateMachine stateMachine) {
        String key = stateMachine.current().idempotencyKey();
        if (byId.containsKey(stateMachine.getId())) {
            return false;
        }
        CompletableFuture<TransactionStateMachine> claim = CompletableFuture.completedFuture(stateMachine);
        if (byKey.putIfAbsent(key, claim) != null) {
            logger.warn("Idempotency key {} already in flight, transaction {} not tracked", key, stateMachine.getId());
            return false;
        }
        byId.put(stateMachine.getId(), stateMachine);
        releaseOnCompletion(key, claim, stateMachine);
        return true;
    }

    private void releaseOnCompletion(String key, CompletableFuture<TransactionStateMachine> claim,
                                     TransactionStateMachine stateMachine) {
        stateMachine.completion().whenComplete((record, error) -> {
            byId.remove(stateMachine.getId(), stateMachine);
            byKey.remove(key, claim);
        });
    }

    public Optional<TransactionStateMachine> find(String transactionId) {
        return Optional.ofNullable(byId.get(transactionId));
    }

    public boolean isTracked(String transactionId) {
        return byId.containsKey(transactionId);
    }

    public List<TransactionStateMachine> all() {
        return new ArrayList<>(byId.values());
    }

    public int size() {
        return byId.size();
    }
}
