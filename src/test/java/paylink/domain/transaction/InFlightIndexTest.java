package paylink.domain.transaction;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import paylink.dal.store.InMemoryTransactionStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for InFlightIndex
 * @since 19/10/2026
 */
class InFlightIndexTest {
    private InFlightIndex index;
    private TransactionStateMachineFactory factory;

    @BeforeEach
    void setUp() {
        index = new InFlightIndex();
        factory = new TransactionStateMachineFactory(new InMemoryTransactionStore(), Clock.systemUTC());
    }

    private TransactionStateMachine newTransaction(String id, String key) {
        return factory.create(TransactionRecord.created(id, key, "REG-1", "T1", "10.0.0.5:8080", 100, "GBP", 1, Instant.now()));
    }

    @Test
    @DisplayName("Should give the key to the first claimer and the owner's claim to the others")
    void shouldClaimOnce() {
        // When
        Optional<CompletableFuture<TransactionStateMachine>> first = index.claim("key-1");
        Optional<CompletableFuture<TransactionStateMachine>> second = index.claim("key-1");

        // Then
        assertThat(first).isEmpty();
        assertThat(second).isPresent();
        assertThat(second.get()).isNotDone();
    }

    @Test
    @DisplayName("Should hand the registered state machine to waiting claimers")
    void shouldHandRegisteredStateMachineToWaiters() {
        // Given
        index.claim("key-1");
        CompletableFuture<TransactionStateMachine> waiting = index.claim("key-1").orElseThrow();
        TransactionStateMachine stateMachine = newTransaction("tx-1", "key-1");

        // When
        index.register("key-1", stateMachine);

        // Then
        assertThat(waiting).isCompletedWithValue(stateMachine);
        assertThat(index.find("tx-1")).contains(stateMachine);
        assertThat(index.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should release the key when a claim is abandoned")
    void shouldReleaseAbandonedClaim() {
        // Given
        index.claim("key-1");
        CompletableFuture<TransactionStateMachine> waiting = index.claim("key-1").orElseThrow();

        // When
        index.abandon("key-1");

        // Then
        assertThat(waiting).isCompletedWithValue(null);
        assertThat(index.claim("key-1")).isEmpty();
    }

    @Test
    @DisplayName("Should drop a transaction when it reaches a final state")
    void shouldDropFinishedTransaction() {
        // Given
        index.claim("key-1");
        TransactionStateMachine stateMachine = newTransaction("tx-1", "key-1");
        index.register("key-1", stateMachine);

        // When
        stateMachine.transition(ETransactionState.CANCELLED, null);

        // Then
        assertThat(index.isTracked("tx-1")).isFalse();
        assertThat(index.all()).isEmpty();
        assertThat(index.claim("key-1")).isEmpty();
    }

    @Test
    @DisplayName("Should refuse to register an unclaimed key")
    void shouldRefuseUnclaimedRegister() {
        TransactionStateMachine stateMachine = newTransaction("tx-1", "key-1");

        assertThatThrownBy(() -> index.register("key-1", stateMachine))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should track a resumed transaction once")
    void shouldTrackResumedTransactionOnce() {
        // Given
        TransactionStateMachine stateMachine = newTransaction("tx-1", "key-1");

        // When
        boolean first = index.track(stateMachine);
        boolean second = index.track(stateMachine);
        boolean sameKey = index.track(newTransaction("tx-2", "key-1"));

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(sameKey).isFalse();
        assertThat(index.claim("key-1")).isPresent();
        assertThat(index.size()).isEqualTo(1);
    }
}
