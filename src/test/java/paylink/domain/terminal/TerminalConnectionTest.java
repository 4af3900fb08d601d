package paylink.domain.terminal;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import paylink.dal.CircuitBreakerConfig;
import paylink.domain.breaker.CircuitBreaker;
import paylink.domain.breaker.EBreakerState;
import paylink.domain.error.ETerminalError;
import paylink.domain.error.TerminalException;
import paylink.domain.terminal.transport.ScriptedTerminalTransport;
import paylink.domain.terminal.transport.TerminalProtocol;
import paylink.domain.terminal.transport.TransportResponse;
import paylink.domain.transaction.TransactionRequest;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static paylink.domain.terminal.transport.ScriptedTerminalTransport.EOperation.STATUS;
import static paylink.domain.terminal.transport.ScriptedTerminalTransport.EOperation.SUBMIT;
import static paylink.domain.terminal.transport.ScriptedTerminalTransport.fail;

/**
 * Tests for TerminalConnection
 * @since 19/10/2026
 */
class TerminalConnectionTest {
    private static final TransactionRequest REQUEST = new TransactionRequest("tx-1", 1250, "GBP", "REG-1");

    private ScriptedTerminalTransport transport;
    private CircuitBreaker breaker;
    private AtomicInteger unreachableCalls;
    private TerminalConnection connection;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTerminalTransport();
        breaker = new CircuitBreaker("T1", new CircuitBreakerConfig(2, 60_000, 60_000), Clock.systemUTC());
        unreachableCalls = new AtomicInteger();
        connection = new TerminalConnection("T1", "10.0.0.5:8080", new TerminalProtocol(transport), breaker,
                Duration.ofMillis(500), 100, c -> unreachableCalls.incrementAndGet());
    }

    @AfterEach
    void tearDown() {
        connection.close();
    }

    // ========== Breaker Gating Tests ==========

    @Test
    @DisplayName("Should refuse gated calls without touching the network once the breaker is open")
    void shouldGateSubmitThroughBreaker() {
        // Given
        transport.script(SUBMIT, fail(ETerminalError.UNREACHABLE), fail(ETerminalError.UNREACHABLE));
        assertThatThrownBy(() -> connection.submit(REQUEST)).isInstanceOf(TerminalException.class);
        assertThatThrownBy(() -> connection.submit(REQUEST)).isInstanceOf(TerminalException.class);

        // When & Then
        assertThat(breaker.getState().state()).isEqualTo(EBreakerState.OPEN);
        assertThatThrownBy(() -> connection.submit(REQUEST))
                .isInstanceOfSatisfying(TerminalException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ETerminalError.CIRCUIT_OPEN));
        assertThat(transport.count(SUBMIT)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should let status queries through an open breaker")
    void shouldNotGateStatusQueries() throws Exception {
        // Given
        transport.script(SUBMIT, fail(ETerminalError.UNREACHABLE), fail(ETerminalError.UNREACHABLE));
        assertThatThrownBy(() -> connection.submit(REQUEST)).isInstanceOf(TerminalException.class);
        assertThatThrownBy(() -> connection.submit(REQUEST)).isInstanceOf(TerminalException.class);

        // When
        connection.queryStatus("tx-1");

        // Then
        assertThat(transport.count(STATUS)).isEqualTo(1);
        assertThat(breaker.getState().state()).isEqualTo(EBreakerState.OPEN);
    }

    @Test
    @DisplayName("Should count passive failures towards the breaker")
    void shouldRecordPassiveFailures() {
        // Given
        transport.script(STATUS, fail(ETerminalError.TIMEOUT), fail(ETerminalError.TIMEOUT));

        // When
        assertThatThrownBy(() -> connection.queryStatus("tx-1")).isInstanceOf(TerminalException.class);
        assertThatThrownBy(() -> connection.queryStatus("tx-1")).isInstanceOf(TerminalException.class);

        // Then
        assertThat(breaker.getState().state()).isEqualTo(EBreakerState.OPEN);
        assertThat(unreachableCalls.get()).isZero();
    }

    // ========== Unreachable Tracking Tests ==========

    @Test
    @DisplayName("Should notify the listener after two consecutive UNREACHABLE failures")
    void shouldNotifyAfterRepeatedUnreachable() throws Exception {
        // Given
        transport.script(STATUS, fail(ETerminalError.UNREACHABLE));
        assertThatThrownBy(() -> connection.queryStatus("tx-1")).isInstanceOf(TerminalException.class);
        assertThat(unreachableCalls.get()).isZero();

        // When
        transport.script(STATUS, fail(ETerminalError.UNREACHABLE));
        assertThatThrownBy(() -> connection.queryStatus("tx-1")).isInstanceOf(TerminalException.class);

        // Then
        assertThat(unreachableCalls.get()).isEqualTo(1);
        assertThat(connection.getConsecutiveUnreachable()).isEqualTo(2);

        connection.queryStatus("tx-1");
        assertThat(connection.getConsecutiveUnreachable()).isZero();
    }

    @Test
    @DisplayName("Should reset the unreachable count on other failure kinds")
    void shouldResetUnreachableOnOtherKinds() {
        // Given
        transport.script(STATUS, fail(ETerminalError.UNREACHABLE), fail(ETerminalError.TIMEOUT), fail(ETerminalError.UNREACHABLE));

        // When
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> connection.queryStatus("tx-1")).isInstanceOf(TerminalException.class);
        }

        // Then
        assertThat(unreachableCalls.get()).isZero();
        assertThat(connection.getConsecutiveUnreachable()).isEqualTo(1);
    }

    // ========== Session Lock Tests ==========

    @Test
    @DisplayName("Should fail with UNREACHABLE when the session stays busy past the lock timeout")
    void shouldFailWhenSessionBusy() throws Exception {
        // Given
        CountDownLatch submitting = new CountDownLatch(1);
        transport.script(SUBMIT, request -> {
            submitting.countDown();
            try {
                Thread.sleep(500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new TransportResponse(200, "{\"accepted\":true}");
        });
        CompletableFuture<Void> slowSubmit = CompletableFuture.runAsync(() -> {
            try {
                connection.submit(REQUEST);
            } catch (TerminalException e) {
                throw new IllegalStateException(e);
            }
        });
        assertThat(submitting.await(2, TimeUnit.SECONDS)).isTrue();

        // When & Then
        assertThatThrownBy(() -> connection.queryStatus("tx-1"))
                .isInstanceOfSatisfying(TerminalException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ETerminalError.UNREACHABLE);
                    assertThat(e.getMessage()).contains("busy");
                });
        assertThat(transport.count(STATUS)).isZero();
        slowSubmit.get(2, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Should refuse calls after close")
    void shouldRefuseAfterClose() {
        // When
        connection.close();

        // Then
        assertThat(connection.isClosed()).isTrue();
        assertThatThrownBy(() -> connection.identity())
                .isInstanceOfSatisfying(TerminalException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ETerminalError.UNREACHABLE));
        assertThat(transport.totalCalls()).isZero();
    }

    @Test
    @DisplayName("Should follow the terminal to a new address")
    void shouldUpdateAddress() {
        // When
        connection.updateAddress("10.0.0.9:8080");

        // Then
        assertThat(connection.getAddress()).isEqualTo("10.0.0.9:8080");
    }
}
