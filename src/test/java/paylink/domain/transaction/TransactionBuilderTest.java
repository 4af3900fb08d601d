package paylink.domain.transaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import paylink.domain.terminal.ETerminalStatus;
import paylink.domain.terminal.Terminal;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for TransactionBuilder and ChargeIntent validation
 * @since 19/10/2026
 */
class TransactionBuilderTest {
    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    private final TransactionBuilder builder = new TransactionBuilder(Clock.fixed(NOW, ZoneOffset.UTC));
    private final Terminal terminal = new Terminal("T1", "10.0.0.5:8080", "Move/5000", Set.of("SALE"), NOW, ETerminalStatus.REACHABLE);

    @Test
    @DisplayName("Should build a request with a fresh UUID and the intent's amount")
    void shouldBuildRequest() {
        // Given
        ChargeIntent intent = new ChargeIntent(1250, "GBP", "REG-1", "order-1", "R-42");

        // When
        TransactionRequest first = builder.buildRequest(intent);
        TransactionRequest second = builder.buildRequest(intent);

        // Then
        assertThat(UUID.fromString(first.terminalTransactionId())).isNotNull();
        assertThat(first.terminalTransactionId()).isNotEqualTo(second.terminalTransactionId());
        assertThat(first.amount()).isEqualTo(1250);
        assertThat(first.currency()).isEqualTo("GBP");
        assertThat(first.reference()).isEqualTo("R-42");
    }

    @Test
    @DisplayName("Should drop a blank reference")
    void shouldDropBlankReference() {
        TransactionRequest request = builder.buildRequest(new ChargeIntent(100, "EUR", "REG-1", "order-1", "  "));

        assertThat(request.reference()).isNull();
    }

    @Test
    @DisplayName("Should build a CREATED record bound to the terminal")
    void shouldBuildCreatedRecord() {
        // Given
        ChargeIntent intent = new ChargeIntent(1250, "GBP", "REG-1", "order-1");
        TransactionRequest request = builder.buildRequest(intent);

        // When
        TransactionRecord record = builder.buildRecord(request, intent, terminal, 2);

        // Then
        assertThat(record.id()).isEqualTo(request.terminalTransactionId());
        assertThat(record.state()).isEqualTo(ETransactionState.CREATED);
        assertThat(record.idempotencyKey()).isEqualTo("order-1");
        assertThat(record.registerId()).isEqualTo("REG-1");
        assertThat(record.terminalId()).isEqualTo("T1");
        assertThat(record.terminalAddress()).isEqualTo("10.0.0.5:8080");
        assertThat(record.attempt()).isEqualTo(2);
        assertThat(record.createdAt()).isEqualTo(NOW);
        assertThat(record.updatedAt()).isEqualTo(NOW);
        assertThat(record.outcomeUnknown()).isFalse();
        assertThat(record.slip().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should reject invalid intents")
    void shouldRejectInvalidIntents() {
        assertThatThrownBy(() -> builder.buildRequest(new ChargeIntent(-5, "GBP", "REG-1", "k")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
        assertThatThrownBy(() -> builder.buildRequest(new ChargeIntent(100, "POUND", "REG-1", "k")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ISO-4217");
        assertThatThrownBy(() -> builder.buildRequest(new ChargeIntent(100, "GBP", " ", "k")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.buildRequest(new ChargeIntent(100, "GBP", "REG-1", null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Idempotency key");
    }
}
