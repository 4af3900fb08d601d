package paylink.domain.transaction;

import paylink.domain.terminal.Terminal;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Clock;
import java.util.UUID;

/**
 * Turns a charge intent into the wire request and its initial record
 */
@Singleton
public class TransactionBuilder {
    private final Clock clock;

    @Inject
    public TransactionBuilder(Clock clock) {
        this.clock = clock;
    }

    public TransactionRequest buildRequest(ChargeIntent intent) {
        intent.validate();
        String reference = intent.reference() == null || intent.reference().isBlank() ? null : intent.reference();
        return new TransactionRequest(UUID.randomUUID().toString(), intent.amount(), intent.currency(), reference);
    }

    public TransactionRecord buildRecord(TransactionRequest request, ChargeIntent intent, Terminal terminal, int attempt) {
        return TransactionRecord.created(request.terminalTransactionId(), intent.idempotencyKey(), intent.registerId(),
                terminal.id(), terminal.address(), request.amount(), request.currency(), attempt, clock.instant());
    }
}
