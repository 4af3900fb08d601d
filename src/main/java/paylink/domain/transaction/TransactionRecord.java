package paylink.domain.transaction;

import paylink.domain.terminal.transport.dto.ERemoteStatus;

import java.time.Instant;

/**
 * Durable unit of truth for one attempted charge.
 * Written before the first network send and rewritten on every state change; never deleted.
 *
 * @param id terminal transaction id
 * @param attempt 1-based attempt number for the idempotency key
 * @param outcomeUnknown set for TIMED_OUT records whose money movement is not known
 * @param reconciledOutcome authoritative terminal status learned after a TIMED_OUT, null if none
 */
public record TransactionRecord(
        String id,
        String idempotencyKey,
        String registerId,
        String terminalId,
        String terminalAddress,
        long amount,
        String currency,
        ETransactionState state,
        Instant createdAt,
        Instant updatedAt,
        int attempt,
        String lastError,
        boolean outcomeUnknown,
        ERemoteStatus reconciledOutcome,
        CardSlip slip) {

    public static TransactionRecord created(String id, String idempotencyKey, String registerId,
                                            String terminalId, String terminalAddress,
                                            long amount, String currency, int attempt, Instant now) {
        return new TransactionRecord(id, idempotencyKey, registerId, terminalId, terminalAddress,
                amount, currency, ETransactionState.CREATED, now, now, attempt, null, false, null, CardSlip.EMPTY);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public boolean isInFlight() {
        return state.isInFlight();
    }

    public TransactionRecord withState(ETransactionState newState, Instant now) {
        return new TransactionRecord(id, idempotencyKey, registerId, terminalId, terminalAddress, amount, currency,
                newState, createdAt, now, attempt, lastError, outcomeUnknown, reconciledOutcome, slip);
    }

    public TransactionRecord withLastError(String error, Instant now) {
        return new TransactionRecord(id, idempotencyKey, registerId, terminalId, terminalAddress, amount, currency,
                state, createdAt, now, attempt, error, outcomeUnknown, reconciledOutcome, slip);
    }

    public TransactionRecord withOutcomeUnknown(boolean unknown) {
        return new TransactionRecord(id, idempotencyKey, registerId, terminalId, terminalAddress, amount, currency,
                state, createdAt, updatedAt, attempt, lastError, unknown, reconciledOutcome, slip);
    }

    public TransactionRecord withReconciledOutcome(ERemoteStatus outcome, Instant now) {
        return new TransactionRecord(id, idempotencyKey, registerId, terminalId, terminalAddress, amount, currency,
                state, createdAt, now, attempt, lastError, false, outcome, slip);
    }

    public TransactionRecord withSlip(CardSlip cardSlip) {
        return new TransactionRecord(id, idempotencyKey, registerId, terminalId, terminalAddress, amount, currency,
                state, createdAt, updatedAt, attempt, lastError, outcomeUnknown, reconciledOutcome,
                cardSlip == null ? CardSlip.EMPTY : cardSlip);
    }

    @Override
    public String toString() {
        return String.format("TransactionRecord{id=%s, key=%s, terminal=%s, amount=%d %s, state=%s, attempt=%d%s%s}",
                id, idempotencyKey, terminalId, amount, currency, state, attempt,
                lastError == null ? "" : ", lastError='" + lastError + "'",
                outcomeUnknown ? ", outcomeUnknown" : "");
    }
}
