package paylink.domain.transaction;

/**
 * Wire-ready sale request. Immutable once sent.
 */
public record TransactionRequest(String terminalTransactionId, long amount, String currency, String reference) {
}
