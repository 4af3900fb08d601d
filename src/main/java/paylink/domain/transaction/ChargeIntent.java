package paylink.domain.transaction;

import java.util.regex.Pattern;

/**
 * Charge request from the POS domain.
 *
 * @param amount amount in minor units (pence, cents)
 * @param currency ISO-4217 code, upper case
 * @param idempotencyKey caller supplied, stable across retries of the same purchase
 * @param reference optional text passed to the terminal (receipt number), may be null
 */
public record ChargeIntent(long amount, String currency, String registerId, String idempotencyKey, String reference) {
    private static final Pattern CURRENCY = Pattern.compile("[A-Z]{3}");

    public ChargeIntent(long amount, String currency, String registerId, String idempotencyKey) {
        this(amount, currency, registerId, idempotencyKey, null);
    }

    /**
     * @throws IllegalArgumentException if the intent cannot be charged
     */
    public void validate() {
        if (amount <= 0) {
            throw new IllegalArgumentException("Charge amount must be positive, got " + amount);
        }
        if (currency == null || !CURRENCY.matcher(currency).matches()) {
            throw new IllegalArgumentException("Currency must be a 3-letter ISO-4217 code, got '" + currency + "'");
        }
        if (registerId == null || registerId.isBlank()) {
            throw new IllegalArgumentException("Register ID cannot be empty");
        }
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be empty");
        }
    }
}
