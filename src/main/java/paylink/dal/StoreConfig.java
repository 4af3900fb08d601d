package paylink.dal;

import paylink.common.PaymentConstants;

/**
 * Type-safe configuration for the durable transaction store
 * @since 19/10/2026
 */
public record StoreConfig(String file, boolean fsync) {

    public static StoreConfig defaults() {
        return new StoreConfig(PaymentConstants.DEFAULT_STORE_FILE, true);
    }

    public void validate() throws ConfigurationException {
        if (file == null || file.isBlank()) {
            throw new ConfigurationException("Transaction store file cannot be empty");
        }
    }
}
