package paylink.dal;

import paylink.common.PaymentConstants;

/**
 * Type-safe configuration for transaction status polling
 * @since 19/10/2026
 */
public record PollingConfig(int initialIntervalMs, int maxIntervalMs, int maxPollDurationMs) {

    public static PollingConfig defaults() {
        return new PollingConfig(PaymentConstants.DEFAULT_POLL_INITIAL_MS,
                PaymentConstants.DEFAULT_POLL_MAX_MS,
                PaymentConstants.DEFAULT_MAX_POLL_DURATION_MS);
    }

    public void validate() throws ConfigurationException {
        if (initialIntervalMs < 1) {
            throw new ConfigurationException("Initial poll interval must be positive");
        }
        if (maxIntervalMs < initialIntervalMs) {
            throw new ConfigurationException("Poll interval cap must not be lower than the initial interval");
        }
        if (maxPollDurationMs < initialIntervalMs) {
            throw new ConfigurationException("Max poll duration must be at least one poll interval");
        }
    }
}
