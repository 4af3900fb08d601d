package paylink.dal;

import paylink.common.PaymentConstants;

/**
 * Type-safe configuration for the per-terminal circuit breaker
 * @since 19/10/2026
 */
public record CircuitBreakerConfig(int failureThreshold, int baseBackoffMs, int maxBackoffMs) {

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(PaymentConstants.DEFAULT_FAILURE_THRESHOLD,
                PaymentConstants.DEFAULT_BREAKER_BASE_BACKOFF_MS,
                PaymentConstants.DEFAULT_BREAKER_MAX_BACKOFF_MS);
    }

    public void validate() throws ConfigurationException {
        if (failureThreshold < 1) {
            throw new ConfigurationException("Circuit breaker failure threshold must be at least 1");
        }
        if (baseBackoffMs < 1) {
            throw new ConfigurationException("Circuit breaker backoff must be positive");
        }
        if (maxBackoffMs < baseBackoffMs) {
            throw new ConfigurationException("Circuit breaker backoff cap must not be lower than the base backoff");
        }
    }
}
