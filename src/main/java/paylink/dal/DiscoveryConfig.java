package paylink.dal;

import paylink.common.PaymentConstants;

/**
 * Type-safe configuration for terminal discovery on the local network
 *
 * @param range CIDR ("192.168.1.0/24"), dash range ("192.168.1.10-192.168.1.40") or a single host
 * @since 19/10/2026
 */
public record DiscoveryConfig(String range, int concurrency, int probeTimeoutMs, int maxHosts) {

    public static DiscoveryConfig defaults() {
        return new DiscoveryConfig(PaymentConstants.DEFAULT_DISCOVERY_RANGE,
                PaymentConstants.DEFAULT_DISCOVERY_CONCURRENCY,
                PaymentConstants.DEFAULT_PROBE_TIMEOUT_MS,
                PaymentConstants.DEFAULT_MAX_HOSTS);
    }

    public void validate() throws ConfigurationException {
        if (range == null || range.isBlank()) {
            throw new ConfigurationException("Discovery range cannot be empty");
        }
        if (concurrency < 1) {
            throw new ConfigurationException("Discovery concurrency must be at least 1");
        }
        if (probeTimeoutMs < 1) {
            throw new ConfigurationException("Probe timeout must be positive");
        }
        if (maxHosts < 1) {
            throw new ConfigurationException("Discovery max hosts must be at least 1");
        }
    }
}
