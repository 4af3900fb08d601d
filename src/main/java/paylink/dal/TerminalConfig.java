package paylink.dal;

import paylink.common.ETerminalConnectionType;
import paylink.common.PaymentConstants;

/**
 * Type-safe configuration for the payment terminal session.
 * Supports a network terminal (fixed address or discovered) and a Dummy mode for testing.
 *
 * @param address fixed terminal address (host:port), empty when the terminal is discovered
 * @param cacheFile terminal cache snapshot file, empty disables the snapshot
 * @since 19/10/2026
 */
public record TerminalConfig(
        ETerminalConnectionType connectionType,
        String address,
        int port,
        int connectTimeoutMs,
        int requestTimeoutMs,
        int lockTimeoutMs,
        String requiredCapability,
        String preferredTerminalId,
        long cacheTtlMs,
        String cacheFile) {

    public static final String DUMMY_ADDRESS = "dummy-terminal:0";

    /**
     * Factory method: network terminal with defaults
     */
    public static TerminalConfig network(String address) {
        return new TerminalConfig(ETerminalConnectionType.NETWORK, address, PaymentConstants.DEFAULT_TERMINAL_PORT,
                PaymentConstants.DEFAULT_CONNECT_TIMEOUT_MS, PaymentConstants.DEFAULT_REQUEST_TIMEOUT_MS,
                PaymentConstants.DEFAULT_LOCK_TIMEOUT_MS, PaymentConstants.DEFAULT_REQUIRED_CAPABILITY,
                "", PaymentConstants.DEFAULT_CACHE_TTL_MS, "");
    }

    /**
     * Factory method: dummy terminal (testing mode)
     */
    public static TerminalConfig dummy() {
        return new TerminalConfig(ETerminalConnectionType.NONE, DUMMY_ADDRESS, 0,
                PaymentConstants.DEFAULT_CONNECT_TIMEOUT_MS, PaymentConstants.DEFAULT_REQUEST_TIMEOUT_MS,
                PaymentConstants.DEFAULT_LOCK_TIMEOUT_MS, PaymentConstants.DEFAULT_REQUIRED_CAPABILITY,
                "", PaymentConstants.DEFAULT_CACHE_TTL_MS, "");
    }

    public boolean isDummy() {
        return connectionType == ETerminalConnectionType.NONE;
    }

    public boolean hasFixedAddress() {
        return address != null && !address.isBlank();
    }

    public boolean hasCacheFile() {
        return cacheFile != null && !cacheFile.isBlank();
    }

    /**
     * Validate configuration based on connection type
     */
    public void validate() throws ConfigurationException {
        if (connectionType == null) {
            throw new ConfigurationException("Terminal connection type cannot be null");
        }
        if (connectionType == ETerminalConnectionType.NETWORK) {
            if (port < 1 || port > 65535) {
                throw new ConfigurationException("Terminal port must be between 1 and 65535");
            }
            if (hasFixedAddress() && address.lastIndexOf(':') < 1) {
                throw new ConfigurationException("Terminal address must have the form host:port, got '" + address + "'");
            }
        }
        if (connectTimeoutMs < 1 || requestTimeoutMs < 1 || lockTimeoutMs < 1) {
            throw new ConfigurationException("Terminal timeouts must be positive");
        }
        if (requiredCapability == null || requiredCapability.isBlank()) {
            throw new ConfigurationException("Required terminal capability cannot be empty");
        }
        if (cacheTtlMs < 1) {
            throw new ConfigurationException("Terminal cache TTL must be positive");
        }
    }

    @Override
    public String toString() {
        return switch (connectionType) {
            case NETWORK -> String.format(
                    "TerminalConfig{type=NETWORK, address='%s', port=%d, requestTimeout=%dms, capability=%s}",
                    hasFixedAddress() ? address : "<discovery>", port, requestTimeoutMs, requiredCapability);
            case NONE -> "TerminalConfig{type=NONE (Dummy)}";
        };
    }
}
