package paylink.dal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paylink.common.ETerminalConnectionType;
import paylink.common.PaymentConstants;

/**
 * Main configuration service - entry point for all payment configuration needs
 * @since 19/10/2026
 */
public class ConfigurationService {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationService.class);

    private final ConfigurationLoader loader;
    private final TerminalConfig terminalConfig;
    private final DiscoveryConfig discoveryConfig;
    private final PollingConfig pollingConfig;
    private final CircuitBreakerConfig circuitBreakerConfig;
    private final StoreConfig storeConfig;

    public ConfigurationService() throws ConfigurationException {
        this(new ConfigurationLoader());
    }

    public ConfigurationService(ConfigurationLoader loader) throws ConfigurationException {
        this.loader = loader;
        this.terminalConfig = loadTerminalConfiguration();
        this.discoveryConfig = loadDiscoveryConfiguration();
        this.pollingConfig = loadPollingConfiguration();
        this.circuitBreakerConfig = loadCircuitBreakerConfiguration();
        this.storeConfig = loadStoreConfiguration();
    }

    /**
     * Load terminal configuration (network or dummy)
     */
    private TerminalConfig loadTerminalConfiguration() throws ConfigurationException {
        String connectionTypeStr = loader.getString("terminal.connection.type", "NETWORK");
        ETerminalConnectionType connectionType;
        try {
            connectionType = ETerminalConnectionType.valueOf(connectionTypeStr.toUpperCase());
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid terminal connection type '{}', defaulting to NONE (Dummy)", connectionTypeStr);
            connectionType = ETerminalConnectionType.NONE;
        }

        String address = connectionType == ETerminalConnectionType.NONE
                ? TerminalConfig.DUMMY_ADDRESS
                : loader.getString("terminal.address", "");

        TerminalConfig config = new TerminalConfig(
                connectionType,
                address,
                loader.getInt("terminal.port", PaymentConstants.DEFAULT_TERMINAL_PORT),
                loader.getInt("terminal.connect.timeout.ms", PaymentConstants.DEFAULT_CONNECT_TIMEOUT_MS),
                loader.getInt("terminal.request.timeout.ms", PaymentConstants.DEFAULT_REQUEST_TIMEOUT_MS),
                loader.getInt("terminal.lock.timeout.ms", PaymentConstants.DEFAULT_LOCK_TIMEOUT_MS),
                loader.getString("terminal.required.capability", PaymentConstants.DEFAULT_REQUIRED_CAPABILITY),
                loader.getString("terminal.preferred.id", ""),
                loader.getLong("terminal.cache.ttl.ms", PaymentConstants.DEFAULT_CACHE_TTL_MS),
                loader.getString("terminal.cache.file", PaymentConstants.DEFAULT_CACHE_FILE));

        config.validate();
        logger.info("Configured terminal: {}", config);
        return config;
    }

    private DiscoveryConfig loadDiscoveryConfiguration() throws ConfigurationException {
        DiscoveryConfig config = new DiscoveryConfig(
                loader.getString("discovery.range", PaymentConstants.DEFAULT_DISCOVERY_RANGE),
                loader.getInt("discovery.concurrency", PaymentConstants.DEFAULT_DISCOVERY_CONCURRENCY),
                loader.getInt("discovery.probe.timeout.ms", PaymentConstants.DEFAULT_PROBE_TIMEOUT_MS),
                loader.getInt("discovery.max.hosts", PaymentConstants.DEFAULT_MAX_HOSTS));
        config.validate();
        return config;
    }

    private PollingConfig loadPollingConfiguration() throws ConfigurationException {
        PollingConfig config = new PollingConfig(
                loader.getInt("poll.interval.initial.ms", PaymentConstants.DEFAULT_POLL_INITIAL_MS),
                loader.getInt("poll.interval.max.ms", PaymentConstants.DEFAULT_POLL_MAX_MS),
                loader.getInt("poll.max.duration.ms", PaymentConstants.DEFAULT_MAX_POLL_DURATION_MS));
        config.validate();
        return config;
    }

    private CircuitBreakerConfig loadCircuitBreakerConfiguration() throws ConfigurationException {
        CircuitBreakerConfig config = new CircuitBreakerConfig(
                loader.getInt("breaker.failure.threshold", PaymentConstants.DEFAULT_FAILURE_THRESHOLD),
                loader.getInt("breaker.backoff.base.ms", PaymentConstants.DEFAULT_BREAKER_BASE_BACKOFF_MS),
                loader.getInt("breaker.backoff.max.ms", PaymentConstants.DEFAULT_BREAKER_MAX_BACKOFF_MS));
        config.validate();
        return config;
    }

    private StoreConfig loadStoreConfiguration() throws ConfigurationException {
        StoreConfig config = new StoreConfig(
                loader.getString("store.file", PaymentConstants.DEFAULT_STORE_FILE),
                loader.getBoolean("store.fsync", true));
        config.validate();
        return config;
    }

    public TerminalConfig getTerminalConfiguration() {
        return terminalConfig;
    }

    public DiscoveryConfig getDiscoveryConfiguration() {
        return discoveryConfig;
    }

    public PollingConfig getPollingConfiguration() {
        return pollingConfig;
    }

    public CircuitBreakerConfig getCircuitBreakerConfiguration() {
        return circuitBreakerConfig;
    }

    public StoreConfig getStoreConfiguration() {
        return storeConfig;
    }
}
