package paylink;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paylink.dal.CircuitBreakerConfig;
import paylink.dal.ConfigurationService;
import paylink.dal.DiscoveryConfig;
import paylink.dal.PollingConfig;
import paylink.dal.StoreConfig;
import paylink.dal.TerminalConfig;
import paylink.dal.store.FileTransactionStore;
import paylink.dal.store.ITransactionStore;
import paylink.domain.terminal.transport.DummyTerminalTransport;
import paylink.domain.terminal.transport.HttpTerminalTransport;
import paylink.domain.terminal.transport.ITerminalTransport;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;

/**
 * @since 19/10/2026
 */
public class GuiceModule extends AbstractModule {
    private static final Logger logger = LoggerFactory.getLogger(GuiceModule.class);

    private final ConfigurationService configService;

    public GuiceModule(ConfigurationService configService) {
        this.configService = configService;
    }

    @Override
    protected void configure() {
        //********************************
        //******** Configuration *********
        //********************************
        bind(TerminalConfig.class).toInstance(configService.getTerminalConfiguration());
        bind(DiscoveryConfig.class).toInstance(configService.getDiscoveryConfiguration());
        bind(PollingConfig.class).toInstance(configService.getPollingConfiguration());
        bind(CircuitBreakerConfig.class).toInstance(configService.getCircuitBreakerConfiguration());
        bind(StoreConfig.class).toInstance(configService.getStoreConfiguration());

        bind(Clock.class).toInstance(Clock.systemUTC());
    }

    /**
     * Real HTTP transport, or the dummy terminal when no terminal is connected
     */
    @Provides
    @Singleton
    public ITerminalTransport provideTerminalTransport(TerminalConfig config) {
        if (config.isDummy()) {
            logger.info("Terminal connection type NONE, using the dummy terminal");
            return new DummyTerminalTransport();
        }
        return new HttpTerminalTransport(Duration.ofMillis(config.connectTimeoutMs()));
    }

    @Provides
    @Singleton
    public ITransactionStore provideTransactionStore(StoreConfig config) {
        return new FileTransactionStore(Paths.get(config.file()), config.fsync());
    }
}
