package paylink;

import paylink.dal.CircuitBreakerConfig;
import paylink.dal.DiscoveryConfig;
import paylink.dal.PollingConfig;
import paylink.dal.TerminalConfig;
import paylink.dal.store.ITransactionStore;
import paylink.domain.breaker.CircuitBreakerRegistry;
import paylink.domain.error.ErrorLogger;
import paylink.domain.recovery.RecoveryManager;
import paylink.domain.terminal.TerminalCache;
import paylink.domain.terminal.TerminalConnectionPool;
import paylink.domain.terminal.discovery.NetworkScanner;
import paylink.domain.terminal.discovery.TerminalDiscovery;
import paylink.domain.terminal.transport.ITerminalTransport;
import paylink.domain.terminal.transport.TerminalProtocol;
import paylink.domain.transaction.InFlightIndex;
import paylink.domain.transaction.TransactionBuilder;
import paylink.domain.transaction.TransactionManager;
import paylink.domain.transaction.TransactionPoller;
import paylink.domain.transaction.TransactionStateMachineFactory;

import java.time.Clock;

/**
 * Object graph of the payment integration wired by hand, the way GuiceModule wires it,
 * with a fixed terminal address and fast polling
 */
public class PaymentTestContext implements AutoCloseable {
    public static final String TERMINAL_ADDRESS = "10.0.0.5:8080";

    public final ITransactionStore store;
    public final TerminalConfig terminalConfig;
    public final PollingConfig pollingConfig;
    public final CircuitBreakerConfig breakerConfig;

    public final ErrorLogger errorLogger = new ErrorLogger();
    public final TerminalCache cache;
    public final CircuitBreakerRegistry breakers;
    public final TerminalConnectionPool connections;
    public final TerminalDiscovery discovery;
    public final InFlightIndex inFlight = new InFlightIndex();
    public final TransactionStateMachineFactory stateMachineFactory;
    public final TransactionPoller poller;
    public final RecoveryManager recoveryManager;
    public final TransactionManager manager;

    public PaymentTestContext(ITerminalTransport transport, ITransactionStore store) {
        this(transport, store, new PollingConfig(20, 40, 1_000), new CircuitBreakerConfig(3, 5_000, 60_000), Clock.systemUTC());
    }

    public PaymentTestContext(ITerminalTransport transport, ITransactionStore store, PollingConfig pollingConfig,
                              CircuitBreakerConfig breakerConfig, Clock clock) {
        this.store = store;
        this.pollingConfig = pollingConfig;
        this.breakerConfig = breakerConfig;
        TerminalConfig network = TerminalConfig.network(TERMINAL_ADDRESS);
        this.terminalConfig = new TerminalConfig(network.connectionType(), network.address(), network.port(),
                network.connectTimeoutMs(), 500, 2_000, network.requiredCapability(), "",
                network.cacheTtlMs(), "");

        TerminalProtocol protocol = new TerminalProtocol(transport);
        this.cache = new TerminalCache(terminalConfig, clock);
        this.breakers = new CircuitBreakerRegistry(breakerConfig, clock, store);
        this.connections = new TerminalConnectionPool(protocol, breakers, cache, terminalConfig);
        this.discovery = new TerminalDiscovery(new NetworkScanner((host, port, timeout) -> false), protocol,
                DiscoveryConfig.defaults(), terminalConfig, clock);
        this.stateMachineFactory = new TransactionStateMachineFactory(store, clock);
        this.poller = new TransactionPoller(pollingConfig, clock, errorLogger);
        this.recoveryManager = new RecoveryManager(store, stateMachineFactory, inFlight, connections, poller, errorLogger);
        this.manager = new TransactionManager(store, inFlight, stateMachineFactory, new TransactionBuilder(clock), poller,
                cache, discovery, connections, breakers, recoveryManager, errorLogger, pollingConfig, terminalConfig, clock);
    }

    @Override
    public void close() {
        manager.close();
    }
}
