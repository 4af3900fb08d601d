package paylink.domain.terminal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paylink.dal.TerminalConfig;
import paylink.domain.breaker.CircuitBreakerRegistry;
import paylink.domain.terminal.transport.TerminalProtocol;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One connection per terminal id
 */
@Singleton
public class TerminalConnectionPool implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TerminalConnectionPool.class);

    private final TerminalProtocol protocol;
    private final CircuitBreakerRegistry breakers;
    private final TerminalCache cache;
    private final TerminalConfig config;
    private final Map<String, TerminalConnection> connections = new ConcurrentHashMap<>();

    @Inject
    public TerminalConnectionPool(TerminalProtocol protocol, CircuitBreakerRegistry breakers,
                                  TerminalCache cache, TerminalConfig config) {
        this.protocol = protocol;
        this.breakers = breakers;
        this.cache = cache;
        this.config = config;
    }

    /**
     * Connection to a discovered terminal, following it to its current address
     */
    public TerminalConnection get(Terminal terminal) {
        TerminalConnection connection = connections.compute(terminal.id(), (id, existing) -> {
            if (existing == null || existing.isClosed()) {
                return open(id, terminal.address());
            }
            existing.updateAddress(terminal.address());
            return existing;
        });
        return connection;
    }

    /**
     * Connection for a persisted record: its stored address, else the cached address of the terminal
     */
    public Optional<TerminalConnection> forRecord(String terminalId, String storedAddress) {
        TerminalConnection existing = connections.get(terminalId);
        if (existing != null && !existing.isClosed()) {
            return Optional.of(existing);
        }
        String address = storedAddress;
        if (address == null || address.isBlank()) {
            address = cache.findByTerminalId(terminalId).map(Terminal::address).orElse(null);
        }
        if (address == null || address.isBlank()) {
            logger.warn("No known address for terminal {}", terminalId);
            return Optional.empty();
        }
        String resolved = address;
        return Optional.of(connections.compute(terminalId, (id, current) ->
                current == null || current.isClosed() ? open(id, resolved) : current));
    }

    public Optional<TerminalConnection> find(String terminalId) {
        return Optional.ofNullable(connections.get(terminalId));
    }

    private TerminalConnection open(String terminalId, String address) {
        logger.info("Opening connection to terminal {} at {}", terminalId, address);
        return new TerminalConnection(terminalId, address, protocol, breakers.get(terminalId),
                Duration.ofMillis(config.requestTimeoutMs()), config.lockTimeoutMs(), this::onUnreachable);
    }

    private void onUnreachable(TerminalConnection connection) {
        cache.invalidateTerminal(connection.getTerminalId());
    }

    public int size() {
        return connections.size();
    }

    @Override
    public void close() {
        connections.values().forEach(TerminalConnection::close);
        connections.clear();
    }
}
