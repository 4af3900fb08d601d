package paylink.domain.breaker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paylink.dal.CircuitBreakerConfig;
import paylink.dal.store.ITransactionStore;
import paylink.domain.error.ETerminalError;
import paylink.domain.error.ErrorHandler;
import paylink.domain.transaction.ETransactionState;
import paylink.domain.transaction.TransactionRecord;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * One circuit breaker per terminal id, created on first use.
 * A new breaker is rebuilt from the terminal's recent records in the transaction store.
 */
@Singleton
public class CircuitBreakerRegistry {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ITransactionStore store;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    @Inject
    public CircuitBreakerRegistry(CircuitBreakerConfig config, Clock clock, ITransactionStore store) {
        this.config = config;
        this.clock = clock;
        this.store = store;
    }

    public CircuitBreaker get(String terminalId) {
        return breakers.computeIfAbsent(terminalId, this::create);
    }

    public Optional<CircuitBreaker> find(String terminalId) {
        return Optional.ofNullable(breakers.get(terminalId));
    }

    private CircuitBreaker create(String terminalId) {
        CircuitBreaker breaker = new CircuitBreaker(terminalId, config, clock);

        List<TransactionRecord> recent = store.findRecentByTerminal(terminalId, config.failureThreshold());
        if (recent.size() >= config.failureThreshold() && recent.stream().allMatch(this::isTransportFailure)) {
            breaker.restoreOpen(1, recent.get(0).updatedAt());
        } else {
            logger.debug("Circuit breaker for terminal {} created CLOSED", terminalId);
        }
        return breaker;
    }

    /**
     * FAILED because nothing reached the terminal: refused by the terminal's network or by its open breaker.
     * A submit timeout never ends FAILED, the record is polled instead.
     */
    private boolean isTransportFailure(TransactionRecord record) {
        if (record.state() != ETransactionState.FAILED) {
            return false;
        }
        ETerminalError kind = ErrorHandler.kindOf(record.lastError());
        return kind == ETerminalError.UNREACHABLE || kind == ETerminalError.CIRCUIT_OPEN;
    }

    public Map<String, CircuitBreakerState> getStates() {
        return breakers.values().stream()
                .collect(Collectors.toMap(CircuitBreaker::getTerminalId, CircuitBreaker::getState));
    }
}
