package paylink.domain.transaction;

import io.reactivex.rxjava3.core.Observable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paylink.common.PaymentConstants;
import paylink.dal.PollingConfig;
import paylink.dal.TerminalConfig;
import paylink.dal.store.ITransactionStore;
import paylink.dal.store.TransactionStoreException;
import paylink.domain.breaker.CircuitBreakerRegistry;
import paylink.domain.error.ETerminalError;
import paylink.domain.error.ErrorHandler;
import paylink.domain.error.ErrorLogger;
import paylink.domain.error.PaymentException;
import paylink.domain.error.TerminalException;
import paylink.domain.recovery.RecoveryManager;
import paylink.domain.terminal.Terminal;
import paylink.domain.terminal.TerminalCache;
import paylink.domain.terminal.TerminalConnection;
import paylink.domain.terminal.TerminalConnectionPool;
import paylink.domain.terminal.discovery.TerminalDiscovery;
import paylink.domain.terminal.transport.dto.CancelResponse;
import paylink.domain.terminal.transport.dto.ERemoteStatus;
import paylink.domain.terminal.transport.dto.StatusResponse;
import paylink.domain.terminal.transport.dto.SubmitResponse;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Clock;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point of the POS domain into card payments.
 *
 * <p>A charge is submitted at most once per idempotency key: concurrent charges with the same key
 * get the record of the first one, a completed purchase is never charged again, and a purchase whose
 * last attempt timed out with an unknown outcome is refused until it is reconciled.</p>
 *
 * @since 19/10/2026
 */
@Singleton
public class TransactionManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TransactionManager.class);

    private final ITransactionStore store;
    private final InFlightIndex inFlight;
    private final TransactionStateMachineFactory stateMachineFactory;
    private final TransactionBuilder builder;
    private final TransactionPoller poller;
    private final TerminalCache cache;
    private final TerminalDiscovery discovery;
    private final TerminalConnectionPool connections;
    private final CircuitBreakerRegistry breakers;
    private final RecoveryManager recoveryManager;
    private final ErrorLogger errorLogger;
    private final PollingConfig pollingConfig;
    private final TerminalConfig terminalConfig;
    private final Clock clock;

    private volatile boolean recovered = false;
    private volatile boolean closed = false;

    @Inject
    public TransactionManager(ITransactionStore store,
                              InFlightIndex inFlight,
                              TransactionStateMachineFactory stateMachineFactory,
                              TransactionBuilder builder,
                              TransactionPoller poller,
                              TerminalCache cache,
                              TerminalDiscovery discovery,
                              TerminalConnectionPool connections,
                              CircuitBreakerRegistry breakers,
                              RecoveryManager recoveryManager,
                              ErrorLogger errorLogger,
                              PollingConfig pollingConfig,
                              TerminalConfig terminalConfig,
                              Clock clock) {
        this.store = store;
        this.inFlight = inFlight;
        this.stateMachineFactory = stateMachineFactory;
        this.builder = builder;
        this.poller = poller;
        this.cache = cache;
        this.discovery = discovery;
        this.connections = connections;
        this.breakers = breakers;
        this.recoveryManager = recoveryManager;
        this.errorLogger = errorLogger;
        this.pollingConfig = pollingConfig;
        this.terminalConfig = terminalConfig;
        this.clock = clock;
    }

    /**
     * Reconcile unresolved transactions left by a previous run. Charges do it lazily if not called.
     */
    public void start() {
        ensureRecovered();
    }

    /**
     * Charge a card on the register's terminal and wait for the outcome.
     *
     * @return the final record (COMPLETED, DECLINED, FAILED, TIMED_OUT or CANCELLED), or the in-flight
     *         record of a concurrent charge with the same idempotency key
     * @throws IllegalArgumentException for an invalid intent
     * @throws PaymentException NO_TERMINAL, CIRCUIT_OPEN, OUTCOME_UNKNOWN, or FAILED when the record cannot be written
     */
    public TransactionRecord charge(ChargeIntent intent) {
        intent.validate();
        if (closed) {
            throw new IllegalStateException("Transaction manager is closed");
        }
        ensureRecovered();

        String key = intent.idempotencyKey();
        while (true) {
            Optional<CompletableFuture<TransactionStateMachine>> owner = inFlight.claim(key);
            if (owner.isPresent()) {
                TransactionStateMachine existing = awaitClaim(key, owner.get());
                if (existing != null) {
                    logger.info("Charge with key {} already in flight as {}, not sent again", key, existing.getId());
                    return existing.current();
                }
                continue;
            }

            TransactionStateMachine stateMachine;
            TerminalConnection connection;
            TransactionRequest request;
            try {
                Optional<TransactionRecord> previous = store.findLatestByIdempotencyKey(key);
                if (previous.isPresent() && !needsNewAttempt(previous.get())) {
                    inFlight.abandon(key);
                    return previous.get();
                }
                int attempt = previous.map(r -> r.attempt() + 1).orElse(1);

                Terminal terminal = resolveTerminal(intent.registerId());
                connection = connections.get(terminal);
                request = builder.buildRequest(intent);
                stateMachine = stateMachineFactory.create(builder.buildRecord(request, intent, terminal, attempt));
            } catch (TransactionStoreException e) {
                inFlight.abandon(key);
                errorLogger.record("charge", null, null, e);
                throw new PaymentException(ETerminalError.FAILED, "Transaction could not be recorded: " + e.getMessage(), null, e);
            } catch (RuntimeException e) {
                inFlight.abandon(key);
                throw e;
            }
            inFlight.register(key, stateMachine);

            return execute(stateMachine, connection, request);
        }
    }

    private TransactionStateMachine awaitClaim(String key, CompletableFuture<TransactionStateMachine> claim) {
        try {
            return claim.get(PaymentConstants.IN_FLIGHT_CLAIM_WAIT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PaymentException(ETerminalError.FAILED, "Interrupted waiting for charge with key " + key);
        } catch (ExecutionException | TimeoutException e) {
            throw new PaymentException(ETerminalError.FAILED, "Charge with key " + key + " is still being prepared", null, e);
        }
    }

    /**
     * Idempotency rules for the latest record of a key
     * @return true if a new attempt may be sent
     */
    private boolean needsNewAttempt(TransactionRecord previous) {
        if (!previous.isTerminal()) {
            logger.warn("Key {} has unresolved transaction {} ({}) outside the in-flight index",
                    previous.idempotencyKey(), previous.id(), previous.state());
            return false;
        }
        if (previous.state() == ETransactionState.COMPLETED) {
            logger.info("Key {} already completed as {}, returning it", previous.idempotencyKey(), previous.id());
            return false;
        }
        if (previous.state() == ETransactionState.TIMED_OUT) {
            if (previous.outcomeUnknown()) {
                throw new PaymentException(ETerminalError.OUTCOME_UNKNOWN,
                        "Outcome of transaction " + previous.id() + " is unknown, reconcile it before charging again", previous);
            }
            if (previous.reconciledOutcome() == ERemoteStatus.COMPLETED) {
                logger.info("Key {} reconciled as completed ({}), returning it", previous.idempotencyKey(), previous.id());
                return false;
            }
        }
        return true;
    }

    /**
     * Cached terminal, the last known one while its breaker refuses calls, else discovery.
     * When discovery finds nothing the last known terminal is used, so its breaker keeps counting failures.
     */
    private Terminal resolveTerminal(String registerId) {
        Optional<Terminal> cached = cache.get(registerId);
        if (cached.isPresent()) {
            return cached.get();
        }
        Optional<Terminal> lastKnown = cache.getLastKnown(registerId);
        if (lastKnown.isPresent() && breakers.get(lastKnown.get().id()).isRejecting()) {
            return lastKnown.get();
        }

        logger.info("No cached terminal for register {}, discovering", registerId);
        Optional<Terminal> discovered = discovery.discoverPreferred();
        if (discovered.isEmpty() && lastKnown.isPresent()) {
            logger.warn("No terminal discovered for register {}, using last known terminal {}",
                    registerId, lastKnown.get().id());
            return lastKnown.get();
        }
        if (discovered.isEmpty()) {
            errorLogger.record("discover", null, null,
                    new PaymentException(ETerminalError.NO_TERMINAL, "No terminal found for register " + registerId));
            throw new PaymentException(ETerminalError.NO_TERMINAL, "No payment terminal found for register " + registerId);
        }
        cache.put(registerId, discovered.get());
        return discovered.get();
    }

    private TransactionRecord execute(TransactionStateMachine stateMachine, TerminalConnection connection,
                                      TransactionRequest request) {
        try {
            submit(stateMachine, connection, request);
        } catch (TransactionStoreException e) {
            stateMachine.abort(e);
            errorLogger.record("submit", stateMachine.getId(), connection.getTerminalId(), e);
            throw new PaymentException(ETerminalError.FAILED, "Transaction state could not be recorded", stateMachine.current(), e);
        }

        TransactionRecord record = stateMachine.current();
        if (record.isTerminal()) {
            if (ErrorHandler.kindOf(record.lastError()) == ETerminalError.CIRCUIT_OPEN) {
                throw new PaymentException(ETerminalError.CIRCUIT_OPEN,
                        "Terminal " + record.terminalId() + " is unavailable, charge not sent", record);
            }
            return record;
        }

        PollHandle handle = poller.poll(stateMachine, connection);
        TransactionRecord result = await(stateMachine, handle);
        if (result.state() == ETransactionState.DECLINED) {
            errorLogger.recordDeclined(result);
        }
        logger.info("Charge {} finished: {}", result.id(), result);
        return result;
    }

    private void submit(TransactionStateMachine stateMachine, TerminalConnection connection, TransactionRequest request) {
        stateMachine.getLock().lock();
        try {
            if (stateMachine.current().state() != ETransactionState.CREATED) {
                logger.info("Transaction {} is {} before submit, not sent", stateMachine.getId(), stateMachine.current().state());
                return;
            }
            try {
                SubmitResponse response = connection.submit(request);
                if (response.isAccepted()) {
                    stateMachine.transition(ETransactionState.SENT, null);
                } else {
                    stateMachine.transition(ETransactionState.FAILED, ErrorHandler.describe(ETerminalError.FAILED,
                            "terminal rejected the request: " + response.getReason()));
                }
            } catch (TerminalException e) {
                ETerminalError kind = errorLogger.record("submit", stateMachine.getId(), connection.getTerminalId(), e);
                if (kind == ETerminalError.TIMEOUT || kind == ETerminalError.MALFORMED_RESPONSE) {
                    // the terminal may have the transaction, polling decides
                    stateMachine.transition(ETransactionState.SENT, ErrorHandler.describe(e));
                } else {
                    stateMachine.transition(ETransactionState.FAILED, ErrorHandler.describe(e));
                }
            }
        } finally {
            stateMachine.getLock().unlock();
        }
    }

    private TransactionRecord await(TransactionStateMachine stateMachine, PollHandle handle) {
        long margin = 2L * terminalConfig.requestTimeoutMs() + terminalConfig.lockTimeoutMs();
        try {
            return handle.result().get(pollingConfig.maxPollDurationMs() + margin, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PaymentException(ETerminalError.FAILED, "Interrupted waiting for transaction " + stateMachine.getId(),
                    stateMachine.current(), e);
        } catch (ExecutionException e) {
            throw new PaymentException(ETerminalError.FAILED, "Transaction " + stateMachine.getId() + " could not be tracked",
                    stateMachine.current(), e.getCause());
        } catch (TimeoutException e) {
            logger.warn("Transaction {} still {} after the poll deadline", stateMachine.getId(), stateMachine.current().state());
            return stateMachine.current();
        }
    }

    /**
     * Cancel a transaction the terminal has not started processing.
     * CREATED is cancelled locally, SENT only if the terminal confirms.
     *
     * @return true if the transaction is now CANCELLED
     */
    public boolean cancel(String transactionId) {
        Optional<TransactionStateMachine> tracked = inFlight.find(transactionId);
        if (tracked.isEmpty()) {
            logger.info("Cancel of {} refused: not in flight", transactionId);
            return false;
        }
        TransactionStateMachine stateMachine = tracked.get();

        stateMachine.getLock().lock();
        try {
            TransactionRecord record = stateMachine.current();
            if (!record.state().isCancellable()) {
                logger.info("Cancel of {} refused in state {}", transactionId, record.state());
                return false;
            }
            if (record.state() == ETransactionState.CREATED) {
                stateMachine.transition(ETransactionState.CANCELLED, null);
                return true;
            }

            Optional<TerminalConnection> connection = connections.find(record.terminalId());
            if (connection.isEmpty()) {
                return false;
            }
            try {
                CancelResponse response = connection.get().cancel(transactionId);
                if (!response.isOk()) {
                    logger.info("Terminal {} rejected cancel of {}", record.terminalId(), transactionId);
                    return false;
                }
                stateMachine.transition(ETransactionState.CANCELLED, null);
                return true;
            } catch (TerminalException e) {
                errorLogger.record("cancel", transactionId, record.terminalId(), e);
                return false;
            }
        } finally {
            stateMachine.getLock().unlock();
        }
    }

    /**
     * @throws NoSuchElementException for an unknown transaction id
     */
    public TransactionRecord getStatus(String transactionId) {
        Optional<TransactionStateMachine> tracked = inFlight.find(transactionId);
        if (tracked.isPresent()) {
            return tracked.get().current();
        }
        return store.findById(transactionId)
                .orElseThrow(() -> new NoSuchElementException("Unknown transaction " + transactionId));
    }

    /**
     * Resolve unresolved records left by a crash. Never sends a charge.
     */
    public List<TransactionRecord> reconcilePending() {
        List<TransactionRecord> reconciled = recoveryManager.reconcilePending();
        recovered = true;
        return reconciled;
    }

    /**
     * Ask the terminal for the outcome of a TIMED_OUT transaction whose outcome is unknown.
     * An authoritative answer is stored as the reconciled outcome; the state stays TIMED_OUT.
     *
     * @throws NoSuchElementException for an unknown transaction id
     * @throws PaymentException if the terminal cannot be asked
     */
    public TransactionRecord resolveUnknownOutcome(String transactionId) {
        TransactionRecord record = getStatus(transactionId);
        if (record.state() != ETransactionState.TIMED_OUT || !record.outcomeUnknown()) {
            return record;
        }
        TerminalConnection connection = connections.forRecord(record.terminalId(), record.terminalAddress())
                .orElseThrow(() -> new PaymentException(ETerminalError.NO_TERMINAL,
                        "No known address for terminal " + record.terminalId(), record));

        StatusResponse status;
        try {
            status = connection.queryStatus(transactionId);
        } catch (TerminalException e) {
            ETerminalError kind = errorLogger.record("resolve", transactionId, record.terminalId(), e);
            throw new PaymentException(kind, "Outcome of " + transactionId + " still unknown: " + e.getMessage(), record, e);
        }

        ERemoteStatus outcome = status.getRemoteStatus();
        if (outcome == null || !outcome.isFinal()) {
            logger.info("Terminal reports {} for timed out transaction {}, outcome stays unknown", outcome, transactionId);
            return record;
        }
        TransactionRecord resolved = record.withReconciledOutcome(outcome, clock.instant());
        if (outcome == ERemoteStatus.COMPLETED) {
            resolved = resolved.withSlip(status.toCardSlip());
        }
        store.update(resolved);
        stateMachineFactory.publish(new TransactionStateEvent(resolved, record.state()));
        logger.info("Timed out transaction {} reconciled as {}", transactionId, outcome);
        return resolved;
    }

    public Observable<TransactionStateEvent> getStateChanges() {
        return stateMachineFactory.getStateChanges();
    }

    private void ensureRecovered() {
        if (recovered) {
            return;
        }
        synchronized (this) {
            if (!recovered) {
                recoveryManager.reconcilePending();
                recovered = true;
            }
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stop pollers and terminal connections; unresolved records are picked up by the next recovery
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        poller.stopAll();
        connections.close();
        stateMachineFactory.complete();
        logger.info("Transaction manager closed, {} transaction(s) left in flight", inFlight.size());
    }
}
