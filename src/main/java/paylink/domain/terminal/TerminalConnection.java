package paylink.domain.terminal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paylink.domain.breaker.CircuitBreaker;
import paylink.domain.error.ETerminalError;
import paylink.domain.error.TerminalException;
import paylink.domain.terminal.transport.TerminalProtocol;
import paylink.domain.terminal.transport.dto.CancelResponse;
import paylink.domain.terminal.transport.dto.IdentityResponse;
import paylink.domain.terminal.transport.dto.StatusResponse;
import paylink.domain.terminal.transport.dto.SubmitResponse;
import paylink.domain.transaction.TransactionRequest;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Logical session with one terminal.
 *
 * <p>All calls to the terminal are serialized through one fair lock taken with a bounded wait.
 * Submit and cancel go through the circuit breaker; status and identity queries only report
 * their outcome to it. The connection also owns the single worker thread that runs the poll
 * timers of this terminal.</p>
 */
public class TerminalConnection implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TerminalConnection.class);
    private static final int UNREACHABLE_LIMIT = 2;

    private final String terminalId;
    private final TerminalProtocol protocol;
    private final CircuitBreaker breaker;
    private final Duration requestTimeout;
    private final long lockTimeoutMs;
    private final Consumer<TerminalConnection> unreachableListener;

    private final ReentrantLock sessionLock = new ReentrantLock(true);
    private final AtomicInteger consecutiveUnreachable = new AtomicInteger();
    private final ScheduledExecutorService worker;

    private volatile String address;
    private volatile boolean closed = false;

    public TerminalConnection(String terminalId, String address, TerminalProtocol protocol, CircuitBreaker breaker,
                              Duration requestTimeout, long lockTimeoutMs,
                              Consumer<TerminalConnection> unreachableListener) {
        this.terminalId = terminalId;
        this.address = address;
        this.protocol = protocol;
        this.breaker = breaker;
        this.requestTimeout = requestTimeout;
        this.lockTimeoutMs = lockTimeoutMs;
        this.unreachableListener = unreachableListener;
        this.worker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "terminal-" + terminalId);
            thread.setDaemon(true);
            return thread;
        });
    }

    public SubmitResponse submit(TransactionRequest request) throws TerminalException {
        return gated("submit", () -> protocol.submit(address, request, requestTimeout));
    }

    public CancelResponse cancel(String terminalTransactionId) throws TerminalException {
        return gated("cancel", () -> protocol.cancel(address, terminalTransactionId, requestTimeout));
    }

    public StatusResponse queryStatus(String terminalTransactionId) throws TerminalException {
        return passive("status", () -> protocol.status(address, terminalTransactionId, requestTimeout));
    }

    public IdentityResponse identity() throws TerminalException {
        return passive("identity", () -> protocol.identity(address, requestTimeout));
    }

    private <T> T gated(String operation, TerminalCall<T> call) throws TerminalException {
        lockSession(operation);
        try {
            CircuitBreaker.Permit permit = breaker.acquire();
            try {
                T result = call.execute();
                permit.success();
                onReachable();
                return result;
            } catch (TerminalException e) {
                permit.failure();
                onFailure(operation, e);
                throw e;
            } catch (RuntimeException e) {
                permit.failure();
                throw e;
            }
        } finally {
            sessionLock.unlock();
        }
    }

    private <T> T passive(String operation, TerminalCall<T> call) throws TerminalException {
        lockSession(operation);
        try {
            T result = call.execute();
            breaker.recordSuccess();
            onReachable();
            return result;
        } catch (TerminalException e) {
            breaker.recordFailure();
            onFailure(operation, e);
            throw e;
        } finally {
            sessionLock.unlock();
        }
    }

    private void lockSession(String operation) throws TerminalException {
        if (closed) {
            throw new TerminalException(ETerminalError.UNREACHABLE, terminalId, "Connection to terminal " + terminalId + " is closed");
        }
        try {
            if (!sessionLock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS)) {
                // nothing was sent, the session stayed busy
                throw new TerminalException(ETerminalError.UNREACHABLE, terminalId,
                        "Terminal " + terminalId + " session busy for " + lockTimeoutMs + "ms, " + operation + " not sent");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TerminalException(ETerminalError.UNREACHABLE, terminalId, "Interrupted waiting for terminal session", e);
        }
    }

    private void onReachable() {
        consecutiveUnreachable.set(0);
    }

    private void onFailure(String operation, TerminalException e) {
        logger.warn("Terminal {} {} failed: {} {}", terminalId, operation, e.getKind(), e.getMessage());
        if (e.getKind() == ETerminalError.UNREACHABLE) {
            if (consecutiveUnreachable.incrementAndGet() >= UNREACHABLE_LIMIT && unreachableListener != null) {
                unreachableListener.accept(this);
            }
        } else {
            consecutiveUnreachable.set(0);
        }
    }

    /**
     * Run a task on this terminal's worker thread
     */
    public ScheduledFuture<?> schedule(Runnable task, long delayMillis) {
        return worker.schedule(task, Math.max(0, delayMillis), TimeUnit.MILLISECONDS);
    }

    public void updateAddress(String newAddress) {
        if (!newAddress.equals(address)) {
            logger.info("Terminal {} moved from {} to {}", terminalId, address, newAddress);
            address = newAddress;
        }
    }

    public String getTerminalId() {
        return terminalId;
    }

    public String getAddress() {
        return address;
    }

    public int getConsecutiveUnreachable() {
        return consecutiveUnreachable.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        worker.shutdown();
        try {
            if (!worker.awaitTermination(2, TimeUnit.SECONDS)) {
                logger.warn("Worker of terminal {} did not terminate in time, forcing shutdown", terminalId);
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Connection to terminal {} closed", terminalId);
    }

    @FunctionalInterface
    private interface TerminalCall<T> {
        T execute() throws TerminalException;
    }
}
