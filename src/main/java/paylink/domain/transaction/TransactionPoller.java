package paylink.domain.transaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paylink.common.ExponentialBackoff;
import paylink.dal.PollingConfig;
import paylink.domain.error.ETerminalError;
import paylink.domain.error.ErrorHandler;
import paylink.domain.error.ErrorLogger;
import paylink.domain.error.TerminalException;
import paylink.domain.terminal.TerminalConnection;
import paylink.domain.terminal.transport.dto.StatusResponse;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;

/**
 * Polls the terminal for the status of sent transactions.
 *
 * <p>Polls run on the connection's worker thread with delays {@code min(initial * 2^n, max)}, clipped
 * so the last poll lands on the deadline {@code start + maxPollDuration}. Without a final status by
 * then the record is TIMED_OUT with its outcome flagged unknown.</p>
 */
@Singleton
public class TransactionPoller {
    private static final Logger logger = LoggerFactory.getLogger(TransactionPoller.class);

    private final PollingConfig config;
    private final Clock clock;
    private final ErrorLogger errorLogger;
    private final ExponentialBackoff backoff;
    private final Map<String, PollHandle> active = new ConcurrentHashMap<>();

    @Inject
    public TransactionPoller(PollingConfig config, Clock clock, ErrorLogger errorLogger) {
        this.config = config;
        this.clock = clock;
        this.errorLogger = errorLogger;
        this.backoff = new ExponentialBackoff(config.initialIntervalMs(), config.maxIntervalMs());
    }

    public PollHandle poll(TransactionStateMachine stateMachine, TerminalConnection connection) {
        PollHandle handle = new PollHandle(stateMachine);
        if (stateMachine.isFinal()) {
            return handle;
        }
        long deadline = clock.millis() + config.maxPollDurationMs();
        active.put(stateMachine.getId(), handle);
        stateMachine.completion().whenComplete((record, error) -> {
            handle.cancel();
            active.remove(stateMachine.getId(), handle);
        });

        logger.debug("Polling transaction {} on terminal {} for up to {}ms",
                stateMachine.getId(), connection.getTerminalId(), config.maxPollDurationMs());
        schedule(new PollTask(stateMachine, connection, handle, deadline), Math.min(backoff.delayMillis(0), config.maxPollDurationMs()));
        return handle;
    }

    private void schedule(PollTask task, long delayMillis) {
        if (task.handle.isStopped()) {
            return;
        }
        try {
            task.handle.setTimer(task.connection.schedule(task, delayMillis));
        } catch (RejectedExecutionException e) {
            logger.warn("Polling of transaction {} stopped, terminal {} connection closed",
                    task.stateMachine.getId(), task.connection.getTerminalId());
            task.handle.cancel();
        }
    }

    /**
     * Stop every running poll (shutdown), records stay as they are and are picked up by recovery
     */
    public void stopAll() {
        active.values().forEach(PollHandle::cancel);
        active.clear();
    }

    public int getActiveCount() {
        return active.size();
    }

    private final class PollTask implements Runnable {
        private final TransactionStateMachine stateMachine;
        private final TerminalConnection connection;
        private final PollHandle handle;
        private final long deadline;
        private int attempt = 1;

        PollTask(TransactionStateMachine stateMachine, TerminalConnection connection, PollHandle handle, long deadline) {
            this.stateMachine = stateMachine;
            this.connection = connection;
            this.handle = handle;
            this.deadline = deadline;
        }

        @Override
        public void run() {
            if (handle.isStopped() || stateMachine.isFinal()) {
                return;
            }
            String id = stateMachine.getId();
            try {
                try {
                    StatusResponse status = connection.queryStatus(id);
                    int count = handle.incrementPollCount();
                    logger.debug("Poll #{} of transaction {}: {}", count, id, status.getRemoteStatus());
                    stateMachine.applyRemoteStatus(status);
                } catch (TerminalException e) {
                    handle.incrementPollCount();
                    errorLogger.record("poll", id, connection.getTerminalId(), e);
                    stateMachine.noteError(ErrorHandler.describe(e));
                }
                if (stateMachine.isFinal()) {
                    return;
                }

                long now = clock.millis();
                if (now >= deadline) {
                    TransactionRecord timedOut = stateMachine.timeOut(ErrorHandler.describe(ETerminalError.TIMED_OUT,
                            "no final status after " + config.maxPollDurationMs() + "ms"));
                    if (timedOut.outcomeUnknown()) {
                        errorLogger.recordOutcomeUnknown(timedOut);
                    }
                    return;
                }
                schedule(this, Math.min(backoff.delayMillis(attempt++), deadline - now));
            } catch (RuntimeException e) {
                errorLogger.record("poll", id, connection.getTerminalId(), e);
                stateMachine.abort(e);
            }
        }
    }
}
