package paylink.domain.recovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paylink.dal.store.ITransactionStore;
import paylink.domain.error.ETerminalError;
import paylink.domain.error.ErrorHandler;
import paylink.domain.error.ErrorLogger;
import paylink.domain.error.TerminalException;
import paylink.domain.terminal.TerminalConnection;
import paylink.domain.terminal.TerminalConnectionPool;
import paylink.domain.terminal.transport.dto.ERemoteStatus;
import paylink.domain.terminal.transport.dto.StatusResponse;
import paylink.domain.transaction.ETransactionState;
import paylink.domain.transaction.InFlightIndex;
import paylink.domain.transaction.TransactionPoller;
import paylink.domain.transaction.TransactionRecord;
import paylink.domain.transaction.TransactionStateMachine;
import paylink.domain.transaction.TransactionStateMachineFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drives records left unresolved by a previous run to a final state.
 *
 * <p>Each record moves to RECOVERY_PENDING and the terminal is asked for its status. A final status
 * is adopted, "processing" resumes polling, anything else times the record out with its outcome
 * unknown. A charge is never sent again.</p>
 */
@Singleton
public class RecoveryManager {
    private static final Logger logger = LoggerFactory.getLogger(RecoveryManager.class);

    private final ITransactionStore store;
    private final TransactionStateMachineFactory stateMachineFactory;
    private final InFlightIndex inFlight;
    private final TerminalConnectionPool connections;
    private final TransactionPoller poller;
    private final ErrorLogger errorLogger;

    @Inject
    public RecoveryManager(ITransactionStore store,
                           TransactionStateMachineFactory stateMachineFactory,
                           InFlightIndex inFlight,
                           TerminalConnectionPool connections,
                           TransactionPoller poller,
                           ErrorLogger errorLogger) {
        this.store = store;
        this.stateMachineFactory = stateMachineFactory;
        this.inFlight = inFlight;
        this.connections = connections;
        this.poller = poller;
        this.errorLogger = errorLogger;
    }

    /**
     * @return the records reconciled by this run, in their state after the status query
     */
    public synchronized List<TransactionRecord> reconcilePending() {
        List<TransactionRecord> unresolved = store.findUnresolved();
        List<TransactionRecord> reconciled = new ArrayList<>();

        for (TransactionRecord record : unresolved) {
            if (inFlight.isTracked(record.id())) {
                logger.debug("Transaction {} already tracked, skipping", record.id());
                continue;
            }
            TransactionStateMachine stateMachine = stateMachineFactory.resume(record);
            if (!inFlight.track(stateMachine)) {
                continue;
            }
            try {
                reconciled.add(reconcile(stateMachine));
            } catch (RuntimeException e) {
                errorLogger.record("recovery", record.id(), record.terminalId(), e);
                stateMachine.abort(e);
                reconciled.add(stateMachine.current());
            }
        }

        if (!reconciled.isEmpty()) {
            logger.info("Recovery reconciled {} of {} unresolved transaction(s)", reconciled.size(), unresolved.size());
        } else {
            logger.info("Recovery found no unresolved transactions to reconcile");
        }
        return reconciled;
    }

    private TransactionRecord reconcile(TransactionStateMachine stateMachine) {
        TransactionRecord record = stateMachine.current();
        logger.info("Recovering transaction {} found in state {}", record.id(), record.state());
        if (record.state() != ETransactionState.RECOVERY_PENDING) {
            stateMachine.transition(ETransactionState.RECOVERY_PENDING, null);
        }

        Optional<TerminalConnection> connection = connections.forRecord(record.terminalId(), record.terminalAddress());
        if (connection.isEmpty()) {
            return giveUp(stateMachine, ErrorHandler.describe(ETerminalError.NO_TERMINAL,
                    "no address for terminal " + record.terminalId()));
        }

        StatusResponse status;
        try {
            status = connection.get().queryStatus(record.id());
        } catch (TerminalException e) {
            errorLogger.record("recovery", record.id(), record.terminalId(), e);
            return giveUp(stateMachine, ErrorHandler.describe(e));
        }

        ERemoteStatus remoteStatus = status.getRemoteStatus();
        if (remoteStatus == ERemoteStatus.NOT_FOUND) {
            return giveUp(stateMachine, ErrorHandler.describe(ETerminalError.TIMED_OUT,
                    "terminal does not know the transaction"));
        }

        TransactionRecord updated = stateMachine.applyRemoteStatus(status);
        if (updated.state() == ETransactionState.DECLINED) {
            errorLogger.recordDeclined(updated);
        } else if (updated.state() == ETransactionState.POLLING) {
            poller.poll(stateMachine, connection.get());
        }
        logger.info("Transaction {} recovered as {}", updated.id(), updated.state());
        return updated;
    }

    private TransactionRecord giveUp(TransactionStateMachine stateMachine, String reason) {
        TransactionRecord timedOut = stateMachine.timeOut(reason);
        errorLogger.recordOutcomeUnknown(timedOut);
        return timedOut;
    }
}
