package paylink.domain.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paylink.common.PaymentConstants;
import paylink.domain.transaction.TransactionRecord;

import javax.inject.Singleton;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Records classified terminal errors to the payment audit log and keeps per-kind counters
 */
@Singleton
public class ErrorLogger {
    private static final Logger auditLogger = LoggerFactory.getLogger(PaymentConstants.AUDIT_LOGGER);

    private final Map<ETerminalError, AtomicLong> counters = new ConcurrentHashMap<>();

    /**
     * Record a failure in the given operation context
     * @return the classified kind
     */
    public ETerminalError record(String context, String transactionId, String terminalId, Throwable error) {
        ETerminalError kind = ErrorHandler.classify(error);
        counters.computeIfAbsent(kind, k -> new AtomicLong()).incrementAndGet();

        String message = error == null ? "" : error.getMessage();
        if (kind.isTransient()) {
            auditLogger.warn("op={} kind={} transient=true tx={} terminal={} msg={}",
                    context, kind, transactionId, terminalId, message);
        } else {
            auditLogger.error("op={} kind={} transient=false tx={} terminal={} msg={}",
                    context, kind, transactionId, terminalId, message, error);
        }
        return kind;
    }

    /**
     * Flag a record whose outcome is unknown and needs manual or automated reconciliation
     */
    public void recordOutcomeUnknown(TransactionRecord record) {
        counters.computeIfAbsent(ETerminalError.TIMED_OUT, k -> new AtomicLong()).incrementAndGet();
        auditLogger.error("op=reconcile kind={} tx={} key={} terminal={} amount={} {} lastError={} - outcome unknown, reconcile before retrying",
                ETerminalError.TIMED_OUT, record.id(), record.idempotencyKey(), record.terminalId(),
                record.amount(), record.currency(), record.lastError());
    }

    /**
     * Record a terminal-reported decline (business outcome, not a fault)
     */
    public void recordDeclined(TransactionRecord record) {
        counters.computeIfAbsent(ETerminalError.DECLINED, k -> new AtomicLong()).incrementAndGet();
        auditLogger.info("op=charge kind={} tx={} key={} terminal={} amount={} {}",
                ETerminalError.DECLINED, record.id(), record.idempotencyKey(), record.terminalId(),
                record.amount(), record.currency());
    }

    public long getCount(ETerminalError kind) {
        AtomicLong counter = counters.get(kind);
        return counter == null ? 0 : counter.get();
    }

    public Map<ETerminalError, Long> getCounts() {
        Map<ETerminalError, Long> snapshot = new EnumMap<>(ETerminalError.class);
        counters.forEach((kind, counter) -> snapshot.put(kind, counter.get()));
        return snapshot;
    }
}
