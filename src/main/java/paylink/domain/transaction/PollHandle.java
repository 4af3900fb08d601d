package paylink.domain.transaction;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Running poll of one transaction
 */
public class PollHandle {
    private final TransactionStateMachine stateMachine;
    private final AtomicInteger pollCount = new AtomicInteger();
    private volatile ScheduledFuture<?> timer;
    private volatile boolean stopped = false;

    PollHandle(TransactionStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    /**
     * Completes with the final record
     */
    public CompletableFuture<TransactionRecord> result() {
        return stateMachine.completion();
    }

    /**
     * Stop polling without touching the record
     */
    public void cancel() {
        stopped = true;
        ScheduledFuture<?> current = timer;
        if (current != null) {
            current.cancel(false);
        }
    }

    public boolean isDone() {
        return stopped || stateMachine.isFinal();
    }

    public int getPollCount() {
        return pollCount.get();
    }

    public String getTransactionId() {
        return stateMachine.getId();
    }

    boolean isStopped() {
        return stopped;
    }

    int incrementPollCount() {
        return pollCount.incrementAndGet();
    }

    void setTimer(ScheduledFuture<?> timer) {
        this.timer = timer;
        if (stopped) {
            timer.cancel(false);
        }
    }
}
