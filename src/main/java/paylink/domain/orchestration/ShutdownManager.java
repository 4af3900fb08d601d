package paylink.domain.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paylink.dal.store.ITransactionStore;
import paylink.domain.transaction.TransactionManager;

import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Manages graceful shutdown of the payment integration
 * @since 19/10/2026
 */
@Singleton
public class ShutdownManager {
    private static final Logger logger = LoggerFactory.getLogger(ShutdownManager.class);

    private final TransactionManager transactionManager;
    private final ITransactionStore store;

    private volatile boolean shutdownHookRegistered = false;
    private volatile boolean shutDown = false;

    @Inject
    public ShutdownManager(TransactionManager transactionManager, ITransactionStore store) {
        this.transactionManager = transactionManager;
        this.store = store;
    }

    /**
     * Register shutdown hook
     */
    public synchronized void registerShutdownHook() {
        if (!shutdownHookRegistered) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "paylink-shutdown"));
            shutdownHookRegistered = true;
        }
    }

    /**
     * Graceful shutdown: stop polling and terminal connections, compact the transaction log, then close it.
     * Compaction runs only once nothing else writes to the store.
     */
    public synchronized void shutdown() {
        if (shutDown) {
            return;
        }
        shutDown = true;
        logger.info("Shutting down payment integration...");

        try {
            transactionManager.close();
        } catch (Exception e) {
            logger.error("Error stopping transaction manager", e);
        }

        try {
            store.compact();
        } catch (Exception e) {
            logger.error("Error compacting transaction store, the full log is kept", e);
        }

        try {
            store.close();
        } catch (Exception e) {
            logger.error("Error closing transaction store", e);
        }

        logger.info("Payment integration shut down");
    }

    public boolean isShutDown() {
        return shutDown;
    }
}
