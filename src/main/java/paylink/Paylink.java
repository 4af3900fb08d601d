package paylink;

import com.google.inject.Guice;
import com.google.inject.Injector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paylink.dal.ConfigurationService;
import paylink.domain.error.PaymentException;
import paylink.domain.orchestration.ShutdownManager;
import paylink.domain.terminal.Terminal;
import paylink.domain.terminal.discovery.TerminalDiscovery;
import paylink.domain.transaction.ChargeIntent;
import paylink.domain.transaction.TransactionManager;
import paylink.domain.transaction.TransactionRecord;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Main entry point of the payment terminal integration.
 * <pre>
 * paylink                                           reconcile unresolved transactions
 * paylink discover                                  list the terminals on the network
 * paylink charge &lt;amount&gt; &lt;currency&gt; &lt;register&gt; &lt;key&gt;  charge in minor units
 * paylink status &lt;transactionId&gt;
 * paylink resolve &lt;transactionId&gt;                    reconcile a timed out transaction
 * </pre>
 * @since 19/10/2026
 */
public class Paylink {
    private static final Logger logger = LoggerFactory.getLogger(Paylink.class);

    public static void main(String[] args) {
        logger.info("Starting Paylink payment terminal integration...");

        ShutdownManager shutdownManager = null;
        try {
            // Load all configurations from DAL
            ConfigurationService configService = new ConfigurationService();
            logger.info("Configuration loaded successfully");
            logger.debug("Terminal: {}", configService.getTerminalConfiguration());
            logger.debug("Polling: {}", configService.getPollingConfiguration());
            logger.debug("Circuit breaker: {}", configService.getCircuitBreakerConfiguration());

            Injector injector = Guice.createInjector(new GuiceModule(configService));

            shutdownManager = injector.getInstance(ShutdownManager.class);
            shutdownManager.registerShutdownHook();

            TransactionManager transactionManager = injector.getInstance(TransactionManager.class);
            transactionManager.start();

            run(args, injector, transactionManager);
        } catch (PaymentException e) {
            logger.error("Payment failed: {} {}", e.getKind(), e.getMessage());
            System.exit(2);
        } catch (IllegalArgumentException | NoSuchElementException e) {
            logger.error("Invalid arguments: {}", e.getMessage());
            System.exit(64);
        } catch (Exception e) {
            logger.error("Failed to start application", e);
            System.exit(1);
        } finally {
            if (shutdownManager != null) {
                shutdownManager.shutdown();
            }
        }
    }

    private static void run(String[] args, Injector injector, TransactionManager transactionManager) {
        String command = args.length == 0 ? "reconcile" : args[0];
        switch (command) {
            case "reconcile":
                // recovery already ran in start()
                break;
            case "discover":
                List<Terminal> terminals = injector.getInstance(TerminalDiscovery.class).discover();
                terminals.forEach(t -> logger.info("Terminal {} at {} ({}, {})", t.id(), t.address(), t.model(), t.capabilities()));
                break;
            case "charge":
                requireArgs(args, 5);
                TransactionRecord record = transactionManager.charge(
                        new ChargeIntent(parseAmount(args[1]), args[2], args[3], args[4]));
                logger.info("Charge result: {}", record);
                break;
            case "status":
                requireArgs(args, 2);
                logger.info("Transaction: {}", transactionManager.getStatus(args[1]));
                break;
            case "resolve":
                requireArgs(args, 2);
                logger.info("Transaction: {}", transactionManager.resolveUnknownOutcome(args[1]));
                break;
            default:
                throw new IllegalArgumentException("Unknown command '" + command + "'");
        }
    }

    private static void requireArgs(String[] args, int count) {
        if (args.length < count) {
            throw new IllegalArgumentException("Command '" + args[0] + "' needs " + (count - 1) + " argument(s)");
        }
    }

    private static long parseAmount(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Amount must be in minor units, got '" + value + "'", e);
        }
    }
}
