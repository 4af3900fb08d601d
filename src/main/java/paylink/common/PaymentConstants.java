package paylink.common;

/**
 * Payment terminal integration defaults
 * @since 19/10/2026
 */
public final class PaymentConstants {
    private PaymentConstants() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    // Terminal session
    public static final int DEFAULT_TERMINAL_PORT = 8080;
    public static final int DEFAULT_REQUEST_TIMEOUT_MS = 5_000;
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 2_000;
    public static final int DEFAULT_LOCK_TIMEOUT_MS = 10_000;
    public static final String DEFAULT_REQUIRED_CAPABILITY = "SALE";
    public static final long DEFAULT_CACHE_TTL_MS = 24L * 60 * 60 * 1000;    // 24 hours
    public static final String DEFAULT_CACHE_FILE = "data/terminal-cache.json";

    // Discovery
    public static final String DEFAULT_DISCOVERY_RANGE = "192.168.1.0/24";
    public static final int DEFAULT_DISCOVERY_CONCURRENCY = 32;
    public static final int DEFAULT_PROBE_TIMEOUT_MS = 300;
    public static final int DEFAULT_MAX_HOSTS = 1024;

    // Polling
    public static final int DEFAULT_POLL_INITIAL_MS = 1_000;
    public static final int DEFAULT_POLL_MAX_MS = 5_000;
    public static final int DEFAULT_MAX_POLL_DURATION_MS = 120_000;         // 2 minutes

    // Circuit breaker
    public static final int DEFAULT_FAILURE_THRESHOLD = 3;
    public static final int DEFAULT_BREAKER_BASE_BACKOFF_MS = 5_000;
    public static final int DEFAULT_BREAKER_MAX_BACKOFF_MS = 60_000;

    // Durable store
    public static final String DEFAULT_STORE_FILE = "data/transactions.jsonl";

    // Waiting for a concurrent charge with the same idempotency key to create its record
    public static final long IN_FLIGHT_CLAIM_WAIT_MS = 60_000;

    // Dedicated logger for the payment audit trail (see log4j2.xml)
    public static final String AUDIT_LOGGER = "PaymentAudit";
}
