package paylink.domain.error;

import com.google.gson.JsonParseException;
import paylink.dal.store.TransactionStoreException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * Classifies failures into the terminal error taxonomy.
 *
 * <p>The {@code lastError} column of a transaction record uses the form {@code "KIND: message"},
 * written by {@link #describe(Throwable)} and read back by {@link #kindOf(String)}.</p>
 */
public final class ErrorHandler {
    private ErrorHandler() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static ETerminalError classify(Throwable error) {
        if (error == null) {
            return ETerminalError.FAILED;
        }
        if (error instanceof TerminalException) {
            return ((TerminalException) error).getKind();
        }
        if (error instanceof PaymentException) {
            return ((PaymentException) error).getKind();
        }
        // connect timeout must be checked before the generic HTTP timeout (it is a subclass)
        if (error instanceof HttpConnectTimeoutException
                || error instanceof ConnectException
                || error instanceof NoRouteToHostException
                || error instanceof UnknownHostException) {
            return ETerminalError.UNREACHABLE;
        }
        if (error instanceof HttpTimeoutException || error instanceof SocketTimeoutException) {
            return ETerminalError.TIMEOUT;
        }
        if (error instanceof JsonParseException) {
            return ETerminalError.MALFORMED_RESPONSE;
        }
        if (error instanceof TransactionStoreException) {
            return ETerminalError.FAILED;
        }
        if (error.getCause() != null && error.getCause() != error) {
            return classify(error.getCause());
        }
        return ETerminalError.FAILED;
    }

    public static boolean isTransient(Throwable error) {
        return classify(error).isTransient();
    }

    /**
     * Format an error for the lastError column
     */
    public static String describe(Throwable error) {
        return describe(classify(error), error == null ? null : error.getMessage());
    }

    public static String describe(ETerminalError kind, String message) {
        return message == null || message.isBlank() ? kind.name() : kind.name() + ": " + message;
    }

    /**
     * Parse the kind back out of a lastError value, null if absent or not in the expected form
     */
    public static ETerminalError kindOf(String lastError) {
        if (lastError == null || lastError.isBlank()) {
            return null;
        }
        int colon = lastError.indexOf(':');
        String name = colon < 0 ? lastError.trim() : lastError.substring(0, colon).trim();
        try {
            return ETerminalError.valueOf(name);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
