package paylink.domain.terminal.transport;

/**
 * Raw terminal answer
 */
public record TransportResponse(int statusCode, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
