package paylink.domain.terminal.transport;

/**
 * One HTTP-like request to a terminal
 *
 * @param body JSON body, null for GET
 */
public record TransportRequest(String method, String path, String body) {

    public static TransportRequest get(String path) {
        return new TransportRequest("GET", path, null);
    }

    public static TransportRequest post(String path, String body) {
        return new TransportRequest("POST", path, body == null ? "{}" : body);
    }

    @Override
    public String toString() {
        return method + " " + path;
    }
}
