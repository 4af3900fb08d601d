package paylink.domain.terminal.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paylink.domain.error.ErrorHandler;
import paylink.domain.error.ETerminalError;
import paylink.domain.error.TerminalException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * HTTP/1.1 transport to a terminal on the local network
 */
public class HttpTerminalTransport implements ITerminalTransport {
    private static final Logger logger = LoggerFactory.getLogger(HttpTerminalTransport.class);

    private final HttpClient httpClient;

    public HttpTerminalTransport(Duration connectTimeout) {
        this(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build());
    }

    HttpTerminalTransport(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public TransportResponse exchange(String address, TransportRequest request, Duration timeout) throws TerminalException {
        HttpRequest httpRequest;
        try {
            httpRequest = buildRequest(address, request, timeout);
        } catch (IllegalArgumentException e) {
            throw new TerminalException(ETerminalError.UNREACHABLE, address, "Invalid terminal address '" + address + "'", e);
        }

        logger.debug("Tx {} {}", address, request);
        try {
            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            logger.debug("Rx {} {} -> {}", address, request, response.statusCode());
            return new TransportResponse(response.statusCode(), response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TerminalException(ETerminalError.TIMEOUT, address, "Interrupted while waiting for " + request, e);
        } catch (IOException e) {
            // Anything after a successful connect may have reached the terminal, so it is a TIMEOUT not UNREACHABLE
            ETerminalError kind = ErrorHandler.classify(e);
            if (kind != ETerminalError.UNREACHABLE) {
                kind = ETerminalError.TIMEOUT;
            }
            throw new TerminalException(kind, address, request + " failed: " + e.getMessage(), e);
        }
    }

    private static HttpRequest buildRequest(String address, TransportRequest request, Duration timeout) {
        URI uri = URI.create("http://" + address + request.path());

        HttpRequest.BodyPublisher body = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(request.body(), StandardCharsets.UTF_8);

        return HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .method(request.method(), body)
                .build();
    }
}
