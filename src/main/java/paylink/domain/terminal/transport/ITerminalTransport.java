package paylink.domain.terminal.transport;

import paylink.domain.error.TerminalException;

import java.time.Duration;

/**
 * Low-level request/response exchange with a terminal address (host:port).
 * Implementations map connect failures to UNREACHABLE and unanswered requests to TIMEOUT.
 */
public interface ITerminalTransport {

    /**
     * Execute one request, bounded by the given timeout
     */
    TransportResponse exchange(String address, TransportRequest request, Duration timeout) throws TerminalException;
}
