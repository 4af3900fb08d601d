package paylink.domain.terminal.transport;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import paylink.domain.error.ETerminalError;
import paylink.domain.error.TerminalException;
import paylink.domain.terminal.transport.dto.CancelResponse;
import paylink.domain.terminal.transport.dto.ERemoteStatus;
import paylink.domain.terminal.transport.dto.StatusResponse;
import paylink.domain.transaction.TransactionRequest;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for HttpTerminalTransport against an embedded terminal
 * @since 19/10/2026
 */
class HttpTerminalTransportTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private FakeTerminalServer server;
    private HttpTerminalTransport transport;

    @BeforeEach
    void setUp() {
        server = new FakeTerminalServer("T-HTTP", List.of("SALE", "CANCEL"), 1).start();
        transport = new HttpTerminalTransport(Duration.ofMillis(500));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    // ========== Exchange Tests ==========

    @Test
    @DisplayName("Should return status code and body of a GET")
    void shouldReturnStatusAndBody() throws TerminalException {
        // When
        TransportResponse response = transport.exchange(server.address(), TransportRequest.get(TerminalProtocol.PATH_IDENTITY), TIMEOUT);

        // Then
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.body()).contains("\"terminalId\":\"T-HTTP\"");
    }

    @Test
    @DisplayName("Should pass HTTP 404 through as a response")
    void shouldPassNotFoundThrough() throws TerminalException {
        // When
        TransportResponse response = transport.exchange(server.address(), TransportRequest.get("/transactions/unknown"), TIMEOUT);

        // Then
        assertThat(response.isNotFound()).isTrue();
    }

    @Test
    @DisplayName("Should send the POST body to the terminal")
    void shouldSendPostBody() throws TerminalException {
        // When
        TransportResponse response = transport.exchange(server.address(),
                TransportRequest.post(TerminalProtocol.PATH_TRANSACTIONS,
                        "{\"terminalTransactionId\":\"tx-1\",\"amount\":1250,\"currency\":\"GBP\"}"), TIMEOUT);

        // Then
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("\"accepted\":true");
        assertThat(server.getSubmitCount()).isEqualTo(1);
    }

    // ========== Failure Classification Tests ==========

    @Test
    @DisplayName("Should report a refused connection as UNREACHABLE")
    void shouldReportRefusedConnectionAsUnreachable() throws IOException {
        // Given
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        // When & Then
        assertThatThrownBy(() -> transport.exchange("127.0.0.1:" + closedPort, TransportRequest.get(TerminalProtocol.PATH_IDENTITY), TIMEOUT))
                .isInstanceOf(TerminalException.class)
                .extracting(e -> ((TerminalException) e).getKind())
                .isEqualTo(ETerminalError.UNREACHABLE);
    }

    @Test
    @DisplayName("Should report a slow answer as TIMEOUT")
    void shouldReportSlowAnswerAsTimeout() {
        // Given
        server.setResponseDelayMs(1_000);

        // When & Then
        assertThatThrownBy(() -> transport.exchange(server.address(), TransportRequest.get(TerminalProtocol.PATH_IDENTITY), Duration.ofMillis(150)))
                .isInstanceOf(TerminalException.class)
                .extracting(e -> ((TerminalException) e).getKind())
                .isEqualTo(ETerminalError.TIMEOUT);
    }

    @Test
    @DisplayName("Should report an invalid address as UNREACHABLE")
    void shouldReportInvalidAddressAsUnreachable() {
        assertThatThrownBy(() -> transport.exchange("bad host:80", TransportRequest.get(TerminalProtocol.PATH_IDENTITY), TIMEOUT))
                .isInstanceOf(TerminalException.class)
                .extracting(e -> ((TerminalException) e).getKind())
                .isEqualTo(ETerminalError.UNREACHABLE);
    }

    // ========== Protocol over HTTP Tests ==========

    @Test
    @DisplayName("Should run a sale over HTTP: submit, processing, completed with slip")
    void shouldRunSaleOverHttp() throws TerminalException {
        // Given
        TerminalProtocol protocol = new TerminalProtocol(transport);
        TransactionRequest request = new TransactionRequest("tx-http-1", 1250, "GBP", "R-1");

        // When
        boolean accepted = protocol.submit(server.address(), request, TIMEOUT).isAccepted();
        StatusResponse first = protocol.status(server.address(), "tx-http-1", TIMEOUT);
        StatusResponse second = protocol.status(server.address(), "tx-http-1", TIMEOUT);

        // Then
        assertThat(accepted).isTrue();
        assertThat(first.getRemoteStatus()).isEqualTo(ERemoteStatus.PROCESSING);
        assertThat(second.getRemoteStatus()).isEqualTo(ERemoteStatus.COMPLETED);
        assertThat(second.toCardSlip().authCode()).isEqualTo("A1B2C3");
        assertThat(second.toCardSlip().cardLast4()).isEqualTo("4242");
    }

    @Test
    @DisplayName("Should cancel a processing sale over HTTP and reject a second cancel")
    void shouldCancelOverHttp() throws TerminalException {
        // Given
        TerminalProtocol protocol = new TerminalProtocol(transport);
        protocol.submit(server.address(), new TransactionRequest("tx-http-2", 500, "GBP", null), TIMEOUT);

        // When
        CancelResponse first = protocol.cancel(server.address(), "tx-http-2", TIMEOUT);
        CancelResponse second = protocol.cancel(server.address(), "tx-http-2", TIMEOUT);

        // Then
        assertThat(first.isOk()).isTrue();
        assertThat(second.isOk()).isFalse();
        assertThat(protocol.status(server.address(), "tx-http-2", TIMEOUT).getRemoteStatus()).isEqualTo(ERemoteStatus.CANCELLED);
    }
}
