package paylink.domain.terminal.transport;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import paylink.common.JsonSupport;
import paylink.domain.error.ETerminalError;
import paylink.domain.error.TerminalException;
import paylink.domain.terminal.transport.dto.CancelResponse;
import paylink.domain.terminal.transport.dto.ERemoteStatus;
import paylink.domain.terminal.transport.dto.IdentityResponse;
import paylink.domain.terminal.transport.dto.StatusResponse;
import paylink.domain.terminal.transport.dto.SubmitResponse;
import paylink.domain.transaction.TransactionRequest;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Terminal wire protocol on top of a transport.
 * <pre>
 * POST /transactions              {terminalTransactionId, amount, currency, reference?} -> {accepted, reason?}
 * GET  /transactions/{id}         -> {status, reference?, authCode?, cardBrand?, cardLast4?, cardType?} (404 = unknown id)
 * POST /transactions/{id}/cancel  -> {result: ok|rejected}
 * GET  /identity                  -> {terminalId?, model, capabilities}
 * </pre>
 * Unexpected status codes, unparsable JSON and missing fields are reported as MALFORMED_RESPONSE.
 */
@Singleton
public class TerminalProtocol {
    public static final String PATH_TRANSACTIONS = "/transactions";
    public static final String PATH_IDENTITY = "/identity";

    private final ITerminalTransport transport;
    private final Gson gson = JsonSupport.compact();

    @Inject
    public TerminalProtocol(ITerminalTransport transport) {
        this.transport = transport;
    }

    public IdentityResponse identity(String address, Duration timeout) throws TerminalException {
        TransportResponse response = transport.exchange(address, TransportRequest.get(PATH_IDENTITY), timeout);
        IdentityResponse identity = decode(address, "identity", response, IdentityResponse.class);
        if (!identity.isWellFormed()) {
            throw malformed(address, "identity payload without model or capabilities");
        }
        return identity;
    }

    public SubmitResponse submit(String address, TransactionRequest request, Duration timeout) throws TerminalException {
        TransportResponse response = transport.exchange(address,
                TransportRequest.post(PATH_TRANSACTIONS, gson.toJson(request)), timeout);
        SubmitResponse submit = decode(address, "submit", response, SubmitResponse.class);
        if (submit.getAccepted() == null) {
            throw malformed(address, "submit answer without 'accepted'");
        }
        return submit;
    }

    public StatusResponse status(String address, String terminalTransactionId, Duration timeout) throws TerminalException {
        TransportResponse response = transport.exchange(address,
                TransportRequest.get(transactionPath(terminalTransactionId)), timeout);
        if (response.isNotFound()) {
            return StatusResponse.notFound();
        }
        StatusResponse status = decode(address, "status", response, StatusResponse.class);
        ERemoteStatus remoteStatus = status.getRemoteStatus();
        if (remoteStatus == null || remoteStatus == ERemoteStatus.NOT_FOUND) {
            throw malformed(address, "unknown transaction status '" + status.getStatus() + "'");
        }
        return status;
    }

    public CancelResponse cancel(String address, String terminalTransactionId, Duration timeout) throws TerminalException {
        TransportResponse response = transport.exchange(address,
                TransportRequest.post(transactionPath(terminalTransactionId) + "/cancel", "{}"), timeout);
        CancelResponse cancel = decode(address, "cancel", response, CancelResponse.class);
        if (!cancel.isWellFormed()) {
            throw malformed(address, "unknown cancel result '" + cancel.getResult() + "'");
        }
        return cancel;
    }

    private static String transactionPath(String terminalTransactionId) {
        return PATH_TRANSACTIONS + "/" + URLEncoder.encode(terminalTransactionId, StandardCharsets.UTF_8);
    }

    private <T> T decode(String address, String operation, TransportResponse response, Class<T> type) throws TerminalException {
        if (!response.isSuccess()) {
            throw malformed(address, operation + " answered HTTP " + response.statusCode());
        }
        if (response.body() == null || response.body().isBlank()) {
            throw malformed(address, operation + " answered with an empty body");
        }
        try {
            T decoded = gson.fromJson(response.body(), type);
            if (decoded == null) {
                throw malformed(address, operation + " answered with a null payload");
            }
            return decoded;
        } catch (JsonParseException e) {
            throw new TerminalException(ETerminalError.MALFORMED_RESPONSE, address,
                    operation + " answered with invalid JSON: " + e.getMessage(), e);
        }
    }

    private static TerminalException malformed(String address, String message) {
        return new TerminalException(ETerminalError.MALFORMED_RESPONSE, address, message);
    }
}
