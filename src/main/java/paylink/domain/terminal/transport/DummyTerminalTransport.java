package paylink.domain.terminal.transport;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paylink.common.JsonSupport;
import paylink.domain.terminal.transport.dto.CancelResponse;
import paylink.domain.terminal.transport.dto.ERemoteStatus;
import paylink.domain.terminal.transport.dto.IdentityResponse;
import paylink.domain.terminal.transport.dto.StatusResponse;
import paylink.domain.terminal.transport.dto.SubmitResponse;
import paylink.domain.transaction.TransactionRequest;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dummy Terminal - used when no physical payment terminal is available.
 * Accepts every sale, answers "processing" for a few polls and then completes it.
 * Amounts ending in 51 minor units are declined, like the usual test-card conventions.
 */
public class DummyTerminalTransport implements ITerminalTransport {
    private static final Logger logger = LoggerFactory.getLogger(DummyTerminalTransport.class);

    public static final String DUMMY_TERMINAL_ID = "DUMMY-01";
    private static final int DECLINE_SUFFIX = 51;

    private final Gson gson = JsonSupport.compact();
    private final Map<String, DummyTransaction> transactions = new ConcurrentHashMap<>();
    private final int processingPolls;

    public DummyTerminalTransport() {
        this(2);
    }

    public DummyTerminalTransport(int processingPolls) {
        this.processingPolls = processingPolls;
        logger.info("DummyTerminalTransport created (no physical hardware), completing after {} polls", processingPolls);
    }

    @Override
    public TransportResponse exchange(String address, TransportRequest request, Duration timeout) {
        String path = request.path();

        if ("GET".equals(request.method()) && TerminalProtocol.PATH_IDENTITY.equals(path)) {
            return ok(new IdentityResponse(DUMMY_TERMINAL_ID, "Dummy Terminal", List.of("SALE", "CANCEL")));
        }
        if ("POST".equals(request.method()) && TerminalProtocol.PATH_TRANSACTIONS.equals(path)) {
            return submit(request.body());
        }
        if (path.startsWith(TerminalProtocol.PATH_TRANSACTIONS + "/")) {
            String rest = path.substring(TerminalProtocol.PATH_TRANSACTIONS.length() + 1);
            if ("POST".equals(request.method()) && rest.endsWith("/cancel")) {
                return cancel(rest.substring(0, rest.length() - "/cancel".length()));
            }
            if ("GET".equals(request.method())) {
                return status(rest);
            }
        }
        return new TransportResponse(404, "{}");
    }

    private TransportResponse submit(String body) {
        TransactionRequest request;
        try {
            request = gson.fromJson(body, TransactionRequest.class);
        } catch (JsonParseException e) {
            return new TransportResponse(400, "{}");
        }
        if (request == null || request.terminalTransactionId() == null || request.amount() <= 0) {
            return ok(new SubmitResponse(false, "invalid request"));
        }
        DummyTransaction existing = transactions.putIfAbsent(request.terminalTransactionId(), new DummyTransaction(request));
        if (existing != null) {
            logger.debug("DummyTerminal: duplicate submit {}", request.terminalTransactionId());
        } else {
            logger.debug("DummyTerminal: accepted {} ({} {})", request.terminalTransactionId(), request.amount(), request.currency());
        }
        return ok(new SubmitResponse(true, null));
    }

    private TransportResponse status(String id) {
        DummyTransaction transaction = transactions.get(id);
        if (transaction == null) {
            return new TransportResponse(404, "{}");
        }
        return ok(transaction.poll());
    }

    private TransportResponse cancel(String id) {
        DummyTransaction transaction = transactions.get(id);
        if (transaction == null) {
            return ok(new CancelResponse(CancelResponse.RESULT_REJECTED));
        }
        return ok(new CancelResponse(transaction.cancel() ? CancelResponse.RESULT_OK : CancelResponse.RESULT_REJECTED));
    }

    private TransportResponse ok(Object payload) {
        return new TransportResponse(200, gson.toJson(payload));
    }

    /**
     * Number of sales the dummy terminal has accepted
     */
    public int getAcceptedCount() {
        return transactions.size();
    }

    private final class DummyTransaction {
        private final TransactionRequest request;
        private int polls;
        private ERemoteStatus status = ERemoteStatus.PROCESSING;

        DummyTransaction(TransactionRequest request) {
            this.request = request;
        }

        synchronized StatusResponse poll() {
            if (status == ERemoteStatus.PROCESSING && ++polls > processingPolls) {
                status = request.amount() % 100 == DECLINE_SUFFIX ? ERemoteStatus.DECLINED : ERemoteStatus.COMPLETED;
            }
            StatusResponse response = StatusResponse.of(status);
            if (status == ERemoteStatus.COMPLETED) {
                response.setReference("DMY" + Math.abs(request.terminalTransactionId().hashCode()));
                response.setAuthCode(String.format("%06d", Math.abs(request.terminalTransactionId().hashCode()) % 1_000_000));
                response.setCardBrand("VISA");
                response.setCardLast4("0000");
                response.setCardType("CONTACTLESS");
            }
            return response;
        }

        synchronized boolean cancel() {
            if (status != ERemoteStatus.PROCESSING) {
                return false;
            }
            status = ERemoteStatus.CANCELLED;
            return true;
        }
    }
}
