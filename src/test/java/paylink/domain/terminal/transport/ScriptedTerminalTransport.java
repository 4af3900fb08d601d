package paylink.domain.terminal.transport;

import paylink.domain.error.ETerminalError;
import paylink.domain.error.TerminalException;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fake terminal answering from per-operation scripts, counting every exchange.
 * A script step is used once; when a script is empty the operation's default step answers.
 */
public class ScriptedTerminalTransport implements ITerminalTransport {

    public enum EOperation { SUBMIT, STATUS, CANCEL, IDENTITY, OTHER }

    @FunctionalInterface
    public interface Step {
        TransportResponse respond(TransportRequest request) throws TerminalException;
    }

    private final Map<EOperation, Deque<Step>> scripts = new EnumMap<>(EOperation.class);
    private final Map<EOperation, Step> defaults = new EnumMap<>(EOperation.class);
    private final Map<EOperation, AtomicInteger> counters = new EnumMap<>(EOperation.class);
    private final List<TransportRequest> requests = new CopyOnWriteArrayList<>();
    private volatile long submitDelayMs = 0;

    public ScriptedTerminalTransport() {
        for (EOperation operation : EOperation.values()) {
            scripts.put(operation, new ArrayDeque<>());
            counters.put(operation, new AtomicInteger());
        }
        defaults.put(EOperation.SUBMIT, json("{\"accepted\":true}"));
        defaults.put(EOperation.STATUS, json("{\"status\":\"processing\"}"));
        defaults.put(EOperation.CANCEL, json("{\"result\":\"ok\"}"));
        defaults.put(EOperation.IDENTITY, json("{\"terminalId\":\"T1\",\"model\":\"Test Terminal\",\"capabilities\":[\"SALE\"]}"));
        defaults.put(EOperation.OTHER, code(404, "{}"));
    }

    // ========== Steps ==========

    public static Step json(String body) {
        return request -> new TransportResponse(200, body);
    }

    public static Step code(int statusCode, String body) {
        return request -> new TransportResponse(statusCode, body);
    }

    public static Step status(String status) {
        return json("{\"status\":\"" + status + "\"}");
    }

    public static Step notFound() {
        return code(404, "{}");
    }

    public static Step fail(ETerminalError kind) {
        return request -> {
            throw new TerminalException(kind, "scripted", "scripted " + kind + " for " + request);
        };
    }

    // ========== Scripting ==========

    public synchronized ScriptedTerminalTransport script(EOperation operation, Step... steps) {
        Collections.addAll(scripts.get(operation), steps);
        return this;
    }

    public synchronized ScriptedTerminalTransport byDefault(EOperation operation, Step step) {
        defaults.put(operation, step);
        return this;
    }

    public void setSubmitDelayMs(long submitDelayMs) {
        this.submitDelayMs = submitDelayMs;
    }

    @Override
    public TransportResponse exchange(String address, TransportRequest request, Duration timeout) throws TerminalException {
        EOperation operation = classify(request);
        counters.get(operation).incrementAndGet();
        requests.add(request);
        if (operation == EOperation.SUBMIT && submitDelayMs > 0) {
            try {
                Thread.sleep(submitDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        Step step;
        synchronized (this) {
            Step scripted = scripts.get(operation).poll();
            step = scripted != null ? scripted : defaults.get(operation);
        }
        return step.respond(request);
    }

    private static EOperation classify(TransportRequest request) {
        String path = request.path();
        if (TerminalProtocol.PATH_IDENTITY.equals(path)) {
            return EOperation.IDENTITY;
        }
        if ("POST".equals(request.method()) && TerminalProtocol.PATH_TRANSACTIONS.equals(path)) {
            return EOperation.SUBMIT;
        }
        if ("POST".equals(request.method()) && path.endsWith("/cancel")) {
            return EOperation.CANCEL;
        }
        if ("GET".equals(request.method()) && path.startsWith(TerminalProtocol.PATH_TRANSACTIONS + "/")) {
            return EOperation.STATUS;
        }
        return EOperation.OTHER;
    }

    // ========== Counters ==========

    public int count(EOperation operation) {
        return counters.get(operation).get();
    }

    public int totalCalls() {
        return counters.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    public List<TransportRequest> getRequests() {
        return requests;
    }
}
