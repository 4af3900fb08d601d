package paylink.domain.terminal.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Probes an address range in parallel for hosts accepting TCP connections on the terminal port
 */
public class NetworkScanner {
    private static final Logger logger = LoggerFactory.getLogger(NetworkScanner.class);
    private static final long SCAN_SLACK_MS = 1_000;

    private final IHostProbe probe;

    @Inject
    public NetworkScanner() {
        this(NetworkScanner::tcpConnect);
    }

    public NetworkScanner(IHostProbe probe) {
        this.probe = probe;
    }

    /**
     * @return responding hosts as host:port, in range order
     */
    public List<String> scan(AddressRange range, int port, int concurrency, int perHostTimeoutMs) {
        List<String> hosts = range.hosts();
        if (hosts.isEmpty()) {
            return List.of();
        }
        int threads = Math.max(1, Math.min(concurrency, hosts.size()));
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads, r -> {
            Thread thread = new Thread(r, "terminal-scan-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        logger.info("Scanning {} on port {} ({} threads, {}ms per host)", range, port, threads, perHostTimeoutMs);
        long waves = (hosts.size() + threads - 1) / threads;
        long deadlineMs = waves * perHostTimeoutMs + SCAN_SLACK_MS;

        List<Callable<Boolean>> probes = new ArrayList<>(hosts.size());
        for (String host : hosts) {
            probes.add(() -> probe.probe(host, port, perHostTimeoutMs));
        }

        List<String> found = new ArrayList<>();
        try {
            List<Future<Boolean>> results = pool.invokeAll(probes, deadlineMs, TimeUnit.MILLISECONDS);
            for (int i = 0; i < results.size(); i++) {
                if (isAlive(results.get(i), hosts.get(i))) {
                    found.add(hosts.get(i) + ":" + port);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Network scan interrupted, returning {} hosts found so far", found.size());
        } finally {
            pool.shutdownNow();
        }
        logger.info("Network scan found {} candidate(s): {}", found.size(), found);
        return found;
    }

    private static boolean isAlive(Future<Boolean> result, String host) throws InterruptedException {
        try {
            return Boolean.TRUE.equals(result.get());
        } catch (CancellationException e) {
            logger.debug("Probe of {} did not finish before the scan deadline", host);
            return false;
        } catch (ExecutionException e) {
            logger.debug("Probe of {} failed: {}", host, e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return false;
        }
    }

    static boolean tcpConnect(String host, int port, int timeoutMs) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), timeoutMs);
            return true;
        } catch (IOException e) {
            // refused, timed out or unroutable: not a candidate
            return false;
        }
    }
}
