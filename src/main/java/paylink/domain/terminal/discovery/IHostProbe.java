package paylink.domain.terminal.discovery;

/**
 * Liveness probe of one host
 */
@FunctionalInterface
public interface IHostProbe {
    boolean probe(String host, int port, int timeoutMs);
}
