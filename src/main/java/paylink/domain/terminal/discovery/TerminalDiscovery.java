package paylink.domain.terminal.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paylink.dal.DiscoveryConfig;
import paylink.dal.TerminalConfig;
import paylink.domain.error.TerminalException;
import paylink.domain.terminal.ETerminalStatus;
import paylink.domain.terminal.Terminal;
import paylink.domain.terminal.transport.TerminalProtocol;
import paylink.domain.terminal.transport.dto.IdentityResponse;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finds payment terminals: scan (or the configured fixed address), then identity handshake
 * and capability check on every candidate.
 */
@Singleton
public class TerminalDiscovery {
    private static final Logger logger = LoggerFactory.getLogger(TerminalDiscovery.class);

    private final NetworkScanner scanner;
    private final TerminalProtocol protocol;
    private final DiscoveryConfig discoveryConfig;
    private final TerminalConfig terminalConfig;
    private final Clock clock;

    @Inject
    public TerminalDiscovery(NetworkScanner scanner, TerminalProtocol protocol, DiscoveryConfig discoveryConfig,
                             TerminalConfig terminalConfig, Clock clock) {
        this.scanner = scanner;
        this.protocol = protocol;
        this.discoveryConfig = discoveryConfig;
        this.terminalConfig = terminalConfig;
        this.clock = clock;
    }

    /**
     * Validated terminals in address order, empty if none answered
     */
    public List<Terminal> discover() {
        List<String> candidates;
        if (terminalConfig.hasFixedAddress()) {
            candidates = List.of(terminalConfig.address());
        } else {
            AddressRange range = AddressRange.parse(discoveryConfig.range(), discoveryConfig.maxHosts());
            candidates = scanner.scan(range, terminalConfig.port(), discoveryConfig.concurrency(),
                    discoveryConfig.probeTimeoutMs());
        }

        List<Terminal> terminals = new ArrayList<>();
        for (String address : candidates) {
            handshake(address).ifPresent(terminals::add);
        }
        logger.info("Discovered {} terminal(s) out of {} candidate(s)", terminals.size(), candidates.size());
        return terminals;
    }

    /**
     * The configured preferred terminal if found, else the first one
     */
    public Optional<Terminal> discoverPreferred() {
        List<Terminal> terminals = discover();
        String preferred = terminalConfig.preferredTerminalId();
        if (preferred != null && !preferred.isBlank()) {
            Optional<Terminal> match = terminals.stream().filter(t -> t.id().equals(preferred)).findFirst();
            if (match.isPresent()) {
                return match;
            }
            logger.warn("Preferred terminal {} not found, using the first discovered", preferred);
        }
        return terminals.stream().findFirst();
    }

    /**
     * Identity handshake with one candidate
     */
    public Optional<Terminal> handshake(String address) {
        IdentityResponse identity;
        try {
            identity = protocol.identity(address, Duration.ofMillis(terminalConfig.requestTimeoutMs()));
        } catch (TerminalException e) {
            logger.debug("Candidate {} rejected: {} {}", address, e.getKind(), e.getMessage());
            return Optional.empty();
        }
        if (!identity.hasCapability(terminalConfig.requiredCapability())) {
            logger.info("Candidate {} ({}) lacks capability {}", address, identity.getModel(), terminalConfig.requiredCapability());
            return Optional.empty();
        }
        String id = identity.getTerminalId() == null || identity.getTerminalId().isBlank()
                ? address
                : identity.getTerminalId();
        Set<String> capabilities = identity.getCapabilities().stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        return Optional.of(new Terminal(id, address, identity.getModel(), capabilities,
                clock.instant(), ETerminalStatus.REACHABLE));
    }
}
