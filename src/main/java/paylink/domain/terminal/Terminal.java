package paylink.domain.terminal;

import java.time.Instant;
import java.util.Set;

/**
 * Payment terminal found on the local network
 *
 * @param id terminal id from the identity handshake, the address if the terminal reports none
 * @param address host:port
 */
public record Terminal(
        String id,
        String address,
        String model,
        Set<String> capabilities,
        Instant lastSeenAt,
        ETerminalStatus status) {

    public Terminal {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    public Terminal withStatus(ETerminalStatus newStatus) {
        return new Terminal(id, address, model, capabilities, lastSeenAt, newStatus);
    }

    public boolean hasCapability(String capability) {
        return capabilities.stream().anyMatch(c -> c.equalsIgnoreCase(capability));
    }
}
