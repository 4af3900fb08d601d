package paylink.domain.terminal;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import paylink.common.JsonSupport;
import paylink.dal.TerminalConfig;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last known good terminal per register.
 * Entries older than the TTL or marked unreachable are not returned by {@link #get(String)},
 * but stay available as the last known terminal of the register.
 */
@Singleton
public class TerminalCache {
    private static final Logger logger = LoggerFactory.getLogger(TerminalCache.class);
    private static final Type SNAPSHOT_TYPE = new TypeToken<Map<String, Terminal>>() { }.getType();

    private final Map<String, Terminal> terminals = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;
    private final Path snapshotFile;
    private final Gson gson = JsonSupport.pretty();

    @Inject
    public TerminalCache(TerminalConfig config, Clock clock) {
        this.clock = clock;
        this.ttl = Duration.ofMillis(config.cacheTtlMs());
        this.snapshotFile = config.hasCacheFile() ? Paths.get(config.cacheFile()) : null;
        loadSnapshot();
    }

    /**
     * Active terminal of the register, empty if unknown, expired or invalidated
     */
    public Optional<Terminal> get(String registerId) {
        Terminal terminal = terminals.get(registerId);
        if (terminal == null || terminal.status() == ETerminalStatus.UNREACHABLE || isExpired(terminal)) {
            return Optional.empty();
        }
        return Optional.of(terminal);
    }

    /**
     * Last terminal the register used, regardless of its status
     */
    public Optional<Terminal> getLastKnown(String registerId) {
        return Optional.ofNullable(terminals.get(registerId));
    }

    public void put(String registerId, Terminal terminal) {
        terminals.put(registerId, terminal.withStatus(ETerminalStatus.REACHABLE));
        logger.info("Register {} uses terminal {} at {}", registerId, terminal.id(), terminal.address());
        saveSnapshot();
    }

    public void invalidate(String registerId) {
        if (terminals.computeIfPresent(registerId, (k, t) -> t.withStatus(ETerminalStatus.UNREACHABLE)) != null) {
            logger.info("Terminal cache entry of register {} invalidated", registerId);
            saveSnapshot();
        }
    }

    /**
     * Invalidate every register entry pointing at the terminal
     */
    public void invalidateTerminal(String terminalId) {
        boolean changed = false;
        for (Map.Entry<String, Terminal> entry : terminals.entrySet()) {
            Terminal terminal = entry.getValue();
            if (terminal.id().equals(terminalId) && terminal.status() != ETerminalStatus.UNREACHABLE) {
                entry.setValue(terminal.withStatus(ETerminalStatus.UNREACHABLE));
                changed = true;
            }
        }
        if (changed) {
            logger.warn("Terminal {} invalidated in cache (repeatedly unreachable)", terminalId);
            saveSnapshot();
        }
    }

    /**
     * Any cached entry of the terminal, used to find the address of a terminal by id
     */
    public Optional<Terminal> findByTerminalId(String terminalId) {
        return terminals.values().stream()
                .filter(t -> t.id().equals(terminalId))
                .findFirst();
    }

    public void remove(String registerId) {
        if (terminals.remove(registerId) != null) {
            saveSnapshot();
        }
    }

    public int size() {
        return terminals.size();
    }

    private boolean isExpired(Terminal terminal) {
        return terminal.lastSeenAt() == null || terminal.lastSeenAt().plus(ttl).isBefore(clock.instant());
    }

    private void loadSnapshot() {
        if (snapshotFile == null || !Files.isRegularFile(snapshotFile)) {
            return;
        }
        try {
            Map<String, Terminal> loaded = gson.fromJson(Files.readString(snapshotFile, StandardCharsets.UTF_8), SNAPSHOT_TYPE);
            if (loaded != null) {
                loaded.forEach((registerId, terminal) -> {
                    if (registerId != null && terminal != null && terminal.id() != null) {
                        terminals.put(registerId, terminal);
                    }
                });
            }
            logger.info("Loaded {} cached terminals from {}", terminals.size(), snapshotFile.toAbsolutePath());
        } catch (IOException | JsonParseException e) {
            logger.warn("Ignoring unreadable terminal cache {}: {}", snapshotFile, e.getMessage());
        }
    }

    private synchronized void saveSnapshot() {
        if (snapshotFile == null) {
            return;
        }
        try {
            Path parent = snapshotFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = snapshotFile.resolveSibling(snapshotFile.getFileName() + ".tmp");
            Files.writeString(temp, gson.toJson(new HashMap<>(terminals), SNAPSHOT_TYPE), StandardCharsets.UTF_8);
            Files.move(temp, snapshotFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            // the cache is rebuilt by discovery, a lost snapshot only costs a scan
            logger.warn("Failed to write terminal cache {}: {}", snapshotFile, e.getMessage());
        }
    }
}
