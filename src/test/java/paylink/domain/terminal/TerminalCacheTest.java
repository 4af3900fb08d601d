package paylink.domain.terminal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import paylink.common.ETerminalConnectionType;
import paylink.common.MutableClock;
import paylink.dal.TerminalConfig;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for TerminalCache
 * @since 19/10/2026
 */
class TerminalCacheTest {
    private static final long TTL_MS = 60_000;

    @TempDir
    Path tempDir;

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-10-19T10:00:00Z"));
    }

    private static TerminalConfig config(String cacheFile) {
        return new TerminalConfig(ETerminalConnectionType.NETWORK, "", 8080, 1_000, 1_000, 1_000,
                "SALE", "", TTL_MS, cacheFile);
    }

    private Terminal terminal(String id, String address) {
        return new Terminal(id, address, "Model X", Set.of("SALE"), clock.instant(), ETerminalStatus.UNKNOWN);
    }

    // ========== Lookup Tests ==========

    @Test
    @DisplayName("Should return a fresh entry as reachable")
    void shouldReturnFreshEntry() {
        // Given
        TerminalCache cache = new TerminalCache(config(""), clock);

        // When
        cache.put("REG-1", terminal("T1", "10.0.0.5:8080"));

        // Then
        assertThat(cache.get("REG-1")).get()
                .satisfies(t -> {
                    assertThat(t.id()).isEqualTo("T1");
                    assertThat(t.status()).isEqualTo(ETerminalStatus.REACHABLE);
                });
        assertThat(cache.get("REG-2")).isEmpty();
    }

    @Test
    @DisplayName("Should expire entries older than the TTL but keep them as last known")
    void shouldExpireAfterTtl() {
        // Given
        TerminalCache cache = new TerminalCache(config(""), clock);
        cache.put("REG-1", terminal("T1", "10.0.0.5:8080"));

        // When
        clock.advance(Duration.ofMillis(TTL_MS + 1));

        // Then
        assertThat(cache.get("REG-1")).isEmpty();
        assertThat(cache.getLastKnown("REG-1")).get().extracting(Terminal::id).isEqualTo("T1");
    }

    @Test
    @DisplayName("Should hide invalidated entries from get")
    void shouldInvalidate() {
        // Given
        TerminalCache cache = new TerminalCache(config(""), clock);
        cache.put("REG-1", terminal("T1", "10.0.0.5:8080"));
        cache.put("REG-2", terminal("T1", "10.0.0.5:8080"));
        cache.put("REG-3", terminal("T2", "10.0.0.6:8080"));

        // When
        cache.invalidate("REG-3");
        cache.invalidateTerminal("T1");

        // Then
        assertThat(cache.get("REG-1")).isEmpty();
        assertThat(cache.get("REG-2")).isEmpty();
        assertThat(cache.get("REG-3")).isEmpty();
        assertThat(cache.getLastKnown("REG-1")).get().extracting(Terminal::status).isEqualTo(ETerminalStatus.UNREACHABLE);
        assertThat(cache.findByTerminalId("T2")).get().extracting(Terminal::address).isEqualTo("10.0.0.6:8080");
        assertThat(cache.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should make a re-put entry reachable again")
    void shouldRevalidateOnPut() {
        // Given
        TerminalCache cache = new TerminalCache(config(""), clock);
        cache.put("REG-1", terminal("T1", "10.0.0.5:8080"));
        cache.invalidate("REG-1");

        // When
        cache.put("REG-1", terminal("T1", "10.0.0.7:8080"));

        // Then
        assertThat(cache.get("REG-1")).get().extracting(Terminal::address).isEqualTo("10.0.0.7:8080");
    }

    // ========== Snapshot Tests ==========

    @Test
    @DisplayName("Should restore entries from the snapshot file")
    void shouldRestoreSnapshot() {
        // Given
        String file = tempDir.resolve("cache/terminals.json").toString();
        TerminalCache first = new TerminalCache(config(file), clock);
        first.put("REG-1", terminal("T1", "10.0.0.5:8080"));

        // When
        TerminalCache second = new TerminalCache(config(file), clock);

        // Then
        assertThat(second.get("REG-1")).get()
                .satisfies(t -> {
                    assertThat(t.id()).isEqualTo("T1");
                    assertThat(t.address()).isEqualTo("10.0.0.5:8080");
                    assertThat(t.hasCapability("sale")).isTrue();
                });
    }

    @Test
    @DisplayName("Should start empty when the snapshot file is unreadable")
    void shouldIgnoreCorruptSnapshot() throws Exception {
        // Given
        Path file = tempDir.resolve("terminals.json");
        Files.writeString(file, "{ this is not json", StandardCharsets.UTF_8);

        // When
        TerminalCache cache = new TerminalCache(config(file.toString()), clock);

        // Then
        assertThat(cache.size()).isZero();
    }
}
