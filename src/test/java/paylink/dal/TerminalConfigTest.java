package paylink.dal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import paylink.common.ETerminalConnectionType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for TerminalConfig record
 * @since 19/10/2026
 */
class TerminalConfigTest {

    private static TerminalConfig withPort(int port) {
        return new TerminalConfig(ETerminalConnectionType.NETWORK, "", port, 2000, 5000, 10000, "SALE", "", 1000L, "");
    }

    @Test
    @DisplayName("Should create a network configuration with defaults")
    void shouldCreateNetworkConfiguration() {
        // When
        TerminalConfig config = TerminalConfig.network("192.168.1.20:8080");

        // Then
        assertThat(config.isDummy()).isFalse();
        assertThat(config.hasFixedAddress()).isTrue();
        assertThat(config.hasCacheFile()).isFalse();
        assertThat(config.toString()).contains("192.168.1.20:8080");
        assertThatCode(config::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should create a valid dummy configuration")
    void shouldCreateDummyConfiguration() {
        // When
        TerminalConfig config = TerminalConfig.dummy();

        // Then
        assertThat(config.isDummy()).isTrue();
        assertThat(config.address()).isEqualTo(TerminalConfig.DUMMY_ADDRESS);
        assertThat(config.toString()).contains("Dummy");
        assertThatCode(config::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should describe a discovered terminal without an address")
    void shouldDescribeDiscoveredTerminal() {
        assertThat(withPort(8080).toString()).contains("<discovery>");
    }

    @Test
    @DisplayName("Should validate the port range for network terminals")
    void shouldValidatePortRange() {
        assertThatThrownBy(() -> withPort(0).validate())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("port must be between 1 and 65535");
        assertThatThrownBy(() -> withPort(65536).validate())
                .isInstanceOf(ConfigurationException.class);
        assertThatCode(() -> withPort(65535).validate()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should reject a fixed address without a port")
    void shouldRejectAddressWithoutPort() {
        TerminalConfig config = new TerminalConfig(ETerminalConnectionType.NETWORK, "192.168.1.20", 8080,
                2000, 5000, 10000, "SALE", "", 1000L, "");

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("host:port");
    }

    @Test
    @DisplayName("Should reject non-positive timeouts and an empty capability")
    void shouldRejectInvalidTimeoutsAndCapability() {
        TerminalConfig noTimeout = new TerminalConfig(ETerminalConnectionType.NETWORK, "", 8080,
                2000, 0, 10000, "SALE", "", 1000L, "");
        TerminalConfig noCapability = new TerminalConfig(ETerminalConnectionType.NETWORK, "", 8080,
                2000, 5000, 10000, " ", "", 1000L, "");

        assertThatThrownBy(noTimeout::validate).hasMessageContaining("timeouts must be positive");
        assertThatThrownBy(noCapability::validate).hasMessageContaining("capability");
    }
}
