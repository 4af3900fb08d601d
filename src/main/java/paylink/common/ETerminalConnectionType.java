package paylink.common;

/**
 * Payment terminal connection type enumeration
 * @since 19/10/2026
 */
public enum ETerminalConnectionType {
    NETWORK,  // HTTP connection to a physical terminal on the local network
    NONE      // Dummy mode (simulated terminal, no hardware)
}
