package paylink.domain.terminal;

public enum ETerminalStatus {
    UNKNOWN,
    REACHABLE,
    UNREACHABLE
}
