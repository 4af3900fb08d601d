package paylink.domain.error;

/**
 * Transport or protocol level failure talking to a payment terminal
 */
public class TerminalException extends Exception {
    private final ETerminalError kind;
    private final String terminalId;

    public TerminalException(ETerminalError kind, String terminalId, String message) {
        super(message);
        this.kind = kind;
        this.terminalId = terminalId;
    }

    public TerminalException(ETerminalError kind, String terminalId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.terminalId = terminalId;
    }

    public ETerminalError getKind() {
        return kind;
    }

    public String getTerminalId() {
        return terminalId;
    }

    @Override
    public String toString() {
        return "TerminalException{kind=" + kind + ", terminal=" + terminalId + ", message=" + getMessage() + "}";
    }
}
