package paylink.domain.terminal.transport.dto;

/**
 * Answer to {@code POST /transactions}
 */
public class SubmitResponse {
    private Boolean accepted;
    private String reason;

    public SubmitResponse() {
    }

    public SubmitResponse(boolean accepted, String reason) {
        this.accepted = accepted;
        this.reason = reason;
    }

    public boolean isAccepted() {
        return Boolean.TRUE.equals(accepted);
    }

    public Boolean getAccepted() {
        return accepted;
    }

    public void setAccepted(Boolean accepted) {
        this.accepted = accepted;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
