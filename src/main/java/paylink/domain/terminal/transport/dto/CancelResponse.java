package paylink.domain.terminal.transport.dto;

/**
 * Answer to {@code POST /transactions/{id}/cancel}
 */
public class CancelResponse {
    public static final String RESULT_OK = "ok";
    public static final String RESULT_REJECTED = "rejected";

    private String result;

    public CancelResponse() {
    }

    public CancelResponse(String result) {
        this.result = result;
    }

    public boolean isOk() {
        return RESULT_OK.equalsIgnoreCase(result);
    }

    public boolean isWellFormed() {
        return RESULT_OK.equalsIgnoreCase(result) || RESULT_REJECTED.equalsIgnoreCase(result);
    }

    public String getResult() {
        return result;
    }

    public void setResult(String result) {
        this.result = result;
    }
}
