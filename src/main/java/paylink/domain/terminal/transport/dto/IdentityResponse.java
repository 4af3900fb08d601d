package paylink.domain.terminal.transport.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Discovery handshake payload ({@code GET /identity})
 */
public class IdentityResponse {
    private String terminalId;
    private String model;
    private List<String> capabilities = new ArrayList<>();

    public IdentityResponse() {
    }

    public IdentityResponse(String terminalId, String model, List<String> capabilities) {
        this.terminalId = terminalId;
        this.model = model;
        this.capabilities = capabilities;
    }

    /**
     * Well formed: model present and at least one capability
     */
    public boolean isWellFormed() {
        return model != null && !model.isBlank() && capabilities != null && !capabilities.isEmpty();
    }

    public boolean hasCapability(String capability) {
        return capabilities != null && capabilities.stream().anyMatch(c -> c != null && c.equalsIgnoreCase(capability));
    }

    public String getTerminalId() {
        return terminalId;
    }

    public void setTerminalId(String terminalId) {
        this.terminalId = terminalId;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public List<String> getCapabilities() {
        return capabilities;
    }

    public void setCapabilities(List<String> capabilities) {
        this.capabilities = capabilities;
    }
}
