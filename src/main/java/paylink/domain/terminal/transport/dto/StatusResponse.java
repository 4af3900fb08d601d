package paylink.domain.terminal.transport.dto;

import paylink.domain.transaction.CardSlip;

/**
 * Answer to {@code GET /transactions/{id}}
 */
public class StatusResponse {
    private String status;
    private String reference;
    private String authCode;
    private String cardBrand;
    private String cardLast4;
    private String cardType;

    // Decoded status, not part of the wire payload
    private transient ERemoteStatus remoteStatus;

    public StatusResponse() {
    }

    public static StatusResponse of(ERemoteStatus remoteStatus) {
        StatusResponse response = new StatusResponse();
        response.remoteStatus = remoteStatus;
        response.status = remoteStatus.getWireName();
        return response;
    }

    public static StatusResponse notFound() {
        return of(ERemoteStatus.NOT_FOUND);
    }

    public ERemoteStatus getRemoteStatus() {
        if (remoteStatus == null) {
            remoteStatus = ERemoteStatus.fromWire(status);
        }
        return remoteStatus;
    }

    /**
     * Card slip details carried with a final status
     */
    public CardSlip toCardSlip() {
        return new CardSlip(reference, authCode, cardBrand, cardLast4, cardType);
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
        this.remoteStatus = null;
    }

    public String getReference() {
        return reference;
    }

    public void setReference(String reference) {
        this.reference = reference;
    }

    public String getAuthCode() {
        return authCode;
    }

    public void setAuthCode(String authCode) {
        this.authCode = authCode;
    }

    public String getCardBrand() {
        return cardBrand;
    }

    public void setCardBrand(String cardBrand) {
        this.cardBrand = cardBrand;
    }

    public String getCardLast4() {
        return cardLast4;
    }

    public void setCardLast4(String cardLast4) {
        this.cardLast4 = cardLast4;
    }

    public String getCardType() {
        return cardType;
    }

    public void setCardType(String cardType) {
        this.cardType = cardType;
    }

    @Override
    public String toString() {
        return "StatusResponse{status=" + getRemoteStatus() + ", reference=" + reference + "}";
    }
}
