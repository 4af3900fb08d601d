package paylink.domain.transaction;

/**
 * Card slip details reported by the terminal for a finished transaction (printed on the receipt)
 */
public record CardSlip(String terminalReference, String authCode, String cardBrand, String cardLast4, String cardType) {

    public static final CardSlip EMPTY = new CardSlip(null, null, null, null, null);

    public boolean isEmpty() {
        return terminalReference == null && authCode == null && cardBrand == null
                && cardLast4 == null && cardType == null;
    }
}
