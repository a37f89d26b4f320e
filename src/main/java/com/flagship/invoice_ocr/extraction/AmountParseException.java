package com.flagship.invoice_ocr.extraction;

/**
 * Thrown when a numeric token cannot be turned into an amount.
 */
public class AmountParseException extends RuntimeException {

    private final RejectionReason reason;

    public AmountParseException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }
}
