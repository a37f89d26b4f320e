package com.flagship.invoice_ocr.exception;

/**
 * Thrown when a caller names a currency code that is not in the ISO-4217 table.
 */
public class UnknownCurrencyException extends RuntimeException {

    private final String code;

    public UnknownCurrencyException(String code) {
        super("Unknown currency code: " + code);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
