package com.flagship.invoice_ocr.extraction;

/**
 * Why a numeric token next to a total keyword was not accepted as the total.
 */
public enum RejectionReason {
    /** Adjacent code or symbol is not in the ISO-4217 table. */
    UNKNOWN_CURRENCY,
    /** No currency could be attached to the number. */
    MISSING_CURRENCY,
    /** Part of an exchange-rate expression ("1 USD = 0.92 EUR"). */
    EXCHANGE_RATE,
    /** Thousands vs. decimal separator could not be told apart. */
    AMBIGUOUS_GROUPING,
    MALFORMED_AMOUNT,
    /** Outside the plausible range for the currency. */
    IMPLAUSIBLE_AMOUNT,
    /** Off by a power of ten from another candidate, likely a lost decimal point. */
    DECIMAL_ARTIFACT
}
