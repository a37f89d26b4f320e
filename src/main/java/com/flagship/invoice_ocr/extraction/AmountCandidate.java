package com.flagship.invoice_ocr.extraction;

import lombok.Value;

/**
 * A parsed amount found next to a total keyword that passed the per-token
 * checks. {@code fractionDigits} is how many decimals were printed.
 */
@Value
class AmountCandidate {
    String keyword;
    String token;
    int offset;
    MonetaryAmount amount;
    int fractionDigits;

    /**
     * Printed with exactly the currency's minor units ("42.50 USD", "1200 JPY").
     */
    boolean isCanonicallyWritten() {
        return fractionDigits == amount.getCurrency().minorUnits();
    }
}
