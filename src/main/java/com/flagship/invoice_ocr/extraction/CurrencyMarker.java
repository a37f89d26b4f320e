package com.flagship.invoice_ocr.extraction;

import com.flagship.invoice_ocr.currency.CurrencyCode;
import lombok.Value;

/**
 * A currency code or symbol printed right before or after a number.
 * {@code currency} is null when the marker is not a known currency.
 */
@Value
class CurrencyMarker {
    String text;
    int start;
    int end;
    /** Whitespace characters between the marker and the number. */
    int gap;
    CurrencyCode currency;

    boolean isKnown() {
        return currency != null;
    }
}
