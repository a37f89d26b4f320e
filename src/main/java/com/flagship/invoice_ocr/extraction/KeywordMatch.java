package com.flagship.invoice_ocr.extraction;

import lombok.Value;

/**
 * A total keyword found in the text, as printed, with its character span.
 */
@Value
public class KeywordMatch {
    String keyword;
    int start;
    int end;

    boolean overlaps(KeywordMatch other) {
        return start < other.end && other.start < end;
    }

    int length() {
        return end - start;
    }
}
