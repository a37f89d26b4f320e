package com.flagship.invoice_ocr.extraction;

/**
 * Outcome of a total extraction.
 */
public enum ExtractionStatus {
    SUCCESS,
    NOT_FOUND,
    AMBIGUOUS,
    INVALID_INPUT
}
