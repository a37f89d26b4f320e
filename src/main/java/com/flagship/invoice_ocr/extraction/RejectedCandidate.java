package com.flagship.invoice_ocr.extraction;

import lombok.Value;

/**
 * A numeric token that was considered and discarded, kept for diagnostics.
 */
@Value
public class RejectedCandidate {
    String keyword;
    String token;
    RejectionReason reason;
    String detail;
}
