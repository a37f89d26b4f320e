package com.flagship.invoice_ocr.extraction;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Result of one extraction call.
 *
 * Failures are values, never exceptions: a wrong total silently taken from
 * an invoice costs more than an explicit "not found".
 *
 * Immutable. {@code amount} is set only for SUCCESS, {@code conflicts} only
 * for AMBIGUOUS.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExtractionResult {
    ExtractionStatus status;
    MonetaryAmount amount;
    List<MonetaryAmount> conflicts;
    List<RejectedCandidate> rejected;
    String message;

    public static ExtractionResult success(MonetaryAmount amount, List<RejectedCandidate> rejected) {
        return new ExtractionResult(ExtractionStatus.SUCCESS, amount, List.of(), List.copyOf(rejected),
                "Total found: " + amount);
    }

    public static ExtractionResult notFound(String message, List<RejectedCandidate> rejected) {
        return new ExtractionResult(ExtractionStatus.NOT_FOUND, null, List.of(), List.copyOf(rejected), message);
    }

    public static ExtractionResult ambiguous(List<MonetaryAmount> conflicts, List<RejectedCandidate> rejected) {
        return new ExtractionResult(ExtractionStatus.AMBIGUOUS, null, List.copyOf(conflicts), List.copyOf(rejected),
                "Conflicting totals: " + conflicts);
    }

    public static ExtractionResult invalidInput(String message) {
        return new ExtractionResult(ExtractionStatus.INVALID_INPUT, null, List.of(), List.of(), message);
    }

    public boolean isSuccess() {
        return status == ExtractionStatus.SUCCESS;
    }

    public Optional<MonetaryAmount> findAmount() {
        return Optional.ofNullable(amount);
    }
}
