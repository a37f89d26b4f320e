package com.flagship.invoice_ocr.observability;

import com.flagship.invoice_ocr.extraction.ExtractionResult;
import com.flagship.invoice_ocr.extraction.RejectedCandidate;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Metrics for total extraction.
 *
 * Metrics exposed:
 * - extraction.result: Counter per outcome, tagged with status and currency
 * - extraction.candidate.rejected: Counter per discarded candidate, tagged with reason
 * - extraction.duration: Timer for extraction calls
 * - currency.detection: Counter of detection requests
 */
@Component
public class ExtractionMetrics {

    private final MeterRegistry registry;

    private final Timer extractionTimer;
    private final Counter detectionRequests;

    public ExtractionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.extractionTimer = Timer.builder("extraction.duration")
                .description("Time taken to extract a total from OCR text")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.detectionRequests = Counter.builder("currency.detection")
                .description("Number of currency detection requests")
                .register(registry);
    }

    /**
     * Times an extraction and records its outcome.
     */
    public ExtractionResult timeExtraction(Supplier<ExtractionResult> extraction) {
        ExtractionResult result = extractionTimer.record(extraction);
        recordResult(result);
        return result;
    }

    public void recordResult(ExtractionResult result) {
        String currency = result.findAmount()
                .map(amount -> amount.getCurrency().name())
                .orElse("none");
        registry.counter("extraction.result",
                "status", result.getStatus().name(),
                "currency", currency
        ).increment();

        for (RejectedCandidate rejected : result.getRejected()) {
            registry.counter("extraction.candidate.rejected",
                    "reason", rejected.getReason().name()
            ).increment();
        }
    }

    public void incrementDetectionRequests() {
        detectionRequests.increment();
    }
}
