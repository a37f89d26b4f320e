package com.flagship.invoice_ocr.extraction;

import com.flagship.invoice_ocr.observability.ExtractionMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;

/**
 * Runs {@link AmountExtractor} with timing and outcome metrics.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExtractionService {

    private final AmountExtractor amountExtractor;
    private final ExtractionMetrics extractionMetrics;

    public ExtractionResult extractTotal(String text, Collection<String> languages) {
        log.debug("Extracting total: textLength={}, languages={}", text == null ? 0 : text.length(), languages);
        return extractionMetrics.timeExtraction(() -> amountExtractor.extractTotal(text, languages));
    }
}
