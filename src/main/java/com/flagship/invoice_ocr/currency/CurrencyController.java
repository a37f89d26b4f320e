package com.flagship.invoice_ocr.currency;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ocr.exception.UnknownCurrencyException;
import com.flagship.invoice_ocr.observability.ExtractionMetrics;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only access to the ISO-4217 table and currency detection.
 */
@RestController
@RequestMapping("/api/currencies")
@RequiredArgsConstructor
@Slf4j
public class CurrencyController {

    private final CurrencyDetector currencyDetector;
    private final ExtractionMetrics extractionMetrics;

    @GetMapping("/{code}")
    public ResponseEntity<CurrencyResponse> getCurrency(@PathVariable("code") String code) {
        CurrencyCode currency = CurrencyCode.fromCode(code)
                .orElseThrow(() -> new UnknownCurrencyException(code));
        return ResponseEntity.ok(CurrencyResponse.from(currency));
    }

    @PostMapping("/detect")
    public ResponseEntity<DetectResponse> detect(@Valid @RequestBody DetectRequest request) {
        extractionMetrics.incrementDetectionRequests();
        List<String> detected = currencyDetector.detect(request.getText()).stream()
                .map(CurrencyCode::name)
                .toList();
        log.info("Detected currencies: {}", detected);
        return ResponseEntity.ok(new DetectResponse(detected));
    }

    @Value
    public static class CurrencyResponse {

        @JsonProperty("code")
        String code;

        @JsonProperty("name")
        String name;

        @JsonProperty("minor_units")
        int minorUnits;

        static CurrencyResponse from(CurrencyCode currency) {
            return new CurrencyResponse(currency.name(), currency.displayName(), currency.minorUnits());
        }
    }

    @Value
    public static class DetectRequest {

        @NotNull(message = "Text is required")
        @JsonProperty("text")
        String text;
    }

    @Value
    public static class DetectResponse {

        @JsonProperty("currencies")
        List<String> currencies;
    }
}
