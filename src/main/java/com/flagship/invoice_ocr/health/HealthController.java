package com.flagship.invoice_ocr.health;

import com.flagship.invoice_ocr.currency.CurrencyCode;
import com.flagship.invoice_ocr.extraction.ExtractionSettings;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness and readiness checks.
 * Unlike the Actuator health endpoint, this does not require authorization.
 */
@RestController
public class HealthController {

    private final ExtractionSettings settings;

    public HealthController(ExtractionSettings settings) {
        this.settings = settings;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("currencies", CurrencyCode.values().length);
        response.put("languages", settings.getDefaultLanguages().size());
        return ResponseEntity.ok(response);
    }
}
