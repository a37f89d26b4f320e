package com.flagship.invoice_ocr.extraction;

import com.flagship.invoice_ocr.extraction.dto.ExtractTotalRequest;
import com.flagship.invoice_ocr.extraction.dto.ExtractTotalResponse;
import com.flagship.invoice_ocr.observability.CorrelationContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for total extraction.
 *
 * SUCCESS, NOT_FOUND and AMBIGUOUS are all answered with 200: the request
 * was fine, the document just had no single total. INVALID_INPUT is a 400
 * carrying the same body.
 */
@RestController
@RequestMapping("/api/extractions")
@RequiredArgsConstructor
@Slf4j
public class ExtractionController {

    private final ExtractionService extractionService;

    /**
     * Extracts the total amount from OCR text.
     *
     * @param request OCR text, optional languages and document id
     * @return extraction outcome
     */
    @PostMapping("/total")
    public ResponseEntity<ExtractTotalResponse> extractTotal(@Valid @RequestBody ExtractTotalRequest request) {
        CorrelationContext.tagDocument(request.getDocumentId());
        log.info("Received total extraction request: textLength={}, languages={}",
                request.getText().length(), request.getLanguages());

        ExtractionResult result = extractionService.extractTotal(request.getText(), request.getLanguages());
        ExtractTotalResponse body = ExtractTotalResponse.from(result, CorrelationContext.getCorrelationId());

        if (result.getStatus() == ExtractionStatus.INVALID_INPUT) {
            log.warn("Rejected extraction input: {}", result.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
        }
        return ResponseEntity.ok(body);
    }
}
