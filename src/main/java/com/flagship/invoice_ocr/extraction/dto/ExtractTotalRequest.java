package com.flagship.invoice_ocr.extraction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.List;

/**
 * Request DTO for total extraction.
 */
@Value
public class ExtractTotalRequest {

    @NotNull(message = "Text is required")
    @Size(max = 200_000, message = "Text must not exceed 200000 characters")
    @JsonProperty("text")
    String text;

    /** ISO-639-1 codes; empty or absent means the configured defaults. */
    @JsonProperty("languages")
    List<String> languages;

    /** Caller's reference, only used for log correlation. */
    @JsonProperty("document_id")
    String documentId;
}
