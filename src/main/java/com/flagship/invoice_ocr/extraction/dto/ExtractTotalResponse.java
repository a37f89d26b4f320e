package com.flagship.invoice_ocr.extraction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ocr.extraction.ExtractionResult;
import com.flagship.invoice_ocr.extraction.ExtractionStatus;
import com.flagship.invoice_ocr.extraction.RejectedCandidate;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Response DTO for total extraction. {@code amount} and {@code currency} are
 * null unless the status is SUCCESS.
 */
@Value
@Builder
public class ExtractTotalResponse {

    @JsonProperty("status")
    ExtractionStatus status;

    @JsonProperty("amount")
    String amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("conflicts")
    List<AmountResponse> conflicts;

    @JsonProperty("rejected")
    List<Rejection> rejected;

    @JsonProperty("message")
    String message;

    @JsonProperty("correlation_id")
    String correlationId;

    public static ExtractTotalResponse from(ExtractionResult result, String correlationId) {
        return ExtractTotalResponse.builder()
            .status(result.getStatus())
            .amount(result.findAmount().map(a -> a.getValue().toPlainString()).orElse(null))
            .currency(result.findAmount().map(a -> a.getCurrency().name()).orElse(null))
            .conflicts(result.getConflicts().stream().map(AmountResponse::from).toList())
            .rejected(result.getRejected().stream().map(Rejection::from).toList())
            .message(result.getMessage())
            .correlationId(correlationId)
            .build();
    }

    @Value
    public static class Rejection {

        @JsonProperty("keyword")
        String keyword;

        @JsonProperty("token")
        String token;

        @JsonProperty("reason")
        String reason;

        @JsonProperty("detail")
        String detail;

        static Rejection from(RejectedCandidate candidate) {
            return new Rejection(candidate.getKeyword(), candidate.getToken(),
                    candidate.getReason().name(), candidate.getDetail());
        }
    }
}
