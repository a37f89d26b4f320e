package com.flagship.invoice_ocr.extraction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ocr.extraction.MonetaryAmount;
import lombok.Value;

/**
 * Amount as a plain decimal string and its currency code.
 */
@Value
public class AmountResponse {

    @JsonProperty("amount")
    String amount;

    @JsonProperty("currency")
    String currency;

    public static AmountResponse from(MonetaryAmount amount) {
        return new AmountResponse(amount.getValue().toPlainString(), amount.getCurrency().name());
    }
}
