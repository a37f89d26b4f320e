package com.flagship.invoice_ocr.extraction;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A numeric token after separator resolution.
 *
 * {@code fractionDigits} is the number of digits written after the decimal
 * separator, 0 when there was none.
 */
@Value
public class ParsedAmount {
    BigDecimal value;
    int fractionDigits;
}
