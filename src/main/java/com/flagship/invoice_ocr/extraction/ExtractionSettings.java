package com.flagship.invoice_ocr.extraction;

import com.flagship.invoice_ocr.currency.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Tuning knobs for {@link AmountExtractor}.
 *
 * Plausibility limits default to the permissive expense ranges: 0.01 to
 * 1,000,000 for currencies with minor units, 1 to 100,000,000 for zero-decimal
 * currencies such as JPY or KRW.
 */
@Value
@Builder(toBuilder = true)
public class ExtractionSettings {

    /** Languages searched when the caller does not name any. */
    @Builder.Default
    Set<String> defaultLanguages = TotalKeywords.languages();

    /** Currency assumed for a bare number on a total line; null means none. */
    CurrencyCode defaultCurrency;

    /** Wins ambiguous symbol resolution ("$" → CAD for a Canadian company). */
    @Builder.Default
    CurrencyCode companyCurrency = CurrencyCode.CHF;

    /** Maximum characters scanned after a keyword. */
    @Builder.Default
    int windowChars = 80;

    @Builder.Default
    BigDecimal minAmount = new BigDecimal("0.01");

    @Builder.Default
    BigDecimal maxAmount = new BigDecimal("1000000");

    @Builder.Default
    BigDecimal zeroDecimalMinAmount = BigDecimal.ONE;

    @Builder.Default
    BigDecimal zeroDecimalMaxAmount = new BigDecimal("100000000");

    public static ExtractionSettings defaults() {
        return ExtractionSettings.builder().build();
    }

    /**
     * Whether an amount falls inside the plausible range for its currency.
     */
    public boolean isPlausible(MonetaryAmount amount) {
        BigDecimal min = amount.getCurrency().isZeroDecimal() ? zeroDecimalMinAmount : minAmount;
        BigDecimal max = amount.getCurrency().isZeroDecimal() ? zeroDecimalMaxAmount : maxAmount;
        return amount.getValue().compareTo(min) >= 0 && amount.getValue().compareTo(max) <= 0;
    }
}
