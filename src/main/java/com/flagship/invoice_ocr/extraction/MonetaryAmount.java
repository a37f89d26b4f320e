package com.flagship.invoice_ocr.extraction;

import com.flagship.invoice_ocr.currency.CurrencyCode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A non-negative amount in a known currency.
 *
 * The value is always scaled to the currency's minor units: 42.5 USD is held
 * as 42.50, 1200 JPY as 1200.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MonetaryAmount {
    BigDecimal value;
    CurrencyCode currency;

    /**
     * Creates an amount, rescaling the value to the currency's minor units.
     *
     * @throws IllegalArgumentException if the value is negative or carries more
     *                                  fraction digits than the currency allows
     */
    public static MonetaryAmount of(BigDecimal value, CurrencyCode currency) {
        if (value == null || currency == null) {
            throw new IllegalArgumentException("Value and currency are required");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + value);
        }
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() > currency.minorUnits()) {
            throw new IllegalArgumentException(String.format(
                    "%s allows %d decimal places, got %s", currency, currency.minorUnits(), value));
        }
        return new MonetaryAmount(value.setScale(currency.minorUnits()), currency);
    }

    @Override
    public String toString() {
        return value.toPlainString() + " " + currency.name();
    }
}
