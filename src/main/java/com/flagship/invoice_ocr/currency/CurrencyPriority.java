package com.flagship.invoice_ocr.currency;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ranks currencies when a printed symbol could mean more than one of them.
 *
 * The company currency always ranks highest, followed by the major stable
 * currencies; everything else gets a flat default.
 */
public class CurrencyPriority {

    static final int COMPANY_CURRENCY_PRIORITY = 100;
    static final int DEFAULT_PRIORITY = 50;

    private static final Map<CurrencyCode, Integer> MAJOR_CURRENCIES = new EnumMap<>(CurrencyCode.class);

    static {
        MAJOR_CURRENCIES.put(CurrencyCode.USD, 95);
        MAJOR_CURRENCIES.put(CurrencyCode.EUR, 90);
        MAJOR_CURRENCIES.put(CurrencyCode.GBP, 85);
        MAJOR_CURRENCIES.put(CurrencyCode.CHF, 100);
        MAJOR_CURRENCIES.put(CurrencyCode.JPY, 80);
        MAJOR_CURRENCIES.put(CurrencyCode.CNY, 75);
        MAJOR_CURRENCIES.put(CurrencyCode.INR, 70);
        MAJOR_CURRENCIES.put(CurrencyCode.AUD, 70);
        MAJOR_CURRENCIES.put(CurrencyCode.CAD, 70);
        MAJOR_CURRENCIES.put(CurrencyCode.SGD, 70);
        MAJOR_CURRENCIES.put(CurrencyCode.HKD, 65);
    }

    private final CurrencyCode companyCurrency;

    public CurrencyPriority(CurrencyCode companyCurrency) {
        if (companyCurrency == null) {
            throw new IllegalArgumentException("Company currency is required");
        }
        this.companyCurrency = companyCurrency;
    }

    public CurrencyCode getCompanyCurrency() {
        return companyCurrency;
    }

    public int priorityOf(CurrencyCode currency) {
        if (currency == companyCurrency) {
            return COMPANY_CURRENCY_PRIORITY;
        }
        return MAJOR_CURRENCIES.getOrDefault(currency, DEFAULT_PRIORITY);
    }

    /**
     * Picks the highest-ranked currency; the earliest one wins a tie.
     *
     * @throws IllegalArgumentException if the list is empty
     */
    public CurrencyCode best(List<CurrencyCode> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("At least one candidate currency is required");
        }
        CurrencyCode best = candidates.get(0);
        for (CurrencyCode candidate : candidates) {
            if (priorityOf(candidate) > priorityOf(best)) {
                best = candidate;
            }
        }
        return best;
    }
}
