package com.flagship.invoice_ocr.config;

import com.flagship.invoice_ocr.currency.CurrencyCode;
import com.flagship.invoice_ocr.currency.CurrencyDetector;
import com.flagship.invoice_ocr.currency.CurrencyPriority;
import com.flagship.invoice_ocr.extraction.AmountExtractor;
import com.flagship.invoice_ocr.extraction.ExtractionSettings;
import com.flagship.invoice_ocr.extraction.TotalKeywords;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Wires the extractor from {@code extraction.*} properties.
 *
 * Invalid currency codes or languages in the configuration fail startup.
 */
@Configuration
@Slf4j
public class ExtractionConfig {

    @Value("${extraction.default-languages:}")
    private String defaultLanguages;

    @Value("${extraction.default-currency:}")
    private String defaultCurrency;

    @Value("${extraction.company-currency:CHF}")
    private String companyCurrency;

    @Value("${extraction.window-chars:80}")
    private int windowChars;

    @Value("${extraction.plausibility.min-amount:0.01}")
    private BigDecimal minAmount;

    @Value("${extraction.plausibility.max-amount:1000000}")
    private BigDecimal maxAmount;

    @Value("${extraction.plausibility.zero-decimal-min-amount:1}")
    private BigDecimal zeroDecimalMinAmount;

    @Value("${extraction.plausibility.zero-decimal-max-amount:100000000}")
    private BigDecimal zeroDecimalMaxAmount;

    @Bean
    public ExtractionSettings extractionSettings() {
        if (windowChars <= 0) {
            throw new IllegalStateException("extraction.window-chars must be positive, got " + windowChars);
        }
        ExtractionSettings settings = ExtractionSettings.builder()
                .defaultLanguages(parseLanguages(defaultLanguages))
                .defaultCurrency(defaultCurrency.isBlank() ? null : requireCurrency("default-currency", defaultCurrency))
                .companyCurrency(requireCurrency("company-currency", companyCurrency))
                .windowChars(windowChars)
                .minAmount(minAmount)
                .maxAmount(maxAmount)
                .zeroDecimalMinAmount(zeroDecimalMinAmount)
                .zeroDecimalMaxAmount(zeroDecimalMaxAmount)
                .build();
        log.info("Extraction settings: languages={}, defaultCurrency={}, companyCurrency={}, windowChars={}",
                settings.getDefaultLanguages(), settings.getDefaultCurrency(),
                settings.getCompanyCurrency(), settings.getWindowChars());
        return settings;
    }

    @Bean
    public CurrencyDetector currencyDetector(ExtractionSettings settings) {
        return new CurrencyDetector(new CurrencyPriority(settings.getCompanyCurrency()));
    }

    @Bean
    public AmountExtractor amountExtractor(ExtractionSettings settings, CurrencyDetector currencyDetector) {
        return new AmountExtractor(settings, currencyDetector);
    }

    private static Set<String> parseLanguages(String property) {
        if (property == null || property.isBlank()) {
            return TotalKeywords.languages();
        }
        List<String> languages = Arrays.stream(property.split(","))
                .map(String::trim)
                .filter(language -> !language.isEmpty())
                .collect(Collectors.toList());
        for (String language : languages) {
            if (!TotalKeywords.isSupported(language)) {
                throw new IllegalStateException("extraction.default-languages contains unsupported language: "
                        + language);
            }
        }
        return new LinkedHashSet<>(languages);
    }

    private static CurrencyCode requireCurrency(String property, String code) {
        return CurrencyCode.fromCode(code)
                .orElseThrow(() -> new IllegalStateException(
                        "extraction." + property + " is not an ISO-4217 code: " + code));
    }
}
