package com.flagship.invoice_ocr.currency;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the currencies a piece of OCR text mentions.
 *
 * ISO codes count only when printed in upper case as a whole word ("EUR",
 * not "Europe"). Glyph symbols count anywhere; alphabetic symbols ("kr", "Fr.")
 * only next to a number. Ambiguous symbols are resolved through
 * {@link CurrencyPriority}.
 *
 * Stateless and safe to share between threads.
 */
@Slf4j
public class CurrencyDetector {

    private static final Pattern ISO_CODE = Pattern.compile("(?<![\\p{L}])[A-Z]{3}(?![\\p{L}])");

    private final CurrencyPriority priority;

    public CurrencyDetector(CurrencyPriority priority) {
        this.priority = priority;
    }

    /**
     * Detects all currencies mentioned in the text, in order of first appearance.
     *
     * @param text OCR text, may be null
     * @return detected currencies, empty if none
     */
    public Set<CurrencyCode> detect(String text) {
        Set<CurrencyCode> detected = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return detected;
        }

        Map<Integer, CurrencyCode> byPosition = new TreeMap<>();
        Matcher code = ISO_CODE.matcher(text);
        while (code.find()) {
            int start = code.start();
            CurrencyCode.fromCode(code.group()).ifPresent(c -> byPosition.put(start, c));
        }

        int i = 0;
        while (i < text.length()) {
            Optional<String> symbol = symbolAt(text, i);
            if (symbol.isPresent()) {
                byPosition.putIfAbsent(i, resolveSymbol(symbol.get()));
                i += symbol.get().length();
            } else {
                i++;
            }
        }
        detected.addAll(byPosition.values());

        log.debug("Detected currencies: {}", detected);
        return detected;
    }

    /**
     * Resolves a printed symbol to the most likely currency.
     *
     * @throws IllegalArgumentException if the symbol is unknown
     */
    public CurrencyCode resolveSymbol(String symbol) {
        var codes = CurrencySymbols.codesFor(symbol);
        if (codes.isEmpty()) {
            throw new IllegalArgumentException("Unknown currency symbol: " + symbol);
        }
        return priority.best(codes);
    }

    /**
     * Resolves either an ISO code or a symbol.
     */
    public Optional<CurrencyCode> resolveMarker(String marker) {
        if (CurrencySymbols.isSymbol(marker)) {
            return Optional.of(resolveSymbol(marker));
        }
        return CurrencyCode.fromCode(marker);
    }

    public CurrencyPriority getPriority() {
        return priority;
    }

    private Optional<String> symbolAt(String text, int index) {
        if (index > 0 && Character.isLetter(text.charAt(index - 1)) && Character.isLetter(text.charAt(index))) {
            return Optional.empty();
        }
        Optional<String> symbol = CurrencySymbols.symbolStartingAt(text, index);
        if (symbol.isEmpty() || !CurrencySymbols.isAlphabetic(symbol.get())) {
            return symbol;
        }
        return nextToNumber(text, index, index + symbol.get().length()) ? symbol : Optional.empty();
    }

    private static boolean nextToNumber(String text, int start, int end) {
        int before = start - 1;
        while (before >= 0 && text.charAt(before) == ' ') {
            before--;
        }
        int after = end;
        while (after < text.length() && text.charAt(after) == ' ') {
            after++;
        }
        return (before >= 0 && Character.isDigit(text.charAt(before)))
                || (after < text.length() && Character.isDigit(text.charAt(after)));
    }
}
