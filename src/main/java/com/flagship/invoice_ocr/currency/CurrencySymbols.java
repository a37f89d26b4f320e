package com.flagship.invoice_ocr.currency;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.flagship.invoice_ocr.currency.CurrencyCode.*;

/**
 * Printed currency symbols and the ISO-4217 codes each of them may stand for.
 *
 * A symbol can be shared by several currencies ("$", "kr", "¥"); the codes are
 * listed in the order used to break priority ties. Alphabetic symbols such as
 * "kr" or "R" only match on word boundaries.
 */
public final class CurrencySymbols {

    private static final Map<String, List<CurrencyCode>> SYMBOLS = new LinkedHashMap<>();

    /** Symbols sorted longest first, so "R$" is tried before "$" and "R". */
    private static final List<String> BY_LENGTH;

    static {
        SYMBOLS.put("US$", List.of(USD));
        SYMBOLS.put("C$", List.of(CAD));
        SYMBOLS.put("A$", List.of(AUD));
        SYMBOLS.put("NZ$", List.of(NZD));
        SYMBOLS.put("HK$", List.of(HKD));
        SYMBOLS.put("S$", List.of(SGD));
        SYMBOLS.put("R$", List.of(BRL));
        SYMBOLS.put("$", List.of(USD, AUD, CAD, NZD, HKD, SGD, MXN, ARS, CLP, COP));
        SYMBOLS.put("€", List.of(EUR));
        SYMBOLS.put("£", List.of(GBP, FKP, GIP, SHP));
        SYMBOLS.put("¥", List.of(JPY, CNY));
        SYMBOLS.put("￥", List.of(JPY, CNY));
        SYMBOLS.put("元", List.of(CNY));
        SYMBOLS.put("円", List.of(JPY));
        SYMBOLS.put("₹", List.of(INR));
        SYMBOLS.put("₨", List.of(PKR, LKR, NPR, MUR, SCR));
        SYMBOLS.put("₱", List.of(PHP));
        SYMBOLS.put("₩", List.of(KRW));
        SYMBOLS.put("₽", List.of(RUB));
        SYMBOLS.put("₴", List.of(UAH));
        SYMBOLS.put("₦", List.of(NGN));
        SYMBOLS.put("₡", List.of(CRC));
        SYMBOLS.put("₪", List.of(ILS));
        SYMBOLS.put("₺", List.of(TRY));
        SYMBOLS.put("₵", List.of(GHS));
        SYMBOLS.put("₸", List.of(KZT));
        SYMBOLS.put("₮", List.of(MNT));
        SYMBOLS.put("₾", List.of(GEL));
        SYMBOLS.put("₼", List.of(AZN));
        SYMBOLS.put("₫", List.of(VND));
        SYMBOLS.put("៛", List.of(KHR));
        SYMBOLS.put("₭", List.of(LAK));
        SYMBOLS.put("₲", List.of(PYG));
        SYMBOLS.put("﷼", List.of(SAR, QAR, OMR, YER, IRR));
        SYMBOLS.put("SFr.", List.of(CHF));
        SYMBOLS.put("Fr.", List.of(CHF));
        SYMBOLS.put("Fr", List.of(CHF, CDF, BIF, DJF, GNF, KMF, RWF));
        SYMBOLS.put("kr.", List.of(DKK));
        SYMBOLS.put("kr", List.of(SEK, NOK, DKK, ISK));
        SYMBOLS.put("Kč", List.of(CZK));
        SYMBOLS.put("zł", List.of(PLN));
        SYMBOLS.put("lei", List.of(RON));
        SYMBOLS.put("Ft", List.of(HUF));
        SYMBOLS.put("R", List.of(ZAR));

        BY_LENGTH = SYMBOLS.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
    }

    private CurrencySymbols() {
        // Utility class
    }

    /**
     * Codes a symbol may stand for, in tie-break order.
     */
    public static List<CurrencyCode> codesFor(String symbol) {
        return SYMBOLS.getOrDefault(symbol, List.of());
    }

    public static boolean isSymbol(String symbol) {
        return SYMBOLS.containsKey(symbol);
    }

    /**
     * All known symbols, longest first.
     */
    public static List<String> symbols() {
        return BY_LENGTH;
    }

    /**
     * Finds the longest symbol that ends exactly at {@code end} in {@code text}.
     */
    public static Optional<String> symbolEndingAt(CharSequence text, int end) {
        for (String symbol : BY_LENGTH) {
            int start = end - symbol.length();
            if (start < 0 || !regionMatches(text, start, symbol)) {
                continue;
            }
            if (isAlphabetic(symbol) && start > 0 && Character.isLetter(text.charAt(start - 1))) {
                continue;
            }
            return Optional.of(symbol);
        }
        return Optional.empty();
    }

    /**
     * Finds the longest symbol that starts exactly at {@code start} in {@code text}.
     */
    public static Optional<String> symbolStartingAt(CharSequence text, int start) {
        for (String symbol : BY_LENGTH) {
            int end = start + symbol.length();
            if (end > text.length() || !regionMatches(text, start, symbol)) {
                continue;
            }
            if (isAlphabetic(symbol) && end < text.length() && Character.isLetter(text.charAt(end))) {
                continue;
            }
            return Optional.of(symbol);
        }
        return Optional.empty();
    }

    static boolean isAlphabetic(String symbol) {
        return Character.isLetter(symbol.charAt(0)) && Character.UnicodeScript.of(symbol.charAt(0))
                == Character.UnicodeScript.LATIN;
    }

    private static boolean regionMatches(CharSequence text, int offset, String symbol) {
        for (int i = 0; i < symbol.length(); i++) {
            if (text.charAt(offset + i) != symbol.charAt(i)) {
                return false;
            }
        }
        return true;
    }
}
