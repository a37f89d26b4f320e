package com.flagship.invoice_ocr.extraction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "Total" labels per language, keyed by ISO-639-1 code.
 *
 * Labels in scripts that separate words with spaces (Latin, Cyrillic, Greek)
 * only match on word boundaries, so "SUBTOTAL" is not read as "TOTAL". A
 * hyphen after a letter joins a compound ("Sub-Total"), so it is not a
 * boundary either. Labels in CJK and similar scripts match anywhere.
 */
public final class TotalKeywords {

    private static final Map<String, List<String>> BY_LANGUAGE = new LinkedHashMap<>();

    static {
        BY_LANGUAGE.put("en", List.of("TOTAL", "GRAND TOTAL", "NET TOTAL", "TOTAL DUE", "AMOUNT DUE",
                "BALANCE DUE", "FINAL AMOUNT"));
        BY_LANGUAGE.put("de", List.of("GESAMT", "GESAMTBETRAG", "SUMME", "ENDBETRAG", "BETRAG", "TOTAL"));
        BY_LANGUAGE.put("fr", List.of("TOTAL", "MONTANT TOTAL", "TOTAL A PAYER", "TOTAL À PAYER", "NET A PAYER",
                "NET À PAYER", "MONTANT"));
        BY_LANGUAGE.put("it", List.of("TOTALE", "TOTALE COMPLESSIVO", "IMPORTO"));
        BY_LANGUAGE.put("es", List.of("TOTAL", "IMPORTE TOTAL", "IMPORTE", "MONTO"));
        BY_LANGUAGE.put("pt", List.of("TOTAL", "VALOR TOTAL", "MONTANTE"));
        BY_LANGUAGE.put("nl", List.of("TOTAAL", "BEDRAG"));
        BY_LANGUAGE.put("sv", List.of("TOTALT", "BELOPP", "SUMMA"));
        BY_LANGUAGE.put("pl", List.of("RAZEM", "SUMA", "ŁĄCZNIE"));
        BY_LANGUAGE.put("tr", List.of("TOPLAM", "TUTAR"));
        BY_LANGUAGE.put("ru", List.of("ИТОГО", "ВСЕГО", "СУММА"));
        BY_LANGUAGE.put("zh", List.of("总计", "总额", "合计"));
        BY_LANGUAGE.put("ja", List.of("合計", "総額"));
        BY_LANGUAGE.put("ko", List.of("합계", "총액"));
        BY_LANGUAGE.put("ar", List.of("المجموع", "الإجمالي"));
        BY_LANGUAGE.put("hi", List.of("कुल", "राशि"));
        BY_LANGUAGE.put("th", List.of("ยอดรวม", "รวม"));
        BY_LANGUAGE.put("vi", List.of("TỔNG CỘNG", "TỔNG"));
        BY_LANGUAGE.put("id", List.of("JUMLAH", "TOTAL"));
    }

    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    static {
        BY_LANGUAGE.values().stream()
                .flatMap(List::stream)
                .distinct()
                .forEach(keyword -> PATTERNS.put(keyword, compile(keyword)));
    }

    private TotalKeywords() {
        // Utility class
    }

    public static Set<String> languages() {
        return Collections.unmodifiableSet(BY_LANGUAGE.keySet());
    }

    public static boolean isSupported(String language) {
        return language != null && BY_LANGUAGE.containsKey(language.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Distinct keywords for the given languages.
     *
     * @throws IllegalArgumentException if a language is not in the catalogue
     */
    public static Set<String> keywordsFor(Collection<String> languages) {
        Set<String> keywords = new LinkedHashSet<>();
        for (String language : languages) {
            List<String> forLanguage = language == null
                    ? null
                    : BY_LANGUAGE.get(language.trim().toLowerCase(Locale.ROOT));
            if (forLanguage == null) {
                throw new IllegalArgumentException("Unsupported language: " + language);
            }
            keywords.addAll(forLanguage);
        }
        return keywords;
    }

    /**
     * Finds every keyword occurrence, case-insensitively. Overlapping matches
     * collapse to the longest one ("GRAND TOTAL" rather than "TOTAL").
     *
     * @return matches ordered by position
     */
    public static List<KeywordMatch> findAll(String text, Collection<String> keywords) {
        List<KeywordMatch> all = new ArrayList<>();
        for (String keyword : keywords) {
            Pattern pattern = PATTERNS.computeIfAbsent(keyword, TotalKeywords::compile);
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                all.add(new KeywordMatch(matcher.group(), matcher.start(), matcher.end()));
            }
        }

        all.sort(Comparator.comparingInt(KeywordMatch::length).reversed()
                .thenComparingInt(KeywordMatch::getStart));
        // kept matches never overlap, so only the neighbours by start need checking
        TreeMap<Integer, KeywordMatch> kept = new TreeMap<>();
        for (KeywordMatch match : all) {
            Map.Entry<Integer, KeywordMatch> before = kept.floorEntry(match.getStart());
            Map.Entry<Integer, KeywordMatch> after = kept.higherEntry(match.getStart());
            if ((before == null || !before.getValue().overlaps(match))
                    && (after == null || !after.getValue().overlaps(match))) {
                kept.put(match.getStart(), match);
            }
        }
        return new ArrayList<>(kept.values());
    }

    private static Pattern compile(String keyword) {
        String body = String.join("\\s+", Arrays.stream(keyword.split(" ")).map(Pattern::quote).toList());
        if (needsWordBoundary(keyword)) {
            // "Sub-Total" and "MwSt-Betrag" are compounds, not labels
            body = "(?<!\\p{L})(?<!\\p{L}-)" + body + "(?!\\p{L})";
        }
        return Pattern.compile(body, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static boolean needsWordBoundary(String keyword) {
        Character.UnicodeScript script = Character.UnicodeScript.of(keyword.codePointAt(0));
        return script == Character.UnicodeScript.LATIN
                || script == Character.UnicodeScript.CYRILLIC
                || script == Character.UnicodeScript.GREEK;
    }
}
