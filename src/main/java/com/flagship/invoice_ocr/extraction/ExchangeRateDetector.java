package com.flagship.invoice_ocr.extraction;

import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates exchange-rate expressions in OCR text so their numbers are never
 * taken for a total.
 *
 * Recognised forms: "1 USD = 0.92 EUR", "USD 1 = EUR 0.92", "EUR/USD 1.0845",
 * "@ 0.92", and anything following an exchange-rate label on the same line
 * ("Exchange rate", "Wechselkurs", "taux de change", ...).
 *
 * An equation is a rate only when its left side is one unit. A converted
 * total such as "100.00 EUR = 108.00 USD" is two amounts, not a rate.
 */
public final class ExchangeRateDetector {

    private static final String MARK = "(?:(?<!\\p{L})[A-Z]{3}(?!\\p{L})|\\p{Sc})";
    private static final String NUM = "\\d[\\d.,']*";
    /** 1, 1.00 or 1,0 and nothing longer. */
    private static final String ONE = "(?<![\\d.,'])1(?:[.,]0+)?(?![\\d.,']?\\d)";

    private static final List<Pattern> RATE_EXPRESSIONS = List.of(
            Pattern.compile(ONE + "\\s*" + MARK + "\\s*=\\s*" + MARK + "?\\s*" + NUM + "(?:\\s*" + MARK + ")?"),
            Pattern.compile(MARK + "\\s*" + ONE + "\\s*=\\s*" + MARK + "\\s*" + NUM),
            Pattern.compile("(?<!\\p{L})[A-Z]{3}\\s*/\\s*[A-Z]{3}(?!\\p{L})\\s*[:=]?\\s*" + NUM),
            Pattern.compile("@\\s*" + NUM));

    private static final Pattern RATE_LABEL = Pattern.compile(
            "(?<!\\p{L})(?:exchange\\s+rate|fx\\s+rate|conversion\\s+rate|rate\\s+of\\s+exchange"
                    + "|wechselkurs|umrechnungskurs|kurs|taux\\s+de\\s+change|tasso\\s+di\\s+cambio"
                    + "|tipo\\s+de\\s+cambio|taxa\\s+de\\s+c[âa]mbio)(?!\\p{L})[^\\n]*",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private ExchangeRateDetector() {
        // Utility class
    }

    /**
     * Character spans of all exchange-rate expressions in the text, merged
     * where they overlap and ordered by position.
     */
    public static List<Span> findRateSpans(String text) {
        List<Span> spans = new ArrayList<>();
        for (Pattern pattern : RATE_EXPRESSIONS) {
            collect(pattern.matcher(text), spans);
        }
        collect(RATE_LABEL.matcher(text), spans);
        return merge(spans);
    }

    /**
     * @param spans spans as returned by {@link #findRateSpans(String)}
     */
    public static boolean isInsideRate(List<Span> spans, int offset) {
        int low = 0;
        int high = spans.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            Span span = spans.get(mid);
            if (offset < span.getStart()) {
                high = mid - 1;
            } else if (offset >= span.getEnd()) {
                low = mid + 1;
            } else {
                return true;
            }
        }
        return false;
    }

    private static List<Span> merge(List<Span> spans) {
        spans.sort(Comparator.comparingInt(Span::getStart));
        List<Span> merged = new ArrayList<>();
        for (Span span : spans) {
            int last = merged.size() - 1;
            if (last >= 0 && span.getStart() <= merged.get(last).getEnd()) {
                Span previous = merged.get(last);
                merged.set(last, new Span(previous.getStart(), Math.max(previous.getEnd(), span.getEnd())));
            } else {
                merged.add(span);
            }
        }
        return merged;
    }

    private static void collect(Matcher matcher, List<Span> spans) {
        while (matcher.find()) {
            spans.add(new Span(matcher.start(), matcher.end()));
        }
    }

    @Value
    public static class Span {
        int start;
        int end;

        public boolean contains(int offset) {
            return offset >= start && offset < end;
        }
    }
}
