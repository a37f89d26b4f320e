package com.flagship.invoice_ocr.extraction;

import com.flagship.invoice_ocr.currency.CurrencyCode;
import com.flagship.invoice_ocr.currency.CurrencyDetector;
import com.flagship.invoice_ocr.currency.CurrencySymbols;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.IntStream;

/**
 * Extracts the document total from OCR text.
 *
 * For every "total" keyword of the requested languages, the extractor scans
 * the text surrounding it for numbers with an adjacent currency code or
 * symbol: the rest of the keyword's line, else the part of the line before
 * the keyword ("42.50 EUR TOTAL"), else the next non-blank line. Candidates
 * are then filtered:
 * <ul>
 *   <li>numbers inside exchange-rate expressions are dropped;</li>
 *   <li>numbers quoted in a code outside ISO-4217 are dropped;</li>
 *   <li>numbers whose separators cannot be resolved are dropped;</li>
 *   <li>amounts outside the plausible range for their currency are dropped;</li>
 *   <li>amounts a power of ten away from a properly written one are dropped
 *       as decimal-point artifacts.</li>
 * </ul>
 * Exactly one distinct survivor is a success; none is NOT_FOUND; several
 * are AMBIGUOUS. The extractor never picks between conflicting totals.
 *
 * Pure and stateless; one instance can serve concurrent calls.
 */
@Slf4j
public class AmountExtractor {

    private static final Pattern NUMBER = Pattern.compile(
            "(?<!\\d)(?<!\\d[.,'’])-?\\d+(?:(?:[.,'’]|[ \\u00A0\\u202F](?=\\d{3}(?!\\d)))\\d+)*");

    private final ExtractionSettings settings;
    private final CurrencyDetector currencyDetector;

    public AmountExtractor(ExtractionSettings settings, CurrencyDetector currencyDetector) {
        this.settings = settings;
        this.currencyDetector = currencyDetector;
    }

    /**
     * Extracts the total using the configured default languages.
     */
    public ExtractionResult extractTotal(String text) {
        return extractTotal(text, null);
    }

    /**
     * Extracts the total amount of a document.
     *
     * @param text               OCR text of one document
     * @param supportedLanguages language codes whose total keywords are searched;
     *                           null or empty means the configured defaults
     * @return the extraction outcome, never null
     */
    public ExtractionResult extractTotal(String text, Collection<String> supportedLanguages) {
        if (text == null || text.isBlank()) {
            return ExtractionResult.invalidInput("OCR text is empty");
        }
        if (text.codePoints().noneMatch(Character::isLetterOrDigit)) {
            return ExtractionResult.invalidInput("OCR text contains no letters or digits");
        }

        Collection<String> languages = supportedLanguages == null || supportedLanguages.isEmpty()
                ? settings.getDefaultLanguages()
                : supportedLanguages;
        Set<String> keywords;
        try {
            keywords = TotalKeywords.keywordsFor(languages);
        } catch (IllegalArgumentException e) {
            return ExtractionResult.invalidInput(e.getMessage());
        }

        List<KeywordMatch> matches = TotalKeywords.findAll(text, keywords);
        if (matches.isEmpty()) {
            log.info("No total keyword found: languages={}", languages);
            return ExtractionResult.notFound("No total keyword found for languages " + languages, List.of());
        }

        Scan scan = new Scan(text, ExchangeRateDetector.findRateSpans(text));
        for (KeywordMatch match : matches) {
            scanWindow(scan, match);
        }

        List<RejectedCandidate> rejected = scan.rejected;
        List<AmountCandidate> survivors = dropDecimalArtifacts(scan.candidates, rejected);
        List<MonetaryAmount> distinct = distinctAmounts(survivors);

        if (distinct.isEmpty()) {
            log.info("No total survived filtering: keywords={}, rejected={}", matches.size(), rejected.size());
            return ExtractionResult.notFound("No valid amount next to a total keyword", rejected);
        }
        if (distinct.size() > 1) {
            log.info("Ambiguous total: candidates={}", distinct);
            return ExtractionResult.ambiguous(distinct, rejected);
        }
        log.info("Total extracted: amount={}, rejected={}", distinct.get(0), rejected.size());
        return ExtractionResult.success(distinct.get(0), rejected);
    }

    private void scanWindow(Scan scan, KeywordMatch match) {
        String text = scan.text;
        List<RejectedCandidate> rejected = scan.rejected;
        Window window = windowFor(scan, match);
        Matcher number = NUMBER.matcher(text)
                .region(window.start, window.end)
                .useTransparentBounds(true);

        List<int[]> bareTokens = new ArrayList<>();
        boolean anyMarked = false;
        int claimedUntil = window.start;

        while (number.find()) {
            int start = number.start();
            int end = number.end();
            String token = number.group();
            if (start >= window.limitEnd) {
                break;
            }
            if (end <= window.limitStart || !scan.visited.add(start)) {
                continue;
            }

            if (ExchangeRateDetector.isInsideRate(scan.rateSpans, start)) {
                reject(rejected, match, token, RejectionReason.EXCHANGE_RATE, "Part of an exchange-rate expression");
                continue;
            }

            CurrencyMarker prefix = markerBefore(text, Math.max(window.start, claimedUntil), start);
            CurrencyMarker suffix = markerAfter(text, end, window.end);
            CurrencyMarker marker = choose(prefix, suffix);
            if (marker == null) {
                bareTokens.add(new int[]{start, end});
                continue;
            }
            anyMarked = true;
            if (marker == suffix) {
                claimedUntil = suffix.getEnd();
            }
            if (!marker.isKnown()) {
                reject(rejected, match, token, RejectionReason.UNKNOWN_CURRENCY,
                        "'" + marker.getText() + "' is not an ISO-4217 currency");
                continue;
            }
            accept(match, token, start, marker.getCurrency(), scan.candidates, rejected);
        }

        if (!anyMarked && !bareTokens.isEmpty()) {
            // Totals are printed last on their line.
            int[] last = bareTokens.get(bareTokens.size() - 1);
            String token = text.substring(last[0], last[1]);
            Optional<CurrencyCode> inherited = inheritCurrency(scan, window);
            if (inherited.isPresent()) {
                accept(match, token, last[0], inherited.get(), scan.candidates, rejected);
            } else {
                reject(rejected, match, token, RejectionReason.MISSING_CURRENCY,
                        "No currency next to the number or on its line");
            }
        }
    }

    private void accept(KeywordMatch match, String token, int offset, CurrencyCode currency,
                        List<AmountCandidate> candidates, List<RejectedCandidate> rejected) {
        ParsedAmount parsed;
        try {
            parsed = AmountParser.parse(token, currency);
        } catch (AmountParseException e) {
            reject(rejected, match, token, e.getReason(), e.getMessage());
            return;
        }

        MonetaryAmount amount = MonetaryAmount.of(parsed.getValue(), currency);
        if (!settings.isPlausible(amount)) {
            reject(rejected, match, token, RejectionReason.IMPLAUSIBLE_AMOUNT,
                    amount + " is outside the plausible range");
            return;
        }
        log.debug("Candidate accepted: keyword='{}', token='{}', amount={}", match.getKeyword(), token, amount);
        candidates.add(new AmountCandidate(match.getKeyword(), token, offset, amount, parsed.getFractionDigits()));
    }

    private Optional<CurrencyCode> inheritCurrency(Scan scan, Window window) {
        Set<CurrencyCode> onLine = scan.lineCurrencies.computeIfAbsent(
                (long) window.contextStart << 32 | window.contextEnd,
                key -> currencyDetector.detect(scan.text.substring(window.contextStart, window.contextEnd)));
        if (onLine.size() == 1) {
            return Optional.of(onLine.iterator().next());
        }
        return Optional.ofNullable(settings.getDefaultCurrency());
    }

    private List<AmountCandidate> dropDecimalArtifacts(List<AmountCandidate> candidates,
                                                       List<RejectedCandidate> rejected) {
        // amounts a power of ten apart share currency and significant digits
        Map<String, Set<Integer>> canonicalScales = new HashMap<>();
        for (AmountCandidate candidate : candidates) {
            if (candidate.isCanonicallyWritten() && candidate.getAmount().getValue().signum() > 0) {
                canonicalScales.computeIfAbsent(digitsKey(candidate.getAmount()), key -> new HashSet<>())
                        .add(candidate.getAmount().getValue().stripTrailingZeros().scale());
            }
        }
        Set<AmountCandidate> artifacts = new LinkedHashSet<>();
        for (AmountCandidate candidate : candidates) {
            if (candidate.isCanonicallyWritten() || candidate.getAmount().getValue().signum() <= 0) {
                continue;
            }
            Set<Integer> scales = canonicalScales.get(digitsKey(candidate.getAmount()));
            if (scales != null && isPowerOfTenApart(scales, candidate.getAmount().getValue().stripTrailingZeros().scale())) {
                artifacts.add(candidate);
            }
        }
        for (AmountCandidate artifact : artifacts) {
            rejected.add(new RejectedCandidate(artifact.getKeyword(), artifact.getToken(),
                    RejectionReason.DECIMAL_ARTIFACT, "Misplaced decimal point, not a real total: " + artifact.getAmount()));
            log.debug("Candidate rejected: token='{}', reason={}", artifact.getToken(), RejectionReason.DECIMAL_ARTIFACT);
        }
        List<AmountCandidate> survivors = new ArrayList<>(candidates);
        survivors.removeAll(artifacts);
        return survivors;
    }

    private static String digitsKey(MonetaryAmount amount) {
        return amount.getCurrency().name() + ':' + amount.getValue().stripTrailingZeros().unscaledValue();
    }

    /** 10 to 10,000 apart. */
    private static boolean isPowerOfTenApart(Set<Integer> canonicalScales, int scale) {
        for (int k = 1; k <= 4; k++) {
            if (canonicalScales.contains(scale + k) || canonicalScales.contains(scale - k)) {
                return true;
            }
        }
        return false;
    }

    private static List<MonetaryAmount> distinctAmounts(List<AmountCandidate> candidates) {
        // amounts are scaled to their currency's minor units, so equal amounts are equal values
        Set<MonetaryAmount> distinct = new LinkedHashSet<>();
        for (AmountCandidate candidate : candidates) {
            distinct.add(candidate.getAmount());
        }
        return new ArrayList<>(distinct);
    }

    private static void reject(List<RejectedCandidate> rejected, KeywordMatch match, String token,
                               RejectionReason reason, String detail) {
        log.debug("Candidate rejected: keyword='{}', token='{}', reason={}, detail={}",
                match.getKeyword(), token, reason, detail);
        rejected.add(new RejectedCandidate(match.getKeyword(), token, reason, detail));
    }

    // ==================== Currency markers ====================

    /**
     * Prefers a known currency over an unknown one, then the marker closest to
     * the number; a tie goes to the prefix.
     */
    private static CurrencyMarker choose(CurrencyMarker prefix, CurrencyMarker suffix) {
        if (prefix == null || suffix == null) {
            return prefix != null ? prefix : suffix;
        }
        if (prefix.isKnown() != suffix.isKnown()) {
            return prefix.isKnown() ? prefix : suffix;
        }
        return suffix.getGap() < prefix.getGap() ? suffix : prefix;
    }

    private CurrencyMarker markerBefore(String text, int lowerBound, int numberStart) {
        int p = numberStart;
        while (p > lowerBound && isSpace(text.charAt(p - 1))) {
            p--;
        }
        int gap = numberStart - p;
        if (p <= lowerBound) {
            return null;
        }

        if (p - 3 >= lowerBound && isUpperCode(text, p - 3)
                && (p - 3 == 0 || !Character.isLetter(text.charAt(p - 4)))) {
            String code = text.substring(p - 3, p);
            Optional<CurrencyCode> currency = CurrencyCode.fromCode(code);
            if (currency.isPresent()) {
                return new CurrencyMarker(code, p - 3, p, gap, currency.get());
            }
            // a word before a spaced-out number is a label, not a currency
            if (gap == 0) {
                return new CurrencyMarker(code, p - 3, p, gap, null);
            }
        }

        Optional<String> symbol = CurrencySymbols.symbolEndingAt(text, p);
        if (symbol.isPresent() && p - symbol.get().length() >= lowerBound) {
            return new CurrencyMarker(symbol.get(), p - symbol.get().length(), p, gap,
                    currencyDetector.resolveSymbol(symbol.get()));
        }
        if (Character.getType(text.charAt(p - 1)) == Character.CURRENCY_SYMBOL) {
            return new CurrencyMarker(text.substring(p - 1, p), p - 1, p, gap, null);
        }
        return null;
    }

    private CurrencyMarker markerAfter(String text, int numberEnd, int upperBound) {
        int p = numberEnd;
        while (p < upperBound && isSpace(text.charAt(p))) {
            p++;
        }
        int gap = p - numberEnd;
        if (p >= upperBound) {
            return null;
        }

        if (p + 3 <= upperBound && isUpperCode(text, p)
                && (p + 3 == text.length() || !Character.isLetter(text.charAt(p + 3)))) {
            String code = text.substring(p, p + 3);
            return new CurrencyMarker(code, p, p + 3, gap, CurrencyCode.fromCode(code).orElse(null));
        }

        Optional<String> symbol = CurrencySymbols.symbolStartingAt(text, p);
        if (symbol.isPresent() && p + symbol.get().length() <= upperBound) {
            return new CurrencyMarker(symbol.get(), p, p + symbol.get().length(), gap,
                    currencyDetector.resolveSymbol(symbol.get()));
        }
        if (Character.getType(text.charAt(p)) == Character.CURRENCY_SYMBOL) {
            return new CurrencyMarker(text.substring(p, p + 1), p, p + 1, gap, null);
        }
        return null;
    }

    private static boolean isUpperCode(String text, int start) {
        for (int i = start; i < start + 3; i++) {
            char c = text.charAt(i);
            if (c < 'A' || c > 'Z') {
                return false;
            }
        }
        return true;
    }

    private static boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\u00A0' || c == '\u202F';
    }

    // ==================== Windows ====================

    /**
     * Text scanned for one keyword. Numbers are matched across
     * {@code start..end} so none is cut short, but only those overlapping
     * {@code limitStart..limitEnd} are considered. {@code contextStart..contextEnd}
     * spans the keyword's line and, if different, the value's line.
     */
    private static final class Window {
        final int start;
        final int end;
        final int limitStart;
        final int limitEnd;
        final int contextStart;
        final int contextEnd;

        Window(int start, int end, int limitStart, int limitEnd, int contextStart, int contextEnd) {
            this.start = start;
            this.end = end;
            this.limitStart = limitStart;
            this.limitEnd = limitEnd;
            this.contextStart = contextStart;
            this.contextEnd = contextEnd;
        }
    }

    private Window windowFor(Scan scan, KeywordMatch match) {
        String text = scan.text;
        int windowChars = settings.getWindowChars();
        int lineStart = lineStart(text, match.getStart());
        int lineEnd = lineEnd(text, match.getEnd());

        int afterLimit = Math.min(lineEnd, match.getEnd() + windowChars);
        if (scan.containsDigit(match.getEnd(), lineEnd)) {
            return new Window(match.getEnd(), lineEnd, match.getEnd(), afterLimit, lineStart, lineEnd);
        }

        int beforeLimit = Math.max(lineStart, match.getStart() - windowChars);
        if (scan.containsDigit(lineStart, match.getStart())) {
            int from = beforeLimit;
            while (from > lineStart && isNumberChar(text.charAt(from - 1))) {
                from--;
            }
            return new Window(from, match.getStart(), beforeLimit, match.getStart(), lineStart, lineEnd);
        }

        // the value is printed below its label only when the label's line has no digits at all
        int next = lineEnd + 1;
        while (next < text.length()) {
            int nextEnd = lineEnd(text, next);
            if (!text.substring(next, nextEnd).isBlank()) {
                return new Window(next, nextEnd, next, Math.min(nextEnd, next + windowChars), lineStart, nextEnd);
            }
            next = nextEnd + 1;
        }
        return new Window(match.getEnd(), lineEnd, match.getEnd(), afterLimit, lineStart, lineEnd);
    }

    private static boolean isNumberChar(char c) {
        return Character.isDigit(c) || c == '.' || c == ',' || c == '\'' || c == '’' || isSpace(c);
    }

    /**
     * State of one extraction call, shared by the windows of all keywords.
     */
    private static final class Scan {
        final String text;
        final List<ExchangeRateDetector.Span> rateSpans;
        final int[] digits;
        final Set<Integer> visited = new HashSet<>();
        final List<AmountCandidate> candidates = new ArrayList<>();
        final List<RejectedCandidate> rejected = new ArrayList<>();
        final Map<Long, Set<CurrencyCode>> lineCurrencies = new HashMap<>();

        Scan(String text, List<ExchangeRateDetector.Span> rateSpans) {
            this.text = text;
            this.rateSpans = rateSpans;
            this.digits = IntStream.range(0, text.length())
                    .filter(i -> Character.isDigit(text.charAt(i)))
                    .toArray();
        }

        boolean containsDigit(int from, int to) {
            int index = Arrays.binarySearch(digits, from);
            int next = index >= 0 ? index : -index - 1;
            return next < digits.length && digits[next] < to;
        }
    }

    private static int lineStart(String text, int offset) {
        return text.lastIndexOf('\n', offset - 1) + 1;
    }

    private static int lineEnd(String text, int offset) {
        int newline = text.indexOf('\n', offset);
        return newline < 0 ? text.length() : newline;
    }
}
