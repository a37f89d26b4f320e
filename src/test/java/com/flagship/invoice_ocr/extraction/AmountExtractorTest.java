package com.flagship.invoice_ocr.extraction;

import com.flagship.invoice_ocr.currency.CurrencyCode;
import com.flagship.invoice_ocr.currency.CurrencyDetector;
import com.flagship.invoice_ocr.currency.CurrencyPriority;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for total extraction from OCR text.
 *
 * These tests verify:
 * - A single labelled total is extracted with its currency
 * - Exchange-rate numbers never become the total
 * - Conflicting totals are reported as ambiguous, not guessed
 * - Unknown currencies exclude only their own candidate
 * - Decimal-point artifacts and implausible amounts are filtered out
 */
class AmountExtractorTest {

    private static final List<String> ENGLISH = List.of("en");

    private final AmountExtractor extractor = extractor(ExtractionSettings.defaults());

    private static AmountExtractor extractor(ExtractionSettings settings) {
        return new AmountExtractor(settings, new CurrencyDetector(new CurrencyPriority(settings.getCompanyCurrency())));
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private ExtractionResult extract(String text, List<String> languages) {
        printInput("Text", text.replace("\n", " | "));
        printInput("Languages", languages);
        ExtractionResult result = extractor.extractTotal(text, languages);
        printOutput("Status", result.getStatus());
        printOutput("Amount", result.getAmount());
        printOutput("Rejected", result.getRejected());
        return result;
    }

    private static void assertAmount(ExtractionResult result, String value, CurrencyCode currency) {
        assertEquals(ExtractionStatus.SUCCESS, result.getStatus(), result.getMessage());
        MonetaryAmount amount = result.findAmount().orElseThrow();
        assertEquals(new BigDecimal(value), amount.getValue());
        assertEquals(currency, amount.getCurrency());
    }

    private static boolean hasRejection(ExtractionResult result, RejectionReason reason) {
        return result.getRejected().stream().anyMatch(r -> r.getReason() == reason);
    }

    // ==================== Core behaviour ====================

    @Test
    @DisplayName("Single labelled total is extracted with its currency")
    void testSimpleTotal() {
        printTestHeader("Single Labelled Total");

        ExtractionResult result = extract("TOTAL: 42.50 USD", ENGLISH);

        assertAmount(result, "42.50", CurrencyCode.USD);
        assertTrue(result.getRejected().isEmpty());
        assertTrue(result.getConflicts().isEmpty());
        printSuccess("42.50 USD extracted");
    }

    @Test
    @DisplayName("Exchange-rate line is ignored; only the total line counts")
    void testExchangeRateLineIgnored() {
        printTestHeader("Exchange Rate Line Plus Total Line");

        ExtractionResult result = extract("Rate: 1 USD = 0.92 EUR\nTOTAL 100.00 EUR", ENGLISH);

        assertAmount(result, "100.00", CurrencyCode.EUR);
        printSuccess("Exchange-rate numbers did not become the total");
    }

    @Test
    @DisplayName("Exchange-rate expression on the total line is filtered out")
    void testExchangeRateOnTotalLine() {
        printTestHeader("Exchange Rate Inside Total Window");

        ExtractionResult result = extract("Amount due (1 USD = 0.92 EUR): 100.00 EUR", ENGLISH);

        assertAmount(result, "100.00", CurrencyCode.EUR);
        assertEquals(2, result.getRejected().stream()
                .filter(r -> r.getReason() == RejectionReason.EXCHANGE_RATE).count());
        printSuccess("Rate numbers rejected as EXCHANGE_RATE");
    }

    @Test
    @DisplayName("Labelled exchange rate after the total is filtered out")
    void testLabelledExchangeRate() {
        printTestHeader("Labelled Exchange Rate");

        ExtractionResult result = extract("TOTAL 100.00 EUR (Kurs 0.92 USD)", List.of("en", "de"));

        assertAmount(result, "100.00", CurrencyCode.EUR);
        assertTrue(hasRejection(result, RejectionReason.EXCHANGE_RATE));
        printSuccess("Rate after 'Kurs' rejected");
    }

    @Test
    @DisplayName("A total whose only value is an exchange rate is not found")
    void testOnlyExchangeRate() {
        printTestHeader("Only Exchange Rate Below Keyword");

        ExtractionResult result = extract("Total\n1 USD = 0.92 EUR", ENGLISH);

        assertEquals(ExtractionStatus.NOT_FOUND, result.getStatus());
        assertTrue(hasRejection(result, RejectionReason.EXCHANGE_RATE));
        printSuccess("NOT_FOUND with EXCHANGE_RATE rejections");
    }

    @Test
    @DisplayName("Conflicting totals in different sections are ambiguous")
    void testConflictingTotals() {
        printTestHeader("Conflicting Section Totals");

        ExtractionResult result = extract("Order 1\nTOTAL 100.00 EUR\n\nOrder 2\nTOTAL 250.00 EUR", ENGLISH);

        assertEquals(ExtractionStatus.AMBIGUOUS, result.getStatus());
        assertNull(result.getAmount());
        assertEquals(2, result.getConflicts().size());
        printOutput("Conflicts", result.getConflicts());
        printSuccess("AMBIGUOUS reported, nothing guessed");
    }

    @Test
    @DisplayName("Two currencies on one total line are ambiguous")
    void testTwoCurrenciesOnOneLine() {
        printTestHeader("Two Currencies On Total Line");

        ExtractionResult result = extract("TOTAL 100.00 EUR 108.00 USD", ENGLISH);

        assertEquals(ExtractionStatus.AMBIGUOUS, result.getStatus());
        assertTrue(result.getConflicts().stream().anyMatch(a -> a.getCurrency() == CurrencyCode.EUR));
        assertTrue(result.getConflicts().stream().anyMatch(a -> a.getCurrency() == CurrencyCode.USD));
        printSuccess("Both amounts listed as conflicts");
    }

    @Test
    @DisplayName("Repeated identical totals are one result")
    void testRepeatedTotal() {
        printTestHeader("Repeated Identical Total");

        ExtractionResult result = extract("TOTAL 42.50 EUR\nAMOUNT DUE 42.50 EUR", ENGLISH);

        assertAmount(result, "42.50", CurrencyCode.EUR);
        printSuccess("Duplicates collapsed");
    }

    @Test
    @DisplayName("Text without any total keyword is not found")
    void testNoKeyword() {
        printTestHeader("No Total Keyword");

        ExtractionResult result = extract("Thank you for shopping\nItem 12.00 EUR", ENGLISH);

        assertEquals(ExtractionStatus.NOT_FOUND, result.getStatus());
        assertTrue(result.getRejected().isEmpty());
        printSuccess("NOT_FOUND");
    }

    @Test
    @DisplayName("Subtotal and tax lines are not totals")
    void testSubtotalIgnored() {
        printTestHeader("Subtotal, Tax, Total");

        ExtractionResult result = extract("Subtotal 90.00 EUR\nTax 10.00 EUR\nTotal 100.00 EUR", ENGLISH);

        assertAmount(result, "100.00", CurrencyCode.EUR);
        printSuccess("Only the Total line was used");
    }

    // ==================== Currencies ====================

    @Test
    @DisplayName("Unknown ISO-like code excludes only its own candidate")
    void testUnknownCurrencyCode() {
        printTestHeader("Unknown Currency Code");

        ExtractionResult alone = extract("TOTAL 50.00 XYZ", ENGLISH);
        assertEquals(ExtractionStatus.NOT_FOUND, alone.getStatus());
        assertTrue(hasRejection(alone, RejectionReason.UNKNOWN_CURRENCY));

        ExtractionResult withOther = extract("TOTAL 50.00 XYZ\nAMOUNT DUE 50.00 EUR", ENGLISH);
        assertAmount(withOther, "50.00", CurrencyCode.EUR);
        assertTrue(hasRejection(withOther, RejectionReason.UNKNOWN_CURRENCY));
        printSuccess("XYZ candidate excluded, extraction continued");
    }

    @Test
    @DisplayName("Currency glyph outside ISO-4217 is rejected without failing")
    void testUnknownCurrencySymbol() {
        printTestHeader("Unknown Currency Symbol");

        ExtractionResult result = extract("TOTAL ₿0.005\nAMOUNT DUE 12.00 USD", ENGLISH);

        assertAmount(result, "12.00", CurrencyCode.USD);
        assertTrue(hasRejection(result, RejectionReason.UNKNOWN_CURRENCY));
        printSuccess("Bitcoin sign rejected as UNKNOWN_CURRENCY");
    }

    @Test
    @DisplayName("Dollar sign resolves through the company currency")
    void testDollarResolution() {
        printTestHeader("Dollar Sign Resolution");

        ExtractionResult swiss = extract("TOTAL $ 25.00", ENGLISH);
        assertAmount(swiss, "25.00", CurrencyCode.USD);

        AmountExtractor canadian = extractor(ExtractionSettings.builder()
                .companyCurrency(CurrencyCode.CAD)
                .build());
        ExtractionResult result = canadian.extractTotal("TOTAL $ 25.00", ENGLISH);
        printOutput("Canadian company", result.getAmount());
        assertAmount(result, "25.00", CurrencyCode.CAD);
        printSuccess("$ is USD by default, CAD for a Canadian company");
    }

    @Test
    @DisplayName("Bare number inherits the single currency on its line")
    void testInheritedCurrency() {
        printTestHeader("Currency Inherited From Line");

        ExtractionResult result = extract("TOTAL (EUR)  100.00", ENGLISH);

        assertAmount(result, "100.00", CurrencyCode.EUR);
        printSuccess("EUR inherited");
    }

    @Test
    @DisplayName("Bare number uses the default currency, or is rejected without one")
    void testDefaultCurrency() {
        printTestHeader("Default Currency");

        ExtractionResult withoutDefault = extract("TOTAL 3 items 45.00", ENGLISH);
        assertEquals(ExtractionStatus.NOT_FOUND, withoutDefault.getStatus());
        assertTrue(hasRejection(withoutDefault, RejectionReason.MISSING_CURRENCY));

        AmountExtractor withDefault = extractor(ExtractionSettings.builder()
                .defaultCurrency(CurrencyCode.EUR)
                .build());
        ExtractionResult result = withDefault.extractTotal("TOTAL 3 items 45.00", ENGLISH);
        printOutput("With default EUR", result.getAmount());
        assertAmount(result, "45.00", CurrencyCode.EUR);
        printSuccess("Last number on the line took the default currency");
    }

    // ==================== Languages and formats ====================

    @Test
    @DisplayName("German keyword is only found when German is requested")
    void testGermanKeyword() {
        printTestHeader("German Keyword");

        String text = "GESAMTBETRAG 1.234,56 EUR";
        assertEquals(ExtractionStatus.NOT_FOUND, extract(text, ENGLISH).getStatus());
        assertAmount(extract(text, List.of("de")), "1234.56", CurrencyCode.EUR);
        printSuccess("GESAMTBETRAG matched for de only");
    }

    @Test
    @DisplayName("French total with space grouping and euro sign")
    void testFrenchTotal() {
        printTestHeader("French Total");

        ExtractionResult result = extract("TOTAL À PAYER : 1 234,56 €", List.of("fr"));

        assertAmount(result, "1234.56", CurrencyCode.EUR);
        printSuccess("1234.56 EUR");
    }

    @Test
    @DisplayName("Japanese total in a zero-decimal currency")
    void testJapaneseTotal() {
        printTestHeader("Japanese Total");

        ExtractionResult result = extract("合計 ¥1,200", List.of("ja"));

        assertAmount(result, "1200", CurrencyCode.JPY);
        printSuccess("1200 JPY");
    }

    @Test
    @DisplayName("Swiss apostrophe grouping with prefixed code")
    void testSwissTotal() {
        printTestHeader("Swiss Total");

        ExtractionResult result = extract("Total CHF 1'234.50", ENGLISH);

        assertAmount(result, "1234.50", CurrencyCode.CHF);
        printSuccess("1234.50 CHF");
    }

    @Test
    @DisplayName("Value printed on the next non-blank line")
    void testValueOnNextLine() {
        printTestHeader("Value Below Keyword");

        ExtractionResult result = extract("GRAND TOTAL\n\n  USD 1,250.00", ENGLISH);

        assertAmount(result, "1250.00", CurrencyCode.USD);
        printSuccess("1250.00 USD");
    }

    @Test
    @DisplayName("Dot leaders and a glued comma between label and value")
    void testDotLeaders() {
        printTestHeader("Dot Leaders");

        assertAmount(extract("TOTAL......42.50 EUR\nCASH 50.00 EUR\nCHANGE 7.50 EUR", ENGLISH), "42.50", CurrencyCode.EUR);
        assertAmount(extract("TOTAL.....42.50 EUR", ENGLISH), "42.50", CurrencyCode.EUR);
        assertAmount(extract("TOTAL,42.50 EUR", ENGLISH), "42.50", CurrencyCode.EUR);
        printSuccess("Value after the leader taken, the CASH line below ignored");
    }

    @Test
    @DisplayName("Number starting inside the window is read whole")
    void testNumberCrossingWindowLimit() {
        printTestHeader("Window Limit");

        ExtractionResult result = extract("TOTAL" + " ".repeat(75) + "1234.56 EUR", ENGLISH);
        assertAmount(result, "1234.56", CurrencyCode.EUR);

        ExtractionResult outside = extract("TOTAL" + " ".repeat(90) + "1234.56 EUR", ENGLISH);
        assertEquals(ExtractionStatus.NOT_FOUND, outside.getStatus());
        printSuccess("1234.56 not cut to 1234, and nothing read past the window");
    }

    @Test
    @DisplayName("Value printed before its label on the same line")
    void testValueBeforeKeyword() {
        printTestHeader("Value Before Keyword");

        assertAmount(extract("42.50 EUR TOTAL", ENGLISH), "42.50", CurrencyCode.EUR);
        assertAmount(extract("Item 3.00 EUR\n42.50 EUR TOTAL\nCASH 50.00 EUR", ENGLISH), "42.50", CurrencyCode.EUR);
        printSuccess("42.50 EUR found left of TOTAL");
    }

    @Test
    @DisplayName("Hyphenated compounds are not total labels")
    void testHyphenatedLabels() {
        printTestHeader("Hyphenated Labels");

        assertAmount(extract("Sub-Total 90.00 EUR\nVAT 10.00 EUR\nTotal 100.00 EUR", ENGLISH),
                "100.00", CurrencyCode.EUR);
        assertAmount(extract("Nettobetrag 100,00 EUR\nMwSt-Betrag 19,00 EUR\nGesamtbetrag 119,00 EUR", List.of("de")),
                "119.00", CurrencyCode.EUR);
        printSuccess("Sub-Total and MwSt-Betrag skipped");
    }

    // ==================== Filters ====================

    @Test
    @DisplayName("Amount a power of ten off a well-written total is a decimal artifact")
    void testDecimalArtifact() {
        printTestHeader("Decimal Artifact");

        ExtractionResult result = extract("TOTAL 42.50 EUR\nAMOUNT DUE 4250 EUR", ENGLISH);

        assertAmount(result, "42.50", CurrencyCode.EUR);
        assertTrue(hasRejection(result, RejectionReason.DECIMAL_ARTIFACT));
        printSuccess("4250 EUR dropped as DECIMAL_ARTIFACT");
    }

    @Test
    @DisplayName("Implausible amount is rejected")
    void testImplausibleAmount() {
        printTestHeader("Implausible Amount");

        ExtractionResult result = extract("TOTAL 5000000.00 EUR", ENGLISH);

        assertEquals(ExtractionStatus.NOT_FOUND, result.getStatus());
        assertTrue(hasRejection(result, RejectionReason.IMPLAUSIBLE_AMOUNT));
        printSuccess("IMPLAUSIBLE_AMOUNT");
    }

    @Test
    @DisplayName("Three-decimal currency with one separator is ambiguous grouping")
    void testAmbiguousGrouping() {
        printTestHeader("Ambiguous Grouping");

        ExtractionResult result = extract("TOTAL 12,500 KWD", ENGLISH);

        assertEquals(ExtractionStatus.NOT_FOUND, result.getStatus());
        assertTrue(hasRejection(result, RejectionReason.AMBIGUOUS_GROUPING));
        printSuccess("AMBIGUOUS_GROUPING");
    }

    @Test
    @DisplayName("Leading zero before three decimals is a decimal point")
    void testLeadingZeroThreeDecimals() {
        printTestHeader("Leading Zero, Three Decimals");

        assertAmount(extract("TOTAL 0.750 OMR", ENGLISH), "0.750", CurrencyCode.OMR);
        assertAmount(extract("TOTAL 0,500 KWD", ENGLISH), "0.500", CurrencyCode.KWD);
        printSuccess("0.750 OMR and 0.500 KWD");
    }

    @Test
    @DisplayName("Converted total is two amounts, not an exchange rate")
    void testConvertedTotal() {
        printTestHeader("Converted Total");

        ExtractionResult converted = extract("TOTAL 100.00 EUR = 108.00 USD", ENGLISH);
        assertEquals(ExtractionStatus.AMBIGUOUS, converted.getStatus());
        assertFalse(hasRejection(converted, RejectionReason.EXCHANGE_RATE));
        assertEquals(2, converted.getConflicts().size());

        ExtractionResult rate = extract("TOTAL 100.00 EUR (1.00 USD = 0.92 EUR)", ENGLISH);
        assertAmount(rate, "100.00", CurrencyCode.EUR);
        assertTrue(hasRejection(rate, RejectionReason.EXCHANGE_RATE));
        printSuccess("Both sides kept for the conversion, unit rate still filtered");
    }

    // ==================== Input validation ====================

    @Test
    @DisplayName("Empty or non-textual input is invalid")
    void testInvalidInput() {
        printTestHeader("Invalid Input");

        assertEquals(ExtractionStatus.INVALID_INPUT, extractor.extractTotal(null, ENGLISH).getStatus());
        assertEquals(ExtractionStatus.INVALID_INPUT, extractor.extractTotal("   \n ", ENGLISH).getStatus());
        assertEquals(ExtractionStatus.INVALID_INPUT, extractor.extractTotal("--- ***", ENGLISH).getStatus());

        ExtractionResult unsupported = extractor.extractTotal("TOTAL 1.00 USD", List.of("xx"));
        printOutput("Unsupported language", unsupported.getMessage());
        assertEquals(ExtractionStatus.INVALID_INPUT, unsupported.getStatus());
        printSuccess("INVALID_INPUT for all");
    }

    @Test
    @DisplayName("No languages means the configured defaults")
    void testDefaultLanguages() {
        printTestHeader("Default Languages");

        assertAmount(extractor.extractTotal("TOTALE 12,00 EUR", null), "12.00", CurrencyCode.EUR);
        assertAmount(extractor.extractTotal("TOTALE 12,00 EUR", List.of()), "12.00", CurrencyCode.EUR);
        printSuccess("Italian keyword found through defaults");
    }

    @Test
    @DisplayName("Large single-total document is processed in bounded time")
    void testLargeInput() {
        printTestHeader("Large Input");

        String text = "TOTAL 12.00 EUR\n".repeat(12_500);
        printInput("Length", text.length());
        ExtractionResult result = assertTimeout(Duration.ofSeconds(10), () -> extractor.extractTotal(text, ENGLISH));

        assertAmount(result, "12.00", CurrencyCode.EUR);

        String oneLine = "TOTAL 12.00 EUR ".repeat(12_500);
        ExtractionResult single = assertTimeout(Duration.ofSeconds(10), () -> extractor.extractTotal(oneLine, ENGLISH));
        assertAmount(single, "12.00", CurrencyCode.EUR);
        printSuccess("200k characters on many lines and on one line");
    }

    // ==================== Concurrency ====================

    @Test
    @DisplayName("Concurrent extractions on one instance are independent")
    void testConcurrentExtractions() throws InterruptedException {
        printTestHeader("Concurrent Extractions");

        int threadCount = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger correct = new AtomicInteger();
        List<Throwable> failures = new ArrayList<>();

        for (int i = 0; i < threadCount; i++) {
            final String value = (i + 1) + ".00";
            executor.submit(() -> {
                try {
                    start.await();
                    ExtractionResult result = extractor.extractTotal("TOTAL " + value + " USD", ENGLISH);
                    if (result.isSuccess() && result.getAmount().getValue().compareTo(new BigDecimal(value)) == 0) {
                        correct.incrementAndGet();
                    }
                } catch (Throwable t) {
                    synchronized (failures) {
                        failures.add(t);
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Correct results", correct.get() + "/" + threadCount);
        assertTrue(failures.isEmpty(), "Failures: " + failures);
        assertEquals(threadCount, correct.get());
        printSuccess("Every thread got its own total");
    }
}
