package com.flagship.invoice_ocr.extraction;

import com.flagship.invoice_ocr.currency.CurrencyCode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses OCR numeric tokens written with any of the common grouping and
 * decimal conventions: "1,234.56", "1.234,56", "1'234.56", "1 234,56".
 *
 * Rules:
 * <ul>
 *   <li>if both '.' and ',' occur, the last one is the decimal separator;</li>
 *   <li>a separator that occurs more than once is a grouping separator;</li>
 *   <li>a single '.' or ',' followed by 1, 2 or 4+ digits is a decimal separator;</li>
 *   <li>a single '.' or ',' followed by exactly 3 digits is a grouping
 *       separator when the currency has 0 or 2 minor units, since three
 *       decimals are invalid there. With a 3-minor-unit currency both readings
 *       are valid, and without a currency there is nothing to go by: the token
 *       is rejected as ambiguous. A leading group of zeros ("0.750") is never
 *       a thousands group, so the separator is decimal.</li>
 * </ul>
 * Apostrophes and spaces are always grouping separators. Groups after the
 * first must have exactly three digits, except for Indian lakh grouping
 * ("12,34,567") where the inner groups have two.
 */
public final class AmountParser {

    private AmountParser() {
        // Utility class
    }

    /**
     * @param token    numeric token as printed
     * @param currency currency the token is quoted in, or null when unknown
     * @return the parsed value
     * @throws AmountParseException if the token is malformed or ambiguous
     */
    public static ParsedAmount parse(String token, CurrencyCode currency) {
        if (token == null || token.isBlank()) {
            throw new AmountParseException(RejectionReason.MALFORMED_AMOUNT, "Empty numeric token");
        }
        String normalized = token.trim()
                .replace('’', '\'')
                .replace('\u00A0', ' ')
                .replace('\u202F', ' ');
        if (normalized.startsWith("-")) {
            throw new AmountParseException(RejectionReason.MALFORMED_AMOUNT, "Negative amount: " + token);
        }

        List<String> groups = new ArrayList<>();
        List<Character> separators = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (char c : normalized.toCharArray()) {
            if (Character.isDigit(c)) {
                current.append(c);
            } else if (c == '.' || c == ',' || c == '\'' || c == ' ') {
                if (current.length() == 0) {
                    throw new AmountParseException(RejectionReason.MALFORMED_AMOUNT,
                            "Misplaced separator in: " + token);
                }
                groups.add(current.toString());
                separators.add(c);
                current.setLength(0);
            } else {
                throw new AmountParseException(RejectionReason.MALFORMED_AMOUNT,
                        "Unexpected character '" + c + "' in: " + token);
            }
        }
        if (current.length() == 0) {
            throw new AmountParseException(RejectionReason.MALFORMED_AMOUNT, "Trailing separator in: " + token);
        }
        groups.add(current.toString());

        Character decimalSeparator = findDecimalSeparator(token, groups, separators, currency);

        String integerPart;
        String fractionPart = "";
        if (decimalSeparator != null) {
            List<String> integerGroups = groups.subList(0, groups.size() - 1);
            List<Character> groupingSeparators = separators.subList(0, separators.size() - 1);
            checkGrouping(token, integerGroups, groupingSeparators);
            integerPart = String.join("", integerGroups);
            fractionPart = groups.get(groups.size() - 1);
        } else {
            checkGrouping(token, groups, separators);
            integerPart = String.join("", groups);
        }

        if (currency != null && fractionPart.length() > currency.minorUnits()) {
            throw new AmountParseException(RejectionReason.MALFORMED_AMOUNT, String.format(
                    "%s has %d decimal places, %s allows %d",
                    token, fractionPart.length(), currency, currency.minorUnits()));
        }

        BigDecimal value = fractionPart.isEmpty()
                ? new BigDecimal(integerPart)
                : new BigDecimal(integerPart + "." + fractionPart);
        return new ParsedAmount(value, fractionPart.length());
    }

    private static Character findDecimalSeparator(String token, List<String> groups,
                                                  List<Character> separators, CurrencyCode currency) {
        if (separators.isEmpty()) {
            return null;
        }
        char last = separators.get(separators.size() - 1);
        if (last != '.' && last != ',') {
            return null;
        }

        long lastCount = separators.stream().filter(s -> s == last).count();
        boolean hasOtherMark = separators.stream().anyMatch(s -> s != last);

        if (lastCount > 1) {
            // 1.234.567 or 1,234,567
            return null;
        }
        if (hasOtherMark) {
            // 1.234,56 / 1'234.50 / 1 234,56
            return last;
        }

        int digitsAfter = groups.get(groups.size() - 1).length();
        if (digitsAfter != 3) {
            return last;
        }
        if (groups.get(0).chars().allMatch(c -> c == '0')) {
            // 0.750: a zero can never lead a thousands group
            return last;
        }
        if (currency == null || currency.minorUnits() == 3) {
            throw new AmountParseException(RejectionReason.AMBIGUOUS_GROUPING,
                    "Cannot tell thousands from decimal separator in: " + token);
        }
        // three decimals are not valid for this currency
        return null;
    }

    private static void checkGrouping(String token, List<String> groups, List<Character> separators) {
        if (separators.isEmpty()) {
            return;
        }
        char grouping = separators.get(0);
        for (char separator : separators) {
            if (separator != grouping) {
                throw new AmountParseException(RejectionReason.MALFORMED_AMOUNT,
                        "Mixed grouping separators in: " + token);
            }
        }
        if (groups.get(0).length() > 3) {
            throw new AmountParseException(RejectionReason.MALFORMED_AMOUNT,
                    "Leading digit group too long in: " + token);
        }
        if (!isThousandsGrouping(groups) && !isLakhGrouping(groups)) {
            throw new AmountParseException(RejectionReason.MALFORMED_AMOUNT,
                    "Irregular digit groups in: " + token);
        }
    }

    private static boolean isThousandsGrouping(List<String> groups) {
        return groups.stream().skip(1).allMatch(group -> group.length() == 3);
    }

    /** Indian style: 12,34,56,789. */
    private static boolean isLakhGrouping(List<String> groups) {
        int last = groups.size() - 1;
        if (groups.get(0).length() > 2 || groups.get(last).length() != 3) {
            return false;
        }
        return groups.subList(1, last).stream().allMatch(group -> group.length() == 2);
    }
}
