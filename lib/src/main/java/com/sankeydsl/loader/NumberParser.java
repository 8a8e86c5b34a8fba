package com.sankeydsl.loader;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Lenient parser for user-typed quantities such as {@code $1,234.56}, {@code 10k}, {@code 1.5bn} or
 * {@code 5 million}. Whitespace, grouping commas and currency symbols are stripped before the
 * optional unit suffix is applied. Unparseable input, and input too large for a finite double,
 * yields {@link Double#NaN} rather than an exception so callers can treat bad cells as noise.
 */
public final class NumberParser {

    private static final String CURRENCY_SYMBOLS = "$€£¥";
    private static final String[] SUFFIXES = {"billion", "million", "bn", "k", "m", "b"};

    private NumberParser() {}

    public static double parse(String text) {
        if (text == null) {
            return Double.NaN;
        }
        String cleaned = clean(text);
        if (cleaned.isEmpty()) {
            return Double.NaN;
        }
        String lower = cleaned.toLowerCase(Locale.ROOT);
        double multiplier = 1;
        for (String suffix : SUFFIXES) {
            if (lower.endsWith(suffix)) {
                multiplier = multiplierFor(suffix);
                cleaned = cleaned.substring(0, cleaned.length() - suffix.length());
                break;
            }
        }
        if (!isPlainDecimal(cleaned)) {
            return Double.NaN;
        }
        double value = new BigDecimal(normalizeDot(cleaned)).doubleValue() * multiplier;
        return Double.isFinite(value) ? value : Double.NaN;
    }

    /** True when {@link #parse(String)} resolves the text to a finite number. */
    public static boolean isNumeric(String text) {
        return !Double.isNaN(parse(text));
    }

    /** True when the text resolves to a number strictly greater than zero. */
    public static boolean isPositive(String text) {
        return parse(text) > 0;
    }

    private static String clean(String text) {
        StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == ',' || Character.isWhitespace(ch) || Character.isSpaceChar(ch)) {
                continue;
            }
            if (CURRENCY_SYMBOLS.indexOf(ch) >= 0) {
                continue;
            }
            builder.append(ch);
        }
        return builder.toString();
    }

    private static double multiplierFor(String suffix) {
        switch (suffix) {
            case "k":
                return 1_000d;
            case "m":
            case "million":
                return 1_000_000d;
            default:
                return 1_000_000_000d;
        }
    }

    // [+-]? digits with at most one dot and at least one digit overall.
    private static boolean isPlainDecimal(String text) {
        int start = 0;
        if (!text.isEmpty() && (text.charAt(0) == '+' || text.charAt(0) == '-')) {
            start = 1;
        }
        boolean seenDigit = false;
        boolean seenDot = false;
        for (int i = start; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch >= '0' && ch <= '9') {
                seenDigit = true;
            } else if (ch == '.' && !seenDot) {
                seenDot = true;
            } else {
                return false;
            }
        }
        return seenDigit;
    }

    // BigDecimal rejects "12." and "+.5"-style forms that users type routinely.
    private static String normalizeDot(String text) {
        String normalized = text.endsWith(".") ? text + "0" : text;
        int signLength = normalized.startsWith("+") || normalized.startsWith("-") ? 1 : 0;
        if (normalized.length() > signLength && normalized.charAt(signLength) == '.') {
            normalized = normalized.substring(0, signLength) + "0" + normalized.substring(signLength);
        }
        return normalized;
    }
}
