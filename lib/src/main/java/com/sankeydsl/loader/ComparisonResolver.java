package com.sankeydsl.loader;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Set;

/**
 * Interprets the optional second token of a flow declaration. Numbers are read as the previous
 * period's magnitude and turned into a rounded percentage label; signed or percent tokens are kept
 * as labels; placeholders exported by spreadsheets ({@code NaN}, {@code N/A}, {@code -}) are dropped.
 * Labels holding {@code [} or {@code ]} are dropped too, since bracket text cannot carry them.
 */
public final class ComparisonResolver {

    private static final Set<String> INVALID_TOKENS =
            Set.of("nan", "null", "undefined", "n/a", "na", "none", "-", "--");

    private ComparisonResolver() {}

    /**
     * Trims the token and filters placeholder values.
     *
     * @return the trimmed token, or {@code null} when it is blank, a known placeholder or holds a
     *     bracket
     */
    public static String sanitizeLabel(String token) {
        if (token == null) {
            return null;
        }
        String trimmed = token.trim();
        if (trimmed.isEmpty() || INVALID_TOKENS.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return null;
        }
        if (trimmed.indexOf('[') >= 0 || trimmed.indexOf(']') >= 0) {
            return null;
        }
        return trimmed;
    }

    public static Comparison resolve(double currentValue, String token) {
        String comparison = sanitizeLabel(token);
        if (comparison == null) {
            return Comparison.none();
        }
        if (isFormattedLabel(comparison)) {
            return Comparison.ofLabel(comparison);
        }
        double previous = NumberParser.parse(comparison);
        if (!Double.isNaN(previous) && previous != 0) {
            return Comparison.ofPrevious(previous, percentLabel(currentValue, previous));
        }
        if (containsLetter(comparison)) {
            return Comparison.ofLabel(comparison);
        }
        return Comparison.none();
    }

    static String percentLabel(double currentValue, double previousValue) {
        double delta = currentValue - previousValue;
        double percent = delta / previousValue * 100;
        if (Double.isNaN(percent) || Double.isInfinite(percent)) {
            return delta >= 0 ? "+0%" : "-0%";
        }
        BigDecimal rounded = BigDecimal.valueOf(percent).setScale(0, RoundingMode.HALF_UP);
        String digits = rounded.abs().toPlainString();
        return (delta >= 0 ? "+" : "-") + digits + "%";
    }

    private static boolean isFormattedLabel(String token) {
        return token.startsWith("+") || token.startsWith("-") || token.endsWith("%");
    }

    private static boolean containsLetter(String token) {
        for (int i = 0; i < token.length(); i++) {
            if (Character.isLetter(token.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
