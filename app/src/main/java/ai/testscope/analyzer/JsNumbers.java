package ai.testscope.analyzer;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Number conversions with JavaScript semantics: {@code String(n)}, {@code Number(s)}, {@code parseInt},
 * {@code parseFloat}.
 */
final class JsNumbers {
    private static final BigDecimal PLAIN_UPPER = new BigDecimal("1e21");
    private static final BigDecimal PLAIN_LOWER = new BigDecimal("1e-6");
    private static final Pattern LEADING_FLOAT =
            Pattern.compile("^[+-]?(Infinity|(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?)");

    private JsNumbers() {}

    /** Renders a double the way {@code String(number)} does. */
    static String format(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "Infinity" : "-Infinity";
        if (d == 0) return "0";
        var bd = new BigDecimal(Double.toString(d)).stripTrailingZeros();
        var abs = bd.abs();
        if (abs.compareTo(PLAIN_UPPER) < 0 && abs.compareTo(PLAIN_LOWER) >= 0) {
            return bd.toPlainString();
        }
        // exponent form: d[.ddd]e+N
        var unscaled = bd.unscaledValue().abs().toString();
        int exponent = unscaled.length() - 1 - bd.scale();
        var sb = new StringBuilder();
        if (bd.signum() < 0) sb.append('-');
        sb.append(unscaled.charAt(0));
        if (unscaled.length() > 1) {
            sb.append('.').append(unscaled, 1, unscaled.length());
        }
        sb.append('e').append(exponent >= 0 ? "+" : "-").append(Math.abs(exponent));
        return sb.toString();
    }

    /**
     * Parses the source text of a numeric literal: decimal with optional exponent, {@code 0x}, {@code 0o}, {@code 0b},
     * legacy octal and numeric separators. BigInt literals ({@code 10n}) have no double value and return empty.
     */
    static OptionalDouble parseLiteral(String text) {
        var s = text.replace("_", "");
        if (s.isEmpty() || s.endsWith("n")) {
            return OptionalDouble.empty();
        }
        var lower = s.toLowerCase(Locale.ROOT);
        try {
            if (lower.startsWith("0x")) return OptionalDouble.of(new BigInteger(s.substring(2), 16).doubleValue());
            if (lower.startsWith("0o")) return OptionalDouble.of(new BigInteger(s.substring(2), 8).doubleValue());
            if (lower.startsWith("0b")) return OptionalDouble.of(new BigInteger(s.substring(2), 2).doubleValue());
            if (s.length() > 1 && s.charAt(0) == '0' && s.chars().allMatch(c -> c >= '0' && c <= '7')) {
                return OptionalDouble.of(new BigInteger(s.substring(1), 8).doubleValue());
            }
            return OptionalDouble.of(Double.parseDouble(s));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /** {@code Number(string)}: whitespace trimmed, empty is 0, anything not entirely numeric is NaN. */
    static double toNumber(String s) {
        var trimmed = s.strip();
        if (trimmed.isEmpty()) return 0;
        switch (trimmed) {
            case "Infinity", "+Infinity" -> {
                return Double.POSITIVE_INFINITY;
            }
            case "-Infinity" -> {
                return Double.NEGATIVE_INFINITY;
            }
            default -> {}
        }
        if (trimmed.contains("_") || trimmed.endsWith("n") || !trimmed.matches("[+-]?[0-9A-Fa-fxXoObB.eE+-]+")) {
            return Double.NaN;
        }
        var lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("0x") || lower.startsWith("0o") || lower.startsWith("0b")) {
            return parseLiteral(trimmed).orElse(Double.NaN);
        }
        if (!trimmed.matches("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?")) {
            return Double.NaN;
        }
        return Double.parseDouble(trimmed);
    }

    /** {@code parseInt(string)} with radix 10 (or 16 for a {@code 0x} prefix): the longest leading integer. */
    static double parseInt(String s) {
        var trimmed = s.strip();
        int i = 0;
        boolean negative = false;
        if (i < trimmed.length() && (trimmed.charAt(i) == '+' || trimmed.charAt(i) == '-')) {
            negative = trimmed.charAt(i) == '-';
            i++;
        }
        int radix = 10;
        if (trimmed.regionMatches(true, i, "0x", 0, 2)) {
            radix = 16;
            i += 2;
        }
        int start = i;
        while (i < trimmed.length() && asciiDigit(trimmed.charAt(i), radix) >= 0) {
            i++;
        }
        if (i == start) return Double.NaN;
        double value = new BigInteger(trimmed.substring(start, i), radix).doubleValue();
        return negative ? -value : value;
    }

    /** Value of {@code c} as a digit in {@code radix}, or -1; only ASCII digits and letters count. */
    private static int asciiDigit(char c, int radix) {
        int value;
        if (c >= '0' && c <= '9') {
            value = c - '0';
        } else if (c >= 'a' && c <= 'z') {
            value = c - 'a' + 10;
        } else if (c >= 'A' && c <= 'Z') {
            value = c - 'A' + 10;
        } else {
            return -1;
        }
        return value < radix ? value : -1;
    }

    /** {@code parseFloat(string)}: the longest leading decimal literal. */
    static double parseFloat(String s) {
        var trimmed = s.strip();
        var m = LEADING_FLOAT.matcher(trimmed);
        if (!m.find()) return Double.NaN;
        var match = m.group();
        if (match.endsWith("Infinity")) {
            return match.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return Double.parseDouble(match);
    }

    static boolean isIntegral(double d) {
        return !Double.isInfinite(d) && d == Math.rint(d);
    }
}
