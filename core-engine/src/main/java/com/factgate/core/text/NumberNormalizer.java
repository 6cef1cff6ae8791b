package com.factgate.core.text;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Converts numeric literals to one canonical representation so that numbers
 * from body text and numbers from work product fields compare by exact
 * string equality.
 *
 * <p>
 * The canonical form is {@link BigDecimal#stripTrailingZeros()} rendered with
 * {@link BigDecimal#toPlainString()}: {@code 30}, {@code 30.0} and
 * {@code 30.00} all become {@code "30"}; {@code 1e3} becomes {@code "1000"}.
 * Values too long to print in plain form (such as {@code 1e999999999}) keep
 * the scientific rendering of the stripped value, applied alike to body
 * literals and field values.
 * </p>
 *
 * <h3>Separators</h3>
 * <ul>
 * <li>both {@code ,} and {@code .} present: the last one is the decimal
 * separator, the other groups thousands ({@code 1,234.5}, {@code 1.234,5})</li>
 * <li>one {@code .}: decimal separator</li>
 * <li>one {@code ,} followed by exactly three digits: thousands separator,
 * otherwise decimal ({@code 1,000} vs {@code 25,50})</li>
 * <li>a repeated separator: thousands separator; every group after the
 * first must then have three digits</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class NumberNormalizer {

    private static final Pattern DIGITS_AND_SEPARATORS = Pattern.compile("\\d+(?:[.,]\\d+)*");
    private static final Pattern THOUSANDS_GROUPS = Pattern.compile("\\d{1,3}(?:[.,]\\d{3})+");

    /** Values whose plain rendering would be longer than this keep scientific notation. */
    static final int MAX_PLAIN_LENGTH = 64;

    private NumberNormalizer() {
        // utility class — not instantiable
    }

    /**
     * Normalize a bare literal made of digits and {@code ,} / {@code .}
     * separators (currency symbols and percent signs already stripped).
     *
     * @param literal the literal
     * @return canonical form, or empty if the separators cannot be read as one
     *         number (e.g. {@code 1,2,3})
     */
    public static Optional<String> normalizeLiteral(String literal) {
        if (literal == null || !DIGITS_AND_SEPARATORS.matcher(literal).matches()) {
            return Optional.empty();
        }
        int lastComma = literal.lastIndexOf(',');
        int lastDot = literal.lastIndexOf('.');
        String plain;

        if (lastComma >= 0 && lastDot >= 0) {
            char decimal = lastComma > lastDot ? ',' : '.';
            char grouping = decimal == ',' ? '.' : ',';
            int decimalAt = Math.max(lastComma, lastDot);
            String integerPart = literal.substring(0, decimalAt);
            if (integerPart.indexOf(decimal) >= 0 || !isThousandsGrouped(integerPart)) {
                return Optional.empty();
            }
            plain = integerPart.replace(String.valueOf(grouping), "") + "." + literal.substring(decimalAt + 1);
        } else if (lastComma >= 0 || lastDot >= 0) {
            char sep = lastComma >= 0 ? ',' : '.';
            int count = countOf(literal, sep);
            if (count > 1) {
                if (!isThousandsGrouped(literal)) {
                    return Optional.empty();
                }
                plain = literal.replace(String.valueOf(sep), "");
            } else if (sep == ',' && literal.length() - literal.indexOf(',') - 1 == 3) {
                plain = literal.replace(",", "");
            } else {
                plain = literal.replace(sep, '.');
            }
        } else {
            plain = literal;
        }
        return Optional.of(canonical(new BigDecimal(plain)));
    }

    /**
     * Normalize a JSON number from a work product.
     *
     * @param number the parsed number
     * @return canonical form, or empty for NaN / infinite values
     */
    public static Optional<String> normalizeNumber(Number number) {
        if (number == null) {
            return Optional.empty();
        }
        if (number instanceof BigDecimal bd) {
            return Optional.of(canonical(bd));
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Optional.empty();
            }
            return Optional.of(canonical(new BigDecimal(Double.toString(d))));
        }
        return Optional.of(canonical(new BigDecimal(number.toString())));
    }

    private static String canonical(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.signum() == 0) {
            return "0";
        }
        if (plainLength(stripped) > MAX_PLAIN_LENGTH) {
            return stripped.toString();
        }
        return stripped.toPlainString();
    }

    private static long plainLength(BigDecimal stripped) {
        long precision = stripped.precision();
        long scale = stripped.scale();
        return scale <= 0 ? precision - scale : Math.max(precision, scale) + 1;
    }

    private static boolean isThousandsGrouped(String integerPart) {
        return integerPart.chars().allMatch(Character::isDigit)
                || THOUSANDS_GROUPS.matcher(integerPart).matches();
    }

    private static int countOf(String s, char c) {
        int count = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == c) {
                count++;
            }
        }
        return count;
    }
}
