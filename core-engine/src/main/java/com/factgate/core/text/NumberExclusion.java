package com.factgate.core.text;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural contexts in which a numeric literal is not treated as a factual
 * claim.
 *
 * <p>
 * Exclusions are explicit and configurable; a number is only skipped when one
 * of the enabled rules below matches it. Offsets are relative to the full
 * body text.
 * </p>
 *
 * @since 1.0.0
 */
public enum NumberExclusion {

    /** Part of an ISO calendar date such as {@code 2025-01-15}. */
    ISO_DATE {
        @Override
        public boolean excludes(NumericToken token, String body) {
            Matcher m = ISO_DATE_PATTERN.matcher(body);
            m.useTransparentBounds(true);
            m.region(Math.max(0, token.getLiteralStart() - 10), Math.min(body.length(), token.getLiteralEnd() + 10));
            while (m.find()) {
                if (m.start() <= token.getLiteralStart() && m.end() >= token.getLiteralEnd()) {
                    return true;
                }
            }
            return false;
        }
    },

    /** English ordinal such as {@code 1st}, {@code 2nd}, {@code 3rd}, {@code 4th}. */
    ORDINAL {
        @Override
        public boolean excludes(NumericToken token, String body) {
            if (!token.isPlainInteger()) {
                return false;
            }
            Matcher m = ORDINAL_SUFFIX.matcher(body);
            m.useTransparentBounds(true);
            m.region(token.getLiteralEnd(), body.length());
            return m.lookingAt();
        }
    },

    /** Ordered-list marker at the start of a line: {@code 1.} or {@code 1)}. */
    LIST_INDEX {
        @Override
        public boolean excludes(NumericToken token, String body) {
            if (!token.isPlainInteger()) {
                return false;
            }
            int lineStart = body.lastIndexOf('\n', token.getLiteralStart() - 1) + 1;
            String lead = body.substring(lineStart, token.getLiteralStart());
            if (!LIST_LEAD.matcher(lead).matches()) {
                return false;
            }
            int after = token.getLiteralEnd();
            if (after >= body.length() || (body.charAt(after) != '.' && body.charAt(after) != ')')) {
                return false;
            }
            return after + 1 == body.length() || Character.isWhitespace(body.charAt(after + 1));
        }
    },

    /** Plain four-digit year between 1900 and 2100. */
    YEAR {
        @Override
        public boolean excludes(NumericToken token, String body) {
            if (!token.isPlainInteger() || token.getLiteral().length() != 4) {
                return false;
            }
            int value = Integer.parseInt(token.getLiteral());
            return value >= 1900 && value <= 2100;
        }
    };

    private static final Pattern ISO_DATE_PATTERN = Pattern.compile("(?<!\\d)\\d{4}-\\d{2}-\\d{2}(?!\\d)");
    private static final Pattern ORDINAL_SUFFIX = Pattern.compile("(?i)(?:st|nd|rd|th)(?![\\p{L}\\p{N}])");
    private static final Pattern LIST_LEAD = Pattern.compile("[ \\t]*(?:[-*+][ \\t]+)?");

    /**
     * Decide whether {@code token} is excluded by this rule.
     *
     * @param token a token scanned from {@code body}
     * @param body  the full body text
     * @return {@code true} if the token must not be grounding-checked
     */
    public abstract boolean excludes(NumericToken token, String body);

    /**
     * @return every exclusion; the default configuration
     */
    public static Set<NumberExclusion> defaults() {
        return EnumSet.allOf(NumberExclusion.class);
    }

    /**
     * @param value configuration value such as {@code iso_date}
     * @return the matching exclusion
     * @throws IllegalArgumentException if the value is unknown
     */
    public static NumberExclusion fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Number exclusion must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown number exclusion: '" + value
                    + "'. Supported: iso_date, ordinal, list_index, year", e);
        }
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
