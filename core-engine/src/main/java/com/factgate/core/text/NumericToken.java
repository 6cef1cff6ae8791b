package com.factgate.core.text;

import java.util.Objects;

/**
 * A numeric literal found in text.
 *
 * <p>
 * {@code text} is the full matched span including any currency symbol or
 * percent sign; {@code literal} is the bare digits-and-separators part and
 * {@code normalized} its canonical form (see {@link NumberNormalizer}).
 * </p>
 *
 * @since 1.0.0
 */
public final class NumericToken {

    private final String text;
    private final String literal;
    private final String normalized;
    private final int start;
    private final int literalStart;
    private final boolean decorated;

    NumericToken(String text, String literal, String normalized, int start, int literalStart, boolean decorated) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.literal = Objects.requireNonNull(literal, "literal must not be null");
        this.normalized = Objects.requireNonNull(normalized, "normalized must not be null");
        this.start = start;
        this.literalStart = literalStart;
        this.decorated = decorated;
    }

    public String getText() {
        return text;
    }

    public String getLiteral() {
        return literal;
    }

    public String getNormalized() {
        return normalized;
    }

    /**
     * @return offset of the matched span in the scanned text
     */
    public int getStart() {
        return start;
    }

    public int getEnd() {
        return start + text.length();
    }

    /**
     * @return offset of the bare literal in the scanned text
     */
    public int getLiteralStart() {
        return literalStart;
    }

    public int getLiteralEnd() {
        return literalStart + literal.length();
    }

    /**
     * @return {@code true} if a currency symbol/code or percent sign was attached
     */
    public boolean isDecorated() {
        return decorated;
    }

    /**
     * @return {@code true} for a plain run of digits with no separators or
     *         decoration
     */
    public boolean isPlainInteger() {
        return !decorated && literal.chars().allMatch(Character::isDigit);
    }

    NumericToken shift(int delta) {
        return new NumericToken(text, literal, normalized, start + delta, literalStart + delta, decorated);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NumericToken that))
            return false;
        return start == that.start && literalStart == that.literalStart && decorated == that.decorated
                && text.equals(that.text) && literal.equals(that.literal) && normalized.equals(that.normalized);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, literal, normalized, start, literalStart, decorated);
    }

    @Override
    public String toString() {
        return "NumericToken{'" + text + "' -> " + normalized + " @" + start + '}';
    }
}
