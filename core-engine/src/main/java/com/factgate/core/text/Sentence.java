package com.factgate.core.text;

import java.util.Objects;

/**
 * A sentence of body text together with its position in the body.
 *
 * @since 1.0.0
 */
public final class Sentence {

    private final String text;
    private final int start;

    public Sentence(String text, int start) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        if (start < 0) {
            throw new IllegalArgumentException("start must be >= 0, got: " + start);
        }
        this.start = start;
    }

    public String getText() {
        return text;
    }

    /**
     * @return offset of the first character in the body
     */
    public int getStart() {
        return start;
    }

    /**
     * @return offset one past the last character in the body
     */
    public int getEnd() {
        return start + text.length();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Sentence that))
            return false;
        return start == that.start && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, start);
    }

    @Override
    public String toString() {
        return "Sentence{@" + start + " '" + text + "'}";
    }
}
