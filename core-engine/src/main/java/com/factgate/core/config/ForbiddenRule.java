package com.factgate.core.config;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One compiled lexicon rule: a forbidden verb, term or pattern.
 *
 * <p>
 * Verbs and terms compile to case-insensitive whole-word patterns; forbidden
 * patterns compile as written, case-insensitively.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForbiddenRule {

    /** Origin of a rule in the configuration. */
    public enum Kind {
        VERB, TERM, PATTERN;

        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Kind kind;
    private final String expression;
    private final Pattern pattern;

    ForbiddenRule(Kind kind, String expression, Pattern pattern) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the verb, term or regex as configured
     */
    public String getExpression() {
        return expression;
    }

    public Pattern getPattern() {
        return pattern;
    }

    /**
     * @return rule identity used in findings, e.g. {@code verb:guarantee}
     */
    public String identity() {
        return kind.value() + ":" + expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ForbiddenRule that))
            return false;
        return kind == that.kind && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, expression);
    }

    @Override
    public String toString() {
        return identity();
    }
}
