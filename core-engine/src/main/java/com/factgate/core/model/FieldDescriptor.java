package com.factgate.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Declares one factual field of a work product.
 *
 * <p>
 * Factual fields are never discovered from key suffixes; every field the
 * engine checks must be declared up front. A descriptor carries the field
 * name, its semantic {@link FieldType}, whether its {@code X_source} may be
 * {@code null}, and the prose aliases under which the field is
 * mentioned in body text.
 * </p>
 *
 * <p>
 * The field name itself and its underscore-to-space form (e.g.
 * {@code fee amount} for {@code fee_amount}) are always aliases.
 * </p>
 *
 * @since 1.0.0
 */
public final class FieldDescriptor {

    private final String name;
    private final FieldType type;
    private final boolean sourceNullable;
    private final List<String> aliases;

    private FieldDescriptor(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Field name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
        this.type = Objects.requireNonNull(builder.type, "Field type must not be null for '" + name + "'");
        this.sourceNullable = builder.sourceNullable;

        Set<String> all = new LinkedHashSet<>();
        all.add(name.toLowerCase(Locale.ROOT));
        all.add(name.replace('_', ' ').toLowerCase(Locale.ROOT));
        for (String alias : builder.aliases) {
            if (alias != null && !alias.isBlank()) {
                all.add(alias.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.aliases = Collections.unmodifiableList(new ArrayList<>(all));
    }

    /**
     * Shorthand for a descriptor with no extra aliases and a required source.
     *
     * @param name field name
     * @param type semantic type
     * @return the descriptor
     */
    public static FieldDescriptor of(String name, FieldType type) {
        return builder().name(name).type(type).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link FieldDescriptor}. {@code name} and
     * {@code type} are required.
     */
    public static class Builder {
        private String name;
        private FieldType type;
        private boolean sourceNullable;
        private final List<String> aliases = new ArrayList<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(FieldType type) {
            this.type = type;
            return this;
        }

        public Builder sourceNullable(boolean sourceNullable) {
            this.sourceNullable = sourceNullable;
            return this;
        }

        public Builder alias(String alias) {
            this.aliases.add(alias);
            return this;
        }

        public Builder aliases(List<String> aliases) {
            if (aliases != null) {
                this.aliases.addAll(aliases);
            }
            return this;
        }

        public FieldDescriptor build() {
            return new FieldDescriptor(this);
        }
    }

    public String getName() {
        return name;
    }

    public FieldType getType() {
        return type;
    }

    public boolean isSourceNullable() {
        return sourceNullable;
    }

    /**
     * @return unmodifiable, lowercase aliases; the name comes first
     */
    public List<String> getAliases() {
        return aliases;
    }

    /**
     * @return the {@code X_source} key for this field
     */
    public String sourceKey() {
        return name + WorkProduct.SOURCE_SUFFIX;
    }

    /**
     * @return the {@code X_verified_at} key for this field
     */
    public String verifiedAtKey() {
        return name + WorkProduct.VERIFIED_AT_SUFFIX;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FieldDescriptor that))
            return false;
        return sourceNullable == that.sourceNullable
                && name.equals(that.name)
                && type == that.type
                && aliases.equals(that.aliases);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, sourceNullable, aliases);
    }

    @Override
    public String toString() {
        return "FieldDescriptor{" +
                "name='" + name + '\'' +
                ", type=" + type +
                ", sourceNullable=" + sourceNullable +
                ", aliases=" + aliases +
                '}';
    }
}
