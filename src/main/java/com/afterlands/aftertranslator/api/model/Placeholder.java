package com.afterlands.aftertranslator.api.model;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A named value for template substitution.
 *
 * <p>Replaces {@code {key}} in message templates. The value keeps its type
 * (string, integer, floating point, ...) until it is rendered, so a
 * {@code count} placeholder can also drive plural selection.</p>
 *
 * @param key The placeholder key (without braces)
 * @param value The replacement value
 */
public record Placeholder(@NotNull String key, @NotNull Object value) {

    public Placeholder {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
    }

    /**
     * Creates a new placeholder.
     *
     * @param key Placeholder key
     * @param value Replacement value
     * @return New placeholder
     */
    @NotNull
    public static Placeholder of(@NotNull String key, @NotNull Object value) {
        return new Placeholder(key, value);
    }
}
