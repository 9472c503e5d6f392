package com.afterlands.aftertranslator.core.template;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Condition attached to a plural branch, evaluated against an integral count.
 *
 * <h3>Syntax:</h3>
 * <ul>
 *     <li>{@code {n}} / {@code {a, b, c}} - {@link Match}</li>
 *     <li>{@code {a..b}} - {@link Range} (inclusive)</li>
 *     <li>{@code {..b}} - {@link RangeTo} (inclusive)</li>
 *     <li>{@code {a..}} - {@link RangeFrom} (inclusive)</li>
 * </ul>
 */
public interface PluralGuard {

    /**
     * Checks if the count satisfies this guard.
     *
     * @param count Count value
     * @return true if matched
     */
    boolean matches(long count);

    /**
     * Gets the guard in template syntax, braces included.
     */
    @NotNull
    String syntax();

    /**
     * Matches any of a list of discrete values.
     *
     * @param values Accepted values (never empty)
     */
    record Match(@NotNull List<Long> values) implements PluralGuard {

        public Match {
            Objects.requireNonNull(values, "values cannot be null");
            values = List.copyOf(values);
            if (values.isEmpty()) {
                throw new IllegalArgumentException("values cannot be empty");
            }
        }

        @Override
        public boolean matches(long count) {
            return values.contains(count);
        }

        @Override
        @NotNull
        public String syntax() {
            return values.stream().map(String::valueOf).collect(Collectors.joining(", ", "{", "}"));
        }
    }

    /**
     * Matches {@code from <= count <= to}.
     */
    record Range(long from, long to) implements PluralGuard {

        public Range {
            if (from > to) {
                throw new IllegalArgumentException("from (" + from + ") cannot be greater than to (" + to + ")");
            }
        }

        @Override
        public boolean matches(long count) {
            return count >= from && count <= to;
        }

        @Override
        @NotNull
        public String syntax() {
            return "{" + from + ".." + to + "}";
        }
    }

    /**
     * Matches {@code count <= to}.
     */
    record RangeTo(long to) implements PluralGuard {

        @Override
        public boolean matches(long count) {
            return count <= to;
        }

        @Override
        @NotNull
        public String syntax() {
            return "{.." + to + "}";
        }
    }

    /**
     * Matches {@code count >= from}.
     */
    record RangeFrom(long from) implements PluralGuard {

        @Override
        public boolean matches(long count) {
            return count >= from;
        }

        @Override
        @NotNull
        public String syntax() {
            return "{" + from + "..}";
        }
    }
}
