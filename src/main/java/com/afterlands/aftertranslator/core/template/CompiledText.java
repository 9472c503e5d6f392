package com.afterlands.aftertranslator.core.template;

import com.afterlands.aftertranslator.api.model.Context;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pre-compiled branch text for fast interpolation.
 *
 * <p>Escapes are already resolved in {@code parts}; rendering only
 * concatenates parts and token values.</p>
 *
 * @param source Text as written in the template (escapes unresolved)
 * @param parts Literal parts between tokens
 * @param tokens Tokens in order
 */
public record CompiledText(
        @NotNull String source,
        @NotNull List<String> parts,
        @NotNull List<Token> tokens
) {

    public CompiledText {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(parts, "parts cannot be null");
        Objects.requireNonNull(tokens, "tokens cannot be null");

        parts = List.copyOf(parts);
        tokens = List.copyOf(tokens);

        // "a {x} b" -> parts=["a ", " b"], tokens=[x]
        if (parts.size() != tokens.size() + 1) {
            throw new IllegalArgumentException(
                "Invalid compiled text: parts.size() must equal tokens.size() + 1"
            );
        }
    }

    /**
     * Renders the text with values from a context.
     *
     * <p>A token without a value is written back exactly as it appeared.</p>
     *
     * @param context Values
     * @return Rendered text
     */
    @NotNull
    public String render(@NotNull Context context) {
        if (tokens.isEmpty()) {
            return parts.get(0);
        }

        StringBuilder result = new StringBuilder(source.length() + 16);
        for (int i = 0; i < tokens.size(); i++) {
            result.append(parts.get(i));

            Token token = tokens.get(i);
            Optional<Object> value = token.resolve(context);
            result.append(value.isPresent() ? Interpolator.format(value.get()) : token.raw());
        }
        result.append(parts.get(parts.size() - 1));

        return result.toString();
    }

    public boolean hasTokens() {
        return !tokens.isEmpty();
    }

    /**
     * Placeholder token.
     *
     * @param kind Token kind
     * @param name Value name ({@link Kind#NAMED} only)
     * @param index Value index ({@link Kind#POSITIONAL} only)
     * @param raw Token as written, braces included
     */
    public record Token(@NotNull Kind kind, @Nullable String name, int index, @NotNull String raw) {

        public Token {
            Objects.requireNonNull(kind, "kind cannot be null");
            Objects.requireNonNull(raw, "raw cannot be null");
            if (kind == Kind.NAMED) {
                Objects.requireNonNull(name, "name cannot be null for a named token");
            }
        }

        @NotNull
        public static Token named(@NotNull String name, @NotNull String raw) {
            return new Token(Kind.NAMED, name, -1, raw);
        }

        @NotNull
        public static Token positional(int index, @NotNull String raw) {
            return new Token(Kind.POSITIONAL, null, index, raw);
        }

        @NotNull
        public static Token count(@NotNull String raw) {
            return new Token(Kind.COUNT, null, -1, raw);
        }

        @NotNull
        Optional<Object> resolve(@NotNull Context context) {
            return switch (kind) {
                case NAMED -> Context.COUNT_KEY.equals(name) ? context.get(name).or(context::count) : context.get(name);
                case POSITIONAL -> context.get(index);
                case COUNT -> context.count();
            };
        }
    }

    public enum Kind {
        /** {@code {name}} */
        NAMED,
        /** {@code {}} or {@code {N}} */
        POSITIONAL,
        /** {@code {?}} */
        COUNT
    }
}
