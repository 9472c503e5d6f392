package com.afterlands.aftertranslator.core.template;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Guarded branch of a pluralized template.
 *
 * @param guard Guard selecting this branch
 * @param text Branch text, trimmed and compiled
 */
public record PluralBranch(@NotNull PluralGuard guard, @NotNull CompiledText text) {

    public PluralBranch {
        Objects.requireNonNull(guard, "guard cannot be null");
        Objects.requireNonNull(text, "text cannot be null");
    }
}
