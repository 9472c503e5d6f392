package com.afterlands.aftertranslator.core.template;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * A template after parsing.
 *
 * <p>A simple template has no guarded branches and only a default text.
 * A pluralized template has at least one guarded branch, in declaration
 * order, plus the default text used when no guard matches.</p>
 *
 * @param raw Template as stored in the catalogue
 * @param branches Guarded branches, in declaration order
 * @param defaultText Default (unguarded) branch
 */
public record ParsedTemplate(
        @NotNull String raw,
        @NotNull List<PluralBranch> branches,
        @NotNull CompiledText defaultText
) {

    public ParsedTemplate {
        Objects.requireNonNull(raw, "raw cannot be null");
        Objects.requireNonNull(branches, "branches cannot be null");
        Objects.requireNonNull(defaultText, "defaultText cannot be null");
        branches = List.copyOf(branches);
    }

    /**
     * Checks if the template needs a count to be rendered.
     */
    public boolean isPluralized() {
        return !branches.isEmpty();
    }
}
