package com.afterlands.aftertranslator.api.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a tag does not name a supported locale.
 */
public class LocaleParseException extends TranslationException {

    private final String tag;

    public LocaleParseException(@NotNull String tag) {
        super("Invalid locale: expected a supported locale tag but found '" + tag + "'");
        this.tag = tag;
    }

    @NotNull
    public String getTag() {
        return tag;
    }
}
