package com.afterlands.aftertranslator.api.exception;

import com.afterlands.aftertranslator.api.model.Locale;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a pluralized template is resolved but the context has no count.
 */
public class MissingPluralContextException extends TranslationException {

    private final String domain;
    private final String id;
    private final Locale locale;

    public MissingPluralContextException(@NotNull String domain, @NotNull String id, @NotNull Locale locale) {
        super("Message '" + id + "' in domain '" + domain + "' [" + locale.tag()
                + "] is pluralized but the context has no count");
        this.domain = domain;
        this.id = id;
        this.locale = locale;
    }

    @NotNull
    public String getDomain() {
        return domain;
    }

    @NotNull
    public String getId() {
        return id;
    }

    /**
     * Locale whose catalogue supplied the template.
     */
    @NotNull
    public Locale getLocale() {
        return locale;
    }
}
