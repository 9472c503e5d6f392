package com.afterlands.aftertranslator.api.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a stored template has malformed plural guard syntax.
 *
 * <p>Raised the first time the template is parsed, before any of its
 * branches can reach a caller.</p>
 */
public class TemplateException extends TranslationException {

    private final String template;
    private final String reason;

    public TemplateException(@NotNull String template, @NotNull String reason) {
        super("Malformed template '" + template + "': " + reason);
        this.template = template;
        this.reason = reason;
    }

    @NotNull
    public String getTemplate() {
        return template;
    }

    @NotNull
    public String getReason() {
        return reason;
    }
}
