package com.afterlands.aftertranslator.api.exception;

import com.afterlands.aftertranslator.api.model.Locale;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when no locale of the fallback chain defines the requested message.
 */
public class MessageNotFoundException extends TranslationException {

    private final String domain;
    private final String id;
    private final List<Locale> attemptedLocales;

    public MessageNotFoundException(
            @NotNull String domain,
            @NotNull String id,
            @NotNull List<Locale> attemptedLocales
    ) {
        super("Message not found: '" + id + "' in domain '" + domain + "' (tried "
                + attemptedLocales.stream().map(Locale::tag).collect(Collectors.joining(", ")) + ")");
        this.domain = domain;
        this.id = id;
        this.attemptedLocales = List.copyOf(attemptedLocales);
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
     * Locales consulted, in the order they were tried.
     *
     * @return Immutable list of attempted locales
     */
    @NotNull
    public List<Locale> getAttemptedLocales() {
        return attemptedLocales;
    }
}
