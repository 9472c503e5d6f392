package com.afterlands.aftertranslator.api.service;

import com.afterlands.aftertranslator.api.exception.LocaleParseException;
import com.afterlands.aftertranslator.api.exception.MessageNotFoundException;
import com.afterlands.aftertranslator.api.exception.MissingPluralContextException;
import com.afterlands.aftertranslator.api.exception.TemplateException;
import com.afterlands.aftertranslator.api.exception.TranslationException;
import com.afterlands.aftertranslator.api.model.Context;
import com.afterlands.aftertranslator.api.model.Locale;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Public API for resolving translated messages.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * Translator translator = TranslatorBootstrap.fromFile(Path.of("translator.yml"), logger).getTranslator();
 *
 * // "Hello, Alice!"
 * translator.translate(Locale.ENGLISH, "messages", "greeting", Context.of("name", "Alice"));
 *
 * // "3 apples"
 * translator.translate(Locale.ENGLISH, "messages", "apples", Context.ofCount(3));
 * }</pre>
 *
 * <h3>Resolution:</h3>
 * <ol>
 *     <li>Requested locale</li>
 *     <li>Its base language (en_US -> en)</li>
 *     <li>Fallback locale, if configured and not already tried</li>
 * </ol>
 *
 * <h3>Thread Safety:</h3>
 * <p>Implementations are safe for concurrent use. The catalogues are
 * read-only once the translator is built.</p>
 */
public interface Translator {

    /**
     * Translates a message.
     *
     * @param locale Requested locale
     * @param domain Message domain (e.g., "messages")
     * @param id Message id
     * @param context Values for placeholders and the plural count
     * @return Fully resolved message
     * @throws MessageNotFoundException If no locale in the fallback chain has the message
     * @throws MissingPluralContextException If the message is pluralized and the context has no count
     * @throws TemplateException If the stored template is malformed
     */
    @NotNull
    String translate(
            @NotNull Locale locale,
            @NotNull String domain,
            @NotNull String id,
            @NotNull Context context
    ) throws TranslationException;

    /**
     * Translates a message without context values.
     */
    @NotNull
    default String translate(
            @NotNull Locale locale,
            @NotNull String domain,
            @NotNull String id
    ) throws TranslationException {
        return translate(locale, domain, id, Context.empty());
    }

    /**
     * Translates a message for a locale tag (e.g., "en-US", "pt_br").
     *
     * @throws LocaleParseException If the tag is not a supported locale
     */
    @NotNull
    default String translate(
            @NotNull String localeTag,
            @NotNull String domain,
            @NotNull String id,
            @NotNull Context context
    ) throws TranslationException {
        return translate(Locale.fromTag(localeTag), domain, id, context);
    }

    /**
     * Gets the locales tried for a requested locale, in order.
     *
     * @param locale Requested locale
     * @return Fallback chain (no duplicates)
     */
    @NotNull
    List<Locale> fallbackChain(@NotNull Locale locale);

    /**
     * Checks if any locale in the fallback chain has the message.
     */
    boolean hasMessage(@NotNull Locale locale, @NotNull String domain, @NotNull String id);

    /**
     * Gets the fallback locale.
     *
     * @return Fallback locale, or null if none
     */
    @Nullable
    Locale getFallbackLocale();

    /**
     * Sets the fallback locale, visible to every later call on any thread.
     *
     * @param locale Fallback locale, or null to disable
     */
    void setFallbackLocale(@Nullable Locale locale);
}
