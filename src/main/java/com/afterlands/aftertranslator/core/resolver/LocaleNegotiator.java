package com.afterlands.aftertranslator.core.resolver;

import com.afterlands.aftertranslator.api.model.Locale;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Picks a {@link Locale} from an HTTP {@code Accept-Language} header.
 *
 * <p>Ranges are tried by descending weight. For each range the exact tag is
 * tried first, then its base language. The first supported locale wins;
 * when none is, the default locale is returned.</p>
 *
 * <h3>Examples (all locales supported, default en):</h3>
 * <pre>
 * Accept-Language          -> Locale
 * fr-CH, fr;q=0.9, en;q=0.8 -> fr_CH
 * pt-BR                     -> pt_BR
 * zh-Hant-TW                -> zh
 * *                         -> en
 * (missing / malformed)     -> en
 * </pre>
 */
public class LocaleNegotiator {

    private final Locale defaultLocale;
    private final Set<Locale> supported;

    /**
     * Creates a negotiator limited to some locales.
     *
     * @param defaultLocale Locale returned when nothing matches
     * @param supported Accepted locales (empty = every locale)
     */
    public LocaleNegotiator(@NotNull Locale defaultLocale, @NotNull Collection<Locale> supported) {
        this.defaultLocale = Objects.requireNonNull(defaultLocale, "defaultLocale cannot be null");
        Objects.requireNonNull(supported, "supported cannot be null");
        this.supported = supported.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.allOf(Locale.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(supported));
    }

    /**
     * Creates a negotiator accepting every locale.
     */
    public LocaleNegotiator(@NotNull Locale defaultLocale) {
        this(defaultLocale, Collections.emptySet());
    }

    /**
     * Negotiates a locale.
     *
     * @param acceptLanguage Header value, may be null
     * @return Best supported locale, or the default
     */
    @NotNull
    public Locale negotiate(@Nullable String acceptLanguage) {
        return match(acceptLanguage).orElse(defaultLocale);
    }

    /**
     * Finds the best supported locale without applying the default.
     *
     * @param acceptLanguage Header value, may be null
     * @return Matched locale, or empty
     */
    @NotNull
    public Optional<Locale> match(@Nullable String acceptLanguage) {
        if (acceptLanguage == null || acceptLanguage.isBlank()) {
            return Optional.empty();
        }

        List<java.util.Locale.LanguageRange> ranges;
        try {
            ranges = java.util.Locale.LanguageRange.parse(acceptLanguage);
        } catch (IllegalArgumentException e) {
            // Malformed header: treated as absent
            return Optional.empty();
        }

        for (java.util.Locale.LanguageRange range : ranges) {
            if (range.getWeight() <= 0.0) {
                continue;
            }

            Optional<Locale> locale = resolveRange(range.getRange());
            if (locale.isPresent()) {
                return locale;
            }
        }
        return Optional.empty();
    }

    @NotNull
    private Optional<Locale> resolveRange(@NotNull String range) {
        if (range.startsWith("*")) {
            return Optional.empty();
        }

        Optional<Locale> exact = Locale.lookup(range).filter(supported::contains);
        if (exact.isPresent()) {
            return exact;
        }

        int separator = range.indexOf('-');
        String language = separator < 0 ? range : range.substring(0, separator);
        return Locale.base(language).filter(supported::contains);
    }

    @NotNull
    public Locale getDefaultLocale() {
        return defaultLocale;
    }

    @NotNull
    public Set<Locale> getSupported() {
        return supported;
    }
}
