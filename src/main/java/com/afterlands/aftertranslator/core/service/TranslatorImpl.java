package com.afterlands.aftertranslator.core.service;

import com.afterlands.aftertranslator.api.exception.MessageNotFoundException;
import com.afterlands.aftertranslator.api.exception.MissingPluralContextException;
import com.afterlands.aftertranslator.api.exception.TranslationException;
import com.afterlands.aftertranslator.api.model.Context;
import com.afterlands.aftertranslator.api.model.Locale;
import com.afterlands.aftertranslator.api.service.Translator;
import com.afterlands.aftertranslator.core.cache.TemplateCache;
import com.afterlands.aftertranslator.core.catalogue.Catalogue;
import com.afterlands.aftertranslator.core.catalogue.CatalogueBag;
import com.afterlands.aftertranslator.core.template.CompiledText;
import com.afterlands.aftertranslator.core.template.ParsedTemplate;
import com.afterlands.aftertranslator.core.template.PluralSelector;
import com.afterlands.aftertranslator.core.template.TemplateParser;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Translator over a frozen {@link CatalogueBag}.
 *
 * <h3>Pipeline:</h3>
 * <ol>
 *     <li>Walk the fallback chain until a catalogue has the message</li>
 *     <li>Parse the template (cached)</li>
 *     <li>Select the plural branch, if pluralized</li>
 *     <li>Interpolate the context</li>
 * </ol>
 */
public class TranslatorImpl implements Translator {

    private final CatalogueBag catalogues;
    private final TemplateCache templateCache;
    private final PluralSelector pluralSelector;
    private final Logger logger;
    private final boolean logMissingMessages;
    private final boolean debug;

    private volatile Locale fallbackLocale;

    // Track missing messages to avoid spam
    private final Set<String> loggedMissingMessages = ConcurrentHashMap.newKeySet();

    /**
     * Creates a translator.
     *
     * @param catalogues Catalogues (frozen on construction)
     * @param templateCache Parsed template cache
     * @param fallbackLocale Locale tried last, or null
     * @param logger Logger
     * @param logMissingMessages Log each missing message once
     * @param debug Enable debug logging
     */
    public TranslatorImpl(
            @NotNull CatalogueBag catalogues,
            @NotNull TemplateCache templateCache,
            @Nullable Locale fallbackLocale,
            @NotNull Logger logger,
            boolean logMissingMessages,
            boolean debug
    ) {
        this.catalogues = Objects.requireNonNull(catalogues, "catalogues cannot be null").freeze();
        this.templateCache = Objects.requireNonNull(templateCache, "templateCache cannot be null");
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
        this.pluralSelector = new PluralSelector();
        this.fallbackLocale = fallbackLocale;
        this.logMissingMessages = logMissingMessages;
        this.debug = debug;
    }

    /**
     * Creates a translator with a default cache and no missing-message logging.
     *
     * @param catalogues Catalogues
     * @param fallbackLocale Locale tried last, or null
     */
    public TranslatorImpl(@NotNull CatalogueBag catalogues, @Nullable Locale fallbackLocale) {
        this(catalogues, new TemplateCache(new TemplateParser(), 1000, 30), fallbackLocale,
                Logger.getLogger(TranslatorImpl.class.getName()), false, false);
    }

    @Override
    @NotNull
    public String translate(
            @NotNull Locale locale,
            @NotNull String domain,
            @NotNull String id,
            @NotNull Context context
    ) throws TranslationException {
        Objects.requireNonNull(locale, "locale cannot be null");
        Objects.requireNonNull(domain, "domain cannot be null");
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(context, "context cannot be null");

        List<Locale> chain = fallbackChain(locale);
        for (Locale candidate : chain) {
            Optional<String> template = catalogues.get(candidate).flatMap(c -> c.get(domain, id));
            if (template.isPresent()) {
                if (debug && candidate != locale) {
                    logger.fine("[Translator] " + domain + ":" + id + " [" + locale.tag()
                            + "] resolved from fallback [" + candidate.tag() + "]");
                }
                return render(template.get(), candidate, domain, id, context);
            }
        }

        handleMissing(locale, domain, id);
        throw new MessageNotFoundException(domain, id, chain);
    }

    @NotNull
    private String render(
            @NotNull String template,
            @NotNull Locale locale,
            @NotNull String domain,
            @NotNull String id,
            @NotNull Context context
    ) throws TranslationException {
        ParsedTemplate parsed = templateCache.get(template);

        CompiledText text;
        if (parsed.isPluralized()) {
            Optional<Object> count = context.count();
            if (count.isEmpty()) {
                throw new MissingPluralContextException(domain, id, locale);
            }
            text = pluralSelector.select(parsed, count.get());
        } else {
            text = parsed.defaultText();
        }

        return text.render(context);
    }

    @Override
    @NotNull
    public List<Locale> fallbackChain(@NotNull Locale locale) {
        Objects.requireNonNull(locale, "locale cannot be null");

        List<Locale> chain = new ArrayList<>(3);
        Locale current = locale;
        while (current != null && !chain.contains(current)) {
            chain.add(current);
            current = current.parentFallback().orElse(null);
        }

        Locale fallback = fallbackLocale;
        if (fallback != null && !chain.contains(fallback)) {
            chain.add(fallback);
        }
        return chain;
    }

    @Override
    public boolean hasMessage(@NotNull Locale locale, @NotNull String domain, @NotNull String id) {
        for (Locale candidate : fallbackChain(locale)) {
            Optional<Catalogue> catalogue = catalogues.get(candidate);
            if (catalogue.isPresent() && catalogue.get().get(domain, id).isPresent()) {
                return true;
            }
        }
        return false;
    }

    @Override
    @Nullable
    public Locale getFallbackLocale() {
        return fallbackLocale;
    }

    @Override
    public void setFallbackLocale(@Nullable Locale locale) {
        this.fallbackLocale = locale;
        if (debug) {
            logger.fine("[Translator] Fallback locale set to " + (locale == null ? "none" : locale.tag()));
        }
    }

    /**
     * Gets the catalogues this translator reads from.
     *
     * @return Frozen bag
     */
    @NotNull
    public CatalogueBag getCatalogues() {
        return catalogues;
    }

    @NotNull
    public TemplateCache getTemplateCache() {
        return templateCache;
    }

    /**
     * Resets missing message log tracking.
     */
    public void resetMissingMessageTracking() {
        loggedMissingMessages.clear();
    }

    private void handleMissing(@NotNull Locale locale, @NotNull String domain, @NotNull String id) {
        if (!logMissingMessages) {
            return;
        }

        String fullKey = locale.tag() + ":" + domain + ":" + id;
        if (loggedMissingMessages.add(fullKey)) {
            logger.warning("[Translator] Missing message: " + domain + ":" + id + " [" + locale.tag() + "]");
        }
    }
}
