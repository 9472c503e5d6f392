package com.afterlands.aftertranslator.bootstrap;

import com.afterlands.aftertranslator.api.model.Locale;
import com.afterlands.aftertranslator.api.service.Translator;
import com.afterlands.aftertranslator.core.cache.TemplateCache;
import com.afterlands.aftertranslator.core.catalogue.CatalogueBag;
import com.afterlands.aftertranslator.core.loader.CatalogueFormat;
import com.afterlands.aftertranslator.core.loader.CatalogueLoadException;
import com.afterlands.aftertranslator.core.loader.CatalogueLoader;
import com.afterlands.aftertranslator.core.resolver.LocaleNegotiator;
import com.afterlands.aftertranslator.core.service.TranslatorImpl;
import com.afterlands.aftertranslator.core.template.Interpolator;
import com.afterlands.aftertranslator.core.template.TemplateParser;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Builds a ready {@link Translator} from {@link TranslatorSettings}.
 *
 * <h3>Initialization Order:</h3>
 * <ol>
 *     <li>Resolve enabled catalogue formats</li>
 *     <li>Load the catalogue directory (populate the bag)</li>
 *     <li>Create the template cache</li>
 *     <li>Create the translator (freezes the bag)</li>
 *     <li>Create the locale negotiator over the loaded locales</li>
 * </ol>
 */
public class TranslatorBootstrap {

    private final TranslatorSettings settings;
    private final Path baseDirectory;
    private final Logger logger;

    private CatalogueLoader loader;
    private TemplateCache templateCache;
    private TranslatorImpl translator;
    private LocaleNegotiator negotiator;

    /**
     * Creates a bootstrap.
     *
     * @param settings Settings
     * @param baseDirectory Directory relative catalogue paths resolve against
     * @param logger Logger
     */
    public TranslatorBootstrap(
            @NotNull TranslatorSettings settings,
            @NotNull Path baseDirectory,
            @NotNull Logger logger
    ) {
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory cannot be null");
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
    }

    /**
     * Loads settings from a file and initializes everything.
     *
     * <p>A relative catalogue directory resolves against the settings file's
     * directory.</p>
     *
     * @param settingsFile Path to translator.yml
     * @param logger Logger
     * @return Initialized bootstrap
     * @throws IOException If the settings cannot be read
     * @throws CatalogueLoadException If the catalogues cannot be loaded
     */
    @NotNull
    public static TranslatorBootstrap fromFile(@NotNull Path settingsFile, @NotNull Logger logger)
            throws IOException, CatalogueLoadException {
        TranslatorSettings settings = TranslatorSettings.load(settingsFile);
        Path parent = settingsFile.toAbsolutePath().getParent();

        TranslatorBootstrap bootstrap = new TranslatorBootstrap(settings, parent, logger);
        bootstrap.initialize();
        return bootstrap;
    }

    /**
     * Initializes all services.
     *
     * @throws CatalogueLoadException If the catalogues cannot be loaded
     * @throws IllegalStateException If already initialized
     */
    public void initialize() throws CatalogueLoadException {
        if (translator != null) {
            throw new IllegalStateException("Already initialized");
        }

        boolean debug = settings.isDebug();
        logger.info("[Bootstrap] Initializing translator...");
        if (debug) {
            logger.fine("[Bootstrap] " + settings);
        }

        // 1. Formats
        List<CatalogueFormat> formats = resolveFormats(settings.getCatalogueFormats());

        // 2. Catalogues
        this.loader = new CatalogueLoader(formats, logger, debug);
        Path directory = settings.resolveCatalogueDirectory(baseDirectory);
        CatalogueBag bag = loader.load(directory);

        // 3. Template cache
        this.templateCache = new TemplateCache(
                new TemplateParser(new Interpolator()),
                settings.getCacheMaxTemplates(),
                settings.getCacheExpireAfterAccessMinutes()
        );

        // 4. Translator
        this.translator = new TranslatorImpl(
                bag,
                templateCache,
                settings.getFallbackLocale(),
                logger,
                settings.isLogMissingMessages(),
                debug
        );

        // 5. Negotiator
        Locale defaultLocale = settings.getFallbackLocale() != null ? settings.getFallbackLocale() : Locale.ENGLISH;
        this.negotiator = new LocaleNegotiator(defaultLocale, bag.locales());

        logger.info("[Bootstrap] Translator ready (" + translator.getCatalogues().getStats() + ")");
    }

    @NotNull
    private List<CatalogueFormat> resolveFormats(@NotNull List<String> names) {
        List<CatalogueFormat> formats = new ArrayList<>();
        for (String name : names) {
            CatalogueFormat format = CatalogueLoader.formatByName(name).orElseThrow(() ->
                    new IllegalArgumentException("Unknown catalogue format: '" + name + "' (expected yaml or json)"));
            formats.add(format);
        }
        return formats;
    }

    // ==================== Getters ====================

    @NotNull
    public TranslatorSettings getSettings() {
        return settings;
    }

    @NotNull
    public Translator getTranslator() {
        return requireInitialized(translator);
    }

    @NotNull
    public LocaleNegotiator getNegotiator() {
        return requireInitialized(negotiator);
    }

    @NotNull
    public TemplateCache getTemplateCache() {
        return requireInitialized(templateCache);
    }

    @NotNull
    public CatalogueLoader getLoader() {
        return requireInitialized(loader);
    }

    private static <T> T requireInitialized(T service) {
        if (service == null) {
            throw new IllegalStateException("TranslatorBootstrap not initialized");
        }
        return service;
    }
}
