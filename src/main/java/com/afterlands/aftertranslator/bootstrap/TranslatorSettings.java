package com.afterlands.aftertranslator.bootstrap;

import com.afterlands.aftertranslator.api.model.Locale;
import com.afterlands.aftertranslator.core.loader.TextScalarResolver;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Settings loaded from {@code translator.yml}.
 *
 * <h3>Keys (defaults):</h3>
 * <pre>
 * fallback-locale: en               # "none" disables the fallback
 * catalogues:
 *   directory: translations         # relative to the settings file
 *   formats: [yaml, json]
 * cache:
 *   max-templates: 1000
 *   expire-after-access-minutes: 30
 * log-missing-messages: true
 * debug: false
 * </pre>
 *
 * <p>Missing keys take their default. Invalid values raise
 * {@link IllegalArgumentException}.</p>
 */
public class TranslatorSettings {

    /** Classpath resource holding the default settings */
    public static final String DEFAULT_RESOURCE = "translator.yml";

    private static final String NO_FALLBACK = "none";

    private final Locale fallbackLocale;
    private final Path catalogueDirectory;
    private final List<String> catalogueFormats;
    private final long cacheMaxTemplates;
    private final long cacheExpireAfterAccessMinutes;
    private final boolean logMissingMessages;
    private final boolean debug;

    /**
     * Creates settings from a parsed YAML document.
     *
     * @param root Top-level mapping (may be empty)
     */
    public TranslatorSettings(@NotNull Map<?, ?> root) {
        Objects.requireNonNull(root, "root cannot be null");

        this.fallbackLocale = parseFallbackLocale(getString(root, "fallback-locale", "en"));

        Map<?, ?> catalogues = getSection(root, "catalogues");
        this.catalogueDirectory = Path.of(Objects.requireNonNullElse(
                getString(catalogues, "directory", "translations"), "translations"));
        this.catalogueFormats = getStringList(catalogues, "formats", List.of("yaml", "json"));

        Map<?, ?> cache = getSection(root, "cache");
        this.cacheMaxTemplates = getPositiveLong(cache, "max-templates", 1000);
        this.cacheExpireAfterAccessMinutes = getPositiveLong(cache, "expire-after-access-minutes", 30);

        this.logMissingMessages = getBoolean(root, "log-missing-messages", true);
        this.debug = getBoolean(root, "debug", false);
    }

    /**
     * Gets settings with every key at its default.
     */
    @NotNull
    public static TranslatorSettings defaults() {
        return new TranslatorSettings(Collections.emptyMap());
    }

    /**
     * Loads settings from a file.
     *
     * @param file Settings file
     * @return Settings
     * @throws IOException If the file cannot be read or is not valid YAML
     */
    @NotNull
    public static TranslatorSettings load(@NotNull Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8), file.toString());
    }

    /**
     * Loads the default settings bundled on the classpath.
     *
     * @throws IOException If the resource is missing or invalid
     */
    @NotNull
    public static TranslatorSettings loadDefault() throws IOException {
        try (InputStream in = TranslatorSettings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Default settings resource not found: " + DEFAULT_RESOURCE);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), DEFAULT_RESOURCE);
        }
    }

    /**
     * Parses settings from YAML text.
     *
     * @param yaml YAML content
     * @param source Source name for error messages
     * @throws IOException If the content is not a YAML mapping
     */
    @NotNull
    public static TranslatorSettings parse(@NotNull String yaml, @NotNull String source) throws IOException {
        Object root;
        try {
            root = TextScalarResolver.newYaml().load(yaml);
        } catch (YAMLException e) {
            throw new IOException("Failed to parse settings " + source + ": " + e.getMessage(), e);
        }

        if (root == null) {
            return defaults();
        }
        if (!(root instanceof Map<?, ?> map)) {
            throw new IOException("Invalid settings " + source + ": expected a mapping at the top level");
        }
        return new TranslatorSettings(map);
    }

    // ==================== Getters ====================

    /**
     * Gets the fallback locale.
     *
     * @return Fallback locale, or null if disabled
     */
    @Nullable
    public Locale getFallbackLocale() {
        return fallbackLocale;
    }

    /**
     * Gets the catalogue directory as configured (possibly relative).
     */
    @NotNull
    public Path getCatalogueDirectory() {
        return catalogueDirectory;
    }

    /**
     * Resolves the catalogue directory against a base directory.
     *
     * @param baseDirectory Directory of the settings file
     * @return Absolute or base-relative directory
     */
    @NotNull
    public Path resolveCatalogueDirectory(@NotNull Path baseDirectory) {
        return catalogueDirectory.isAbsolute() ? catalogueDirectory : baseDirectory.resolve(catalogueDirectory);
    }

    @NotNull
    public List<String> getCatalogueFormats() {
        return catalogueFormats;
    }

    public long getCacheMaxTemplates() {
        return cacheMaxTemplates;
    }

    public long getCacheExpireAfterAccessMinutes() {
        return cacheExpireAfterAccessMinutes;
    }

    public boolean isLogMissingMessages() {
        return logMissingMessages;
    }

    public boolean isDebug() {
        return debug;
    }

    // ==================== Parsing helpers ====================

    @Nullable
    private static Locale parseFallbackLocale(@Nullable String value) {
        if (value == null || value.isBlank() || value.trim().equalsIgnoreCase(NO_FALLBACK)) {
            return null;
        }
        return Locale.lookup(value).orElseThrow(() ->
                new IllegalArgumentException("Invalid fallback-locale: '" + value + "' is not a supported locale"));
    }

    @NotNull
    private static Map<?, ?> getSection(@NotNull Map<?, ?> parent, @NotNull String key) {
        Object value = parent.get(key);
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map<?, ?> section)) {
            throw new IllegalArgumentException("Invalid " + key + ": expected a section");
        }
        return section;
    }

    @Nullable
    private static String getString(@NotNull Map<?, ?> section, @NotNull String key, @Nullable String def) {
        if (!section.containsKey(key)) {
            return def;
        }
        Object value = section.get(key);
        return value == null ? null : String.valueOf(value);
    }

    private static boolean getBoolean(@NotNull Map<?, ?> section, @NotNull String key, boolean def) {
        Object value = section.get(key);
        if (value == null) {
            return def;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        throw new IllegalArgumentException("Invalid " + key + ": expected true or false but found '" + value + "'");
    }

    private static long getPositiveLong(@NotNull Map<?, ?> section, @NotNull String key, long def) {
        Object value = section.get(key);
        if (value == null) {
            return def;
        }
        if (!(value instanceof Integer || value instanceof Long) || ((Number) value).longValue() <= 0) {
            throw new IllegalArgumentException("Invalid " + key + ": expected a positive integer but found '" + value + "'");
        }
        return ((Number) value).longValue();
    }

    @NotNull
    private static List<String> getStringList(@NotNull Map<?, ?> section, @NotNull String key, @NotNull List<String> def) {
        Object value = section.get(key);
        if (value == null) {
            return def;
        }
        if (!(value instanceof List<?> list)) {
            return List.of(String.valueOf(value));
        }

        List<String> result = new ArrayList<>(list.size());
        for (Object item : list) {
            result.add(String.valueOf(item));
        }
        return List.copyOf(result);
    }

    @Override
    public String toString() {
        return "TranslatorSettings{" +
                "fallbackLocale=" + (fallbackLocale == null ? NO_FALLBACK : fallbackLocale.tag()) +
                ", catalogueDirectory=" + catalogueDirectory +
                ", catalogueFormats=" + catalogueFormats +
                ", cacheMaxTemplates=" + cacheMaxTemplates +
                ", cacheExpireAfterAccessMinutes=" + cacheExpireAfterAccessMinutes +
                ", logMissingMessages=" + logMissingMessages +
                ", debug=" + debug +
                '}';
    }
}
