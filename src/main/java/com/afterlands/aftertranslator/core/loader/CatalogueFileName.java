package com.afterlands.aftertranslator.core.loader;

import com.afterlands.aftertranslator.api.model.Locale;
import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Parsed catalogue file name: {@code {domain}.{locale}.{ext}}.
 *
 * <p>The domain may itself contain dots: {@code app.errors.pt_BR.yml} is
 * domain {@code app.errors}, locale {@code pt_BR}.</p>
 *
 * @param domain Message domain
 * @param locale Locale of every message in the file
 * @param extension File extension, without the dot
 */
public record CatalogueFileName(@NotNull String domain, @NotNull Locale locale, @NotNull String extension) {

    public CatalogueFileName {
        Objects.requireNonNull(domain, "domain cannot be null");
        Objects.requireNonNull(locale, "locale cannot be null");
        Objects.requireNonNull(extension, "extension cannot be null");
    }

    /**
     * Parses a file name.
     *
     * @param file Catalogue file
     * @return Parsed name
     * @throws CatalogueLoadException If the name does not follow the convention
     */
    @NotNull
    public static CatalogueFileName parse(@NotNull Path file) throws CatalogueLoadException {
        String fileName = file.getFileName().toString();

        int extensionDot = fileName.lastIndexOf('.');
        int localeDot = extensionDot <= 0 ? -1 : fileName.lastIndexOf('.', extensionDot - 1);
        if (localeDot <= 0 || localeDot + 1 == extensionDot || extensionDot + 1 == fileName.length()) {
            throw new CatalogueLoadException(CatalogueLoadException.Kind.INVALID_FILENAME_FORMAT, file,
                    "Invalid filename: expected {domain}.{locale}.{ext} for '" + fileName + "'");
        }

        String domain = fileName.substring(0, localeDot);
        String localeTag = fileName.substring(localeDot + 1, extensionDot);
        String extension = fileName.substring(extensionDot + 1);

        Locale locale = Locale.lookup(localeTag).orElseThrow(() -> new CatalogueLoadException(
                CatalogueLoadException.Kind.INVALID_FILENAME_LOCALE, file,
                "Invalid filename: expected a supported locale but found '" + localeTag + "' in '" + fileName + "'"));

        return new CatalogueFileName(domain, locale, extension);
    }

    /**
     * Gets the extension of a file name, lowercased.
     *
     * @return Extension, or an empty string
     */
    @NotNull
    public static String extensionOf(@NotNull Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(java.util.Locale.ROOT);
    }
}
