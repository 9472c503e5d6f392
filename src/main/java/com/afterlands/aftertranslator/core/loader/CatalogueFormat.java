package com.afterlands.aftertranslator.core.loader;

import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * File format for catalogue files.
 */
public interface CatalogueFormat {

    /**
     * Gets the format name used in configuration (e.g., "yaml").
     */
    @NotNull
    String name();

    /**
     * Gets the file extensions handled, lowercase and without the dot.
     */
    @NotNull
    Set<String> extensions();

    /**
     * Parses file content into flat {@code id -> template} entries.
     *
     * @param content File content
     * @param file Source file, for error reporting
     * @return Messages in file order
     * @throws CatalogueLoadException If the content is invalid
     */
    @NotNull
    Map<String, String> parse(@NotNull String content, @NotNull Path file) throws CatalogueLoadException;
}
