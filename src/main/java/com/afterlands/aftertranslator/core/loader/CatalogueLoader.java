package com.afterlands.aftertranslator.core.loader;

import com.afterlands.aftertranslator.core.catalogue.Catalogue;
import com.afterlands.aftertranslator.core.catalogue.CatalogueBag;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/**
 * Loads a directory of catalogue files into a {@link CatalogueBag}.
 *
 * <h3>File Structure:</h3>
 * <pre>
 * translations/
 * ├── messages.en.yml
 * ├── messages.en_US.yml
 * ├── messages.fr.json
 * └── errors.pt_BR.yaml
 * </pre>
 *
 * <p>Files for the same locale are merged into one catalogue. When two files
 * define the same (domain, id), the file later in name order wins.</p>
 */
public class CatalogueLoader {

    private final Map<String, CatalogueFormat> formatsByExtension;
    private final CatalogueFileScanner scanner;
    private final Logger logger;
    private final boolean debug;

    /**
     * Creates a catalogue loader.
     *
     * @param formats Enabled formats
     * @param logger Logger
     * @param debug Enable debug logging
     */
    public CatalogueLoader(
            @NotNull List<CatalogueFormat> formats,
            @NotNull Logger logger,
            boolean debug
    ) {
        Objects.requireNonNull(formats, "formats cannot be null");
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
        this.debug = debug;

        this.formatsByExtension = new LinkedHashMap<>();
        for (CatalogueFormat format : formats) {
            for (String extension : format.extensions()) {
                formatsByExtension.put(extension, format);
            }
        }
        this.scanner = new CatalogueFileScanner(formatsByExtension.keySet());
    }

    /**
     * Creates a loader for YAML and JSON files.
     */
    public CatalogueLoader(@NotNull Logger logger) {
        this(List.of(new YamlCatalogueFormat(), new JsonCatalogueFormat()), logger, false);
    }

    /**
     * Gets a format by its configuration name.
     *
     * @param name Format name ("yaml" or "json", case-insensitive)
     * @return Format, or empty if unknown
     */
    @NotNull
    public static Optional<CatalogueFormat> formatByName(@NotNull String name) {
        return switch (name.trim().toLowerCase(java.util.Locale.ROOT)) {
            case "yaml", "yml" -> Optional.of(new YamlCatalogueFormat());
            case "json" -> Optional.of(new JsonCatalogueFormat());
            default -> Optional.empty();
        };
    }

    /**
     * Loads every catalogue file of a directory.
     *
     * @param directory Catalogue directory
     * @return New (unfrozen) bag
     * @throws CatalogueLoadException On the first unreadable or invalid file
     */
    @NotNull
    public CatalogueBag load(@NotNull Path directory) throws CatalogueLoadException {
        Objects.requireNonNull(directory, "directory cannot be null");

        CatalogueBag bag = new CatalogueBag();
        List<Path> files = scanner.scan(directory);
        for (Path file : files) {
            bag.insert(loadFile(file));
        }

        logger.info("[CatalogueLoader] Loaded " + files.size() + " files from " + directory
                + " (" + bag.getStats() + ")");
        return bag;
    }

    /**
     * Loads a directory on an executor.
     *
     * <p>Failures complete the future exceptionally with a
     * {@link CompletionException} wrapping the {@link CatalogueLoadException}.</p>
     *
     * @param directory Catalogue directory
     * @param executor Executor for file I/O
     * @return Future bag
     */
    @NotNull
    public CompletableFuture<CatalogueBag> loadAsync(@NotNull Path directory, @NotNull Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return load(directory);
            } catch (CatalogueLoadException e) {
                logger.severe("[CatalogueLoader] Failed to load " + directory + ": " + e.getMessage());
                throw new CompletionException(e);
            }
        }, executor);
    }

    /**
     * Loads a single catalogue file.
     *
     * @param file File named {@code {domain}.{locale}.{ext}}
     * @return Catalogue holding the file's messages
     * @throws CatalogueLoadException If the file is unreadable or invalid
     */
    @NotNull
    public Catalogue loadFile(@NotNull Path file) throws CatalogueLoadException {
        CatalogueFileName name = CatalogueFileName.parse(file);

        CatalogueFormat format = formatsByExtension.get(name.extension().toLowerCase(java.util.Locale.ROOT));
        if (format == null) {
            throw new CatalogueLoadException(CatalogueLoadException.Kind.INVALID_FILENAME_FORMAT, file,
                    "Unsupported catalogue extension '" + name.extension() + "' for " + file.getFileName());
        }

        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CatalogueLoadException(CatalogueLoadException.Kind.UNREADABLE_FILE, file,
                    "Failed to read file " + file + ": " + e.getMessage(), e);
        }

        Map<String, String> messages = format.parse(content, file);

        Catalogue catalogue = new Catalogue(name.locale());
        messages.forEach((id, template) -> catalogue.insert(name.domain(), id, template));

        if (debug) {
            logger.fine("[CatalogueLoader] Loaded " + messages.size() + " messages for "
                    + name.domain() + " [" + name.locale().tag() + "] from " + file.getFileName());
        }
        return catalogue;
    }

    @NotNull
    public CatalogueFileScanner getScanner() {
        return scanner;
    }
}
