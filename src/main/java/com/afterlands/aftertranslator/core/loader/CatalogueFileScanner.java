package com.afterlands.aftertranslator.core.loader;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists catalogue files in a directory.
 *
 * <p>Only regular files directly inside the directory with one of the
 * accepted extensions are returned; subdirectories and other files are
 * ignored. Results are sorted by file name so merges are reproducible.</p>
 */
public class CatalogueFileScanner {

    private final Set<String> extensions;

    /**
     * @param extensions Accepted extensions, lowercase, without the dot
     */
    public CatalogueFileScanner(@NotNull Set<String> extensions) {
        this.extensions = Set.copyOf(extensions);
    }

    /**
     * Scans a directory.
     *
     * @param directory Catalogue directory
     * @return Catalogue files, sorted by name
     * @throws CatalogueLoadException If the directory cannot be listed
     */
    @NotNull
    public List<Path> scan(@NotNull Path directory) throws CatalogueLoadException {
        if (!Files.isDirectory(directory)) {
            throw new CatalogueLoadException(CatalogueLoadException.Kind.UNREADABLE_DIRECTORY, directory,
                    "Failed to read directory " + directory + ": not a directory");
        }

        try (Stream<Path> paths = Files.list(directory)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> extensions.contains(CatalogueFileName.extensionOf(p)))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new CatalogueLoadException(CatalogueLoadException.Kind.UNREADABLE_DIRECTORY, directory,
                    "Failed to read directory " + directory + ": " + e.getMessage(), e);
        }
    }

    @NotNull
    public Set<String> getExtensions() {
        return extensions;
    }
}
