package com.afterlands.aftertranslator.core.loader;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Raised when catalogue files cannot be loaded.
 */
public class CatalogueLoadException extends Exception {

    /**
     * Failure kind.
     */
    public enum Kind {
        /** Directory missing or not listable */
        UNREADABLE_DIRECTORY,
        /** File could not be read */
        UNREADABLE_FILE,
        /** File name is not {@code {domain}.{locale}.{ext}} */
        INVALID_FILENAME_FORMAT,
        /** File name carries an unsupported locale */
        INVALID_FILENAME_LOCALE,
        /** Content could not be parsed, or holds a non-string message */
        INVALID_CONTENT
    }

    private final Kind kind;
    private final Path path;

    public CatalogueLoadException(@NotNull Kind kind, @Nullable Path path, @NotNull String message) {
        this(kind, path, message, null);
    }

    public CatalogueLoadException(
            @NotNull Kind kind,
            @Nullable Path path,
            @NotNull String message,
            @Nullable Throwable cause
    ) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.path = path;
    }

    @NotNull
    public Kind getKind() {
        return kind;
    }

    /**
     * Gets the file or directory that failed.
     */
    @Nullable
    public Path getPath() {
        return path;
    }
}
