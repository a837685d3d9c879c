package com.example.translation.common;

import java.nio.file.Path;

/**
 * Raised by a {@link com.example.translation.source.SourceTreeReader} when a locale
 * directory or translation document cannot be read.
 */
public class TranslationSourceException extends RuntimeException {

    private final Path location;

    public TranslationSourceException(Path location, Throwable cause) {
        super("Translation source unreadable: " + location, cause);
        this.location = location;
    }

    public Path getLocation() {
        return location;
    }
}
