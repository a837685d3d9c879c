package com.example.translation.source;

import com.example.translation.common.TranslationSourceException;

import java.nio.file.Path;
import java.util.List;

/**
 * Read-only access to the translation source tree on durable storage.
 */
public interface SourceTreeReader {

    /**
     * Lists the direct children of a directory.
     *
     * @param directory directory to list
     * @return the entries, or an empty list when the directory does not exist
     * @throws TranslationSourceException if the directory exists but cannot be listed
     */
    List<SourceEntry> list(Path directory);

    /**
     * Reads a document as UTF-8 text.
     *
     * @param document document to read
     * @return the content, or an empty string when the document does not exist
     * @throws TranslationSourceException if the document exists but cannot be read
     */
    String read(Path document);
}
