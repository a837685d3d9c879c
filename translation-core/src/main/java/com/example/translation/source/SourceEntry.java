package com.example.translation.source;

import java.nio.file.Path;

/**
 * One entry of a locale directory listing.
 */
public record SourceEntry(String name, Path path, boolean file, boolean directory) {
}
