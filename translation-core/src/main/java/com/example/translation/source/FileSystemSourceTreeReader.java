package com.example.translation.source;

import com.example.translation.common.TranslationSourceException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link SourceTreeReader} backed by the default file system.
 *
 * <p>Symbolic links below the listed directory are reported as neither file nor
 * directory, so they are never followed.
 */
public class FileSystemSourceTreeReader implements SourceTreeReader {

    @Override
    public List<SourceEntry> list(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> stream = children(directory)) {
            return stream
                    .map(child -> new SourceEntry(
                            child.getFileName().toString(),
                            child,
                            Files.isRegularFile(child, LinkOption.NOFOLLOW_LINKS),
                            Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)))
                    .collect(Collectors.toList());
        } catch (UncheckedIOException ex) {
            throw new TranslationSourceException(directory, ex.getCause());
        } catch (IOException | SecurityException ex) {
            throw new TranslationSourceException(directory, ex);
        }
    }

    @Override
    public String read(Path document) {
        if (!Files.exists(document)) {
            return "";
        }
        try {
            return Files.readString(document, StandardCharsets.UTF_8);
        } catch (IOException | SecurityException ex) {
            throw new TranslationSourceException(document, ex);
        }
    }

    Stream<Path> children(Path directory) throws IOException {
        return Files.list(directory);
    }
}
