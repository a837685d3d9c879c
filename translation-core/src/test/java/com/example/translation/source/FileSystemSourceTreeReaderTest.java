package com.example.translation.source;

import com.example.translation.common.TranslationSourceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemSourceTreeReaderTest {

    @TempDir
    Path root;

    private final FileSystemSourceTreeReader reader = new FileSystemSourceTreeReader();

    @Test
    void testList_ReportsFilesAndDirectories() throws IOException {
        Files.writeString(root.resolve("common.json"), "{}");
        Files.createDirectories(root.resolve("features"));

        List<SourceEntry> entries = reader.list(root);

        assertThat(entries).extracting(SourceEntry::name).containsExactlyInAnyOrder("common.json", "features");
        assertThat(entries).filteredOn(SourceEntry::file).extracting(SourceEntry::name).containsExactly("common.json");
        assertThat(entries).filteredOn(SourceEntry::directory).extracting(SourceEntry::name).containsExactly("features");
    }

    @Test
    void testList_SymbolicLinksAreNeitherFileNorDirectory() throws IOException {
        Files.writeString(root.resolve("common.json"), "{}");
        Files.createSymbolicLink(root.resolve("loop"), root);
        Files.createSymbolicLink(root.resolve("alias.json"), root.resolve("common.json"));

        List<SourceEntry> links = reader.list(root).stream()
                .filter(entry -> !entry.name().equals("common.json"))
                .collect(Collectors.toList());

        assertThat(links).hasSize(2);
        assertThat(links).noneMatch(SourceEntry::file).noneMatch(SourceEntry::directory);
    }

    @Test
    void testList_MissingDirectoryIsEmpty() {
        assertThat(reader.list(root.resolve("absent"))).isEmpty();
        assertThat(reader.read(root.resolve("absent.json"))).isEmpty();
    }

    @Test
    void testList_IterationFailureBecomesSourceException() {
        FileSystemSourceTreeReader failing = new FileSystemSourceTreeReader() {
            @Override
            Stream<Path> children(Path directory) {
                return Stream.of(directory.resolve("a.json")).map(child -> {
                    throw new UncheckedIOException(new IOException("iteration failed"));
                });
            }
        };

        assertThatThrownBy(() -> failing.list(root))
                .isInstanceOf(TranslationSourceException.class)
                .hasCauseInstanceOf(IOException.class)
                .hasRootCauseMessage("iteration failed");
        assertThat(new NamespaceDiscoverer(failing).discover(root)).isEmpty();
    }
}
