package com.mediator.generator.catalog.source;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceFileDiscoveryServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void testFindsJavaSourcesSortedAndSkipsDescriptors() throws IOException {
        Path pkg = Files.createDirectories(tempDir.resolve("com/acme"));
        Files.writeString(pkg.resolve("Zeta.java"), "");
        Files.writeString(pkg.resolve("Alpha.java"), "");
        Files.writeString(pkg.resolve("package-info.java"), "");
        Files.writeString(tempDir.resolve("module-info.java"), "");
        Files.writeString(pkg.resolve("notes.txt"), "");

        List<Path> files = new SourceFileDiscoveryService().discoverSourceFiles(List.of(tempDir));

        assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("Alpha.java", "Zeta.java");
    }

    @Test
    void testRootsAreListedInGivenOrder() throws IOException {
        Path first = Files.createDirectories(tempDir.resolve("b"));
        Path second = Files.createDirectories(tempDir.resolve("a"));
        Files.writeString(first.resolve("One.java"), "");
        Files.writeString(second.resolve("Two.java"), "");

        List<Path> files = new SourceFileDiscoveryService().discoverSourceFiles(List.of(first, second));

        assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("One.java", "Two.java");
    }

    @Test
    void testOverlappingRootsListEachFileOnce() throws IOException {
        Path pkg = Files.createDirectories(tempDir.resolve("src/com/acme"));
        Files.writeString(pkg.resolve("PingHandler.java"), "");
        Path nested = tempDir.resolve("src/com");
        Path redundant = tempDir.resolve("src/com/../com");

        List<Path> files = new SourceFileDiscoveryService()
                .discoverSourceFiles(List.of(tempDir.resolve("src"), nested, redundant));

        assertThat(files).hasSize(1);
        assertThat(files.get(0)).isEqualTo(pkg.resolve("PingHandler.java"));
    }
}
