package com.mediator.generator.catalog.source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.mediator.generator.catalog.CatalogLoadException;

import lombok.NoArgsConstructor;

/**
 * Lists the {@code .java} files under a set of source roots. The result is sorted so
 * that catalog order, and with it the order duplicates are reported in, does not
 * depend on the file system. A file reached through overlapping roots is listed once,
 * under the first root that reaches it.
 */
@NoArgsConstructor
public class SourceFileDiscoveryService {

    public List<Path> discoverSourceFiles(List<Path> sourceRoots) {
        Map<Path, Path> files = new LinkedHashMap<>();
        for (Path root : sourceRoots) {
            for (Path file : discoverSourceFiles(root)) {
                files.putIfAbsent(file.toAbsolutePath().normalize(), file);
            }
        }
        return new ArrayList<>(files.values());
    }

    private List<Path> discoverSourceFiles(Path root) {
        try (Stream<Path> stream = Files.walk(root)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isJavaSource)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new CatalogLoadException(root, "Failed to list source files", e);
        }
    }

    private boolean isJavaSource(Path path) {
        String name = path.getFileName().toString();
        return name.endsWith(".java")
                && !name.equals("module-info.java")
                && !name.equals("package-info.java");
    }
}
