package com.mediator.generator.codegen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content as UTF-8, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Removes a previously generated file. Returns whether a file was deleted.
     */
    public static boolean deleteIfExists(Path filePath) throws IOException {
        return Files.deleteIfExists(filePath);
    }
}
