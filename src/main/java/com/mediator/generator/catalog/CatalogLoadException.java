package com.mediator.generator.catalog;

import java.nio.file.Path;

/**
 * Raised when a type catalog cannot be read from disk.
 */
public class CatalogLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final transient Path path;

    public CatalogLoadException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
