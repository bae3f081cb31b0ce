package com.querycache.service;

import java.nio.file.Path;

/**
 * Thrown when a referenced SQL file does not exist.
 */
public class SqlFileNotFoundException extends RuntimeException {
    private final Path path;

    /**
     * Create a new exception.
     *
     * @param path resolved path that was looked up
     */
    public SqlFileNotFoundException(Path path) {
        super("File " + path + " not found");
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
