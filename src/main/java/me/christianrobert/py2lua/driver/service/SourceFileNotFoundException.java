package me.christianrobert.py2lua.driver.service;

import java.nio.file.Path;

/**
 * The configured syntax tree file does not exist. Raised before any translation starts.
 */
public class SourceFileNotFoundException extends RuntimeException {

    private final Path source;

    public SourceFileNotFoundException(Path source) {
        super("Source file " + source + " not found");
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
