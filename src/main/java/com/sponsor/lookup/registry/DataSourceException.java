package com.sponsor.lookup.registry;

import java.nio.file.Path;

/**
 * Runtime exception thrown when the sponsor register cannot be read.
 * Fatal to startup: no queries may be served without a loaded registry.
 */
public class DataSourceException extends RuntimeException {

    private final transient Path source;

    public DataSourceException(Path source, String message) {
        super(message);
        this.source = source;
    }

    public DataSourceException(Path source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    /**
     * Returns the path that failed to load, or null for stream sources.
     */
    public Path getSource() {
        return source;
    }
}
