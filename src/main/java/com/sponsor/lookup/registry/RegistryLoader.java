package com.sponsor.lookup.registry;

import java.io.Reader;
import java.nio.file.Path;

/**
 * Builds a {@link SponsorRegistry} from a tabular source.
 * Implementations read a specific format and must skip, not fail on,
 * individual malformed rows.
 */
public interface RegistryLoader {

    /**
     * Loads the registry from a file.
     *
     * @param source path of the register export
     * @return the fully indexed registry
     * @throws DataSourceException if the file is absent or cannot be read
     */
    SponsorRegistry load(Path source);

    /**
     * Loads the registry from a reader.
     *
     * @param reader     the reader to read from; closed on return
     * @param sourceName description used in logs and the {@link LoadResult}
     * @param callback   optional progress callback
     * @return the fully indexed registry
     * @throws DataSourceException if reading fails
     */
    SponsorRegistry load(Reader reader, String sourceName, ProgressCallback callback);

    /**
     * Returns the format supported by this loader (e.g., "csv").
     */
    String getFormat();
}
