package com.sponsor.lookup.registry;

/**
 * Receives progress while a sponsor register is read. The register has no row
 * count up front, so progress is reported as rows read so far.
 */
@FunctionalInterface
public interface ProgressCallback {

    void rowsRead(long rows);

    /**
     * Called once after the last row, before the registry is returned.
     */
    default void completed(LoadResult result) {
    }

    ProgressCallback NOOP = rows -> {};
}
