package com.sponsor.lookup.registry;

/**
 * Outcome of a registry load.
 *
 * @param totalRows   data rows read from the source (header excluded)
 * @param loadedRows  rows turned into sponsor records
 * @param skippedRows rows dropped because the organisation name was empty
 * @param source      description of the source (usually the file path)
 */
public record LoadResult(long totalRows, long loadedRows, long skippedRows, String source) {

    public static LoadResult empty(String source) {
        return new LoadResult(0, 0, 0, source);
    }

    @Override
    public String toString() {
        return "LoadResult{source=" + source +
                ", total=" + totalRows +
                ", loaded=" + loadedRows +
                ", skipped=" + skippedRows + '}';
    }
}
