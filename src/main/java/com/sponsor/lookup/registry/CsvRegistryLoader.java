package com.sponsor.lookup.registry;

import com.sponsor.lookup.core.model.SponsorRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Loads the Home Office "Register of licensed sponsors: workers" CSV export.
 *
 * <p>Expected header (additional columns are ignored, order does not matter):</p>
 * <pre>
 * "Organisation Name","Town/City","County","Type &amp; Rating","Route"
 * </pre>
 *
 * <p>Bytes that are not valid UTF-8 are replaced rather than rejected. Each value is
 * trimmed of whitespace and surrounding quote characters; a missing column yields an
 * empty string. Rows whose organisation name is empty are skipped.</p>
 */
public class CsvRegistryLoader implements RegistryLoader {
    private static final Logger log = LoggerFactory.getLogger(CsvRegistryLoader.class);

    public static final String COLUMN_NAME = "Organisation Name";
    public static final String COLUMN_CITY = "Town/City";
    public static final String COLUMN_COUNTY = "County";
    public static final String COLUMN_RATING = "Type & Rating";
    public static final String COLUMN_ROUTE = "Route";

    private static final char BOM = '\uFEFF';
    private static final int PROGRESS_INTERVAL = 10_000;
    private static final Pattern EDGE_QUOTES_AND_SPACE =
            Pattern.compile("^[\\s\\p{Z}\"]+|[\\s\\p{Z}\"]+$", Pattern.UNICODE_CHARACTER_CLASS);

    private final Supplier<SponsorRegistry.Builder> builderFactory;

    public CsvRegistryLoader() {
        this(SponsorRegistry::builder);
    }

    /**
     * @param builderFactory supplies a registry builder configured with the
     *                       normalizer and blocking strategy to index with
     */
    public CsvRegistryLoader(Supplier<SponsorRegistry.Builder> builderFactory) {
        this.builderFactory = builderFactory;
    }

    @Override
    public SponsorRegistry load(Path source) {
        if (source == null || !Files.isRegularFile(source)) {
            throw new DataSourceException(source, "Sponsor CSV not found: " + source);
        }
        log.info("registry.loading source={}", source);
        InputStream input;
        try {
            input = Files.newInputStream(source);
        } catch (IOException e) {
            log.error("registry.failed source={} error={}", source, e.getMessage());
            throw new DataSourceException(source, "Sponsor CSV is not readable: " + source, e);
        }
        try {
            return load(new InputStreamReader(input, permissiveUtf8()), source.toString(), null);
        } catch (DataSourceException e) {
            throw new DataSourceException(source, e.getMessage(), e.getCause());
        }
    }

    @Override
    public SponsorRegistry load(Reader reader, String sourceName, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        SponsorRegistry.Builder builder = builderFactory.get();

        long totalRows = 0;
        long skippedRows = 0;

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            CsvRecordReader csv = new CsvRecordReader(br);
            List<String> header = csv.next();
            if (header == null) {
                log.warn("registry.empty source={}", sourceName);
                return builder.loadResult(LoadResult.empty(sourceName)).build();
            }
            Columns columns = Columns.fromHeader(header, sourceName);

            List<String> row;
            while ((row = csv.next()) != null) {
                if (isBlankRow(row)) {
                    continue;
                }
                totalRows++;
                if (csv.lastRecordUnterminated()) {
                    skippedRows++;
                    log.debug("registry.row.skipped line={} reason=unterminated-quote source={}",
                            csv.recordLine(), sourceName);
                    continue;
                }

                String name = columns.value(row, columns.name);
                if (name.isEmpty()) {
                    skippedRows++;
                    log.debug("registry.row.skipped line={} reason=empty-name", csv.recordLine());
                    continue;
                }

                builder.add(new SponsorRecord(
                        name,
                        columns.value(row, columns.city),
                        columns.value(row, columns.county),
                        columns.value(row, columns.rating),
                        columns.value(row, columns.route)));

                if (totalRows % PROGRESS_INTERVAL == 0) {
                    cb.rowsRead(totalRows);
                }
            }
        } catch (IOException e) {
            log.error("registry.failed source={} error={}", sourceName, e.getMessage());
            throw new DataSourceException(null, "Failed to read sponsor data from " + sourceName, e);
        }

        LoadResult result = new LoadResult(totalRows, builder.size(), skippedRows, sourceName);
        SponsorRegistry registry = builder.loadResult(result).build();
        cb.completed(result);
        log.info("registry.loaded records={} names={} words={} skipped={} source={}",
                registry.size(), registry.distinctNameCount(), registry.indexedWordCount(),
                skippedRows, sourceName);
        return registry;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private static CharsetDecoder permissiveUtf8() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
    }

    private static boolean isBlankRow(List<String> row) {
        for (String value : row) {
            if (!value.isBlank()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Trims Unicode whitespace (non-breaking spaces included) and quote
     * characters from both ends.
     */
    static String clean(String raw) {
        return EDGE_QUOTES_AND_SPACE.matcher(raw).replaceAll("");
    }

    /**
     * Header positions of the columns the registry uses; -1 when absent.
     */
    private record Columns(int name, int city, int county, int rating, int route) {

        static Columns fromHeader(List<String> header, String sourceName) {
            Map<String, Integer> positions = new HashMap<>();
            for (int i = 0; i < header.size(); i++) {
                String column = header.get(i);
                if (i == 0 && !column.isEmpty() && column.charAt(0) == BOM) {
                    column = column.substring(1);
                }
                positions.putIfAbsent(clean(column), i);
            }
            Integer name = positions.get(COLUMN_NAME);
            if (name == null) {
                throw new DataSourceException(null,
                        "Missing column '" + COLUMN_NAME + "' in " + sourceName + ", found " + header);
            }
            return new Columns(
                    name,
                    positions.getOrDefault(COLUMN_CITY, -1),
                    positions.getOrDefault(COLUMN_COUNTY, -1),
                    positions.getOrDefault(COLUMN_RATING, -1),
                    positions.getOrDefault(COLUMN_ROUTE, -1));
        }

        String value(List<String> row, int index) {
            if (index < 0 || index >= row.size()) {
                return "";
            }
            return clean(row.get(index));
        }
    }
}
