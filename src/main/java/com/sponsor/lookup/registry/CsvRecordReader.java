package com.sponsor.lookup.registry;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Minimal RFC 4180 reader: comma separated, double-quote enclosed fields,
 * doubled quotes as escapes, line breaks allowed inside quoted fields.
 *
 * <p>A quoted field may continue over at most {@link #MAX_CONTINUATION_LINES}
 * further lines. If its quote is still open at end of input or past that limit,
 * the record is flagged via {@link #lastRecordUnterminated()} and the lines read
 * after its first line are returned again as records of their own.</p>
 */
final class CsvRecordReader {

    private static final char SEPARATOR = ',';
    private static final char QUOTE = '"';
    static final int MAX_CONTINUATION_LINES = 10;

    private final BufferedReader reader;
    private final Deque<String> pending = new ArrayDeque<>();
    private long lineNumber;
    private long recordStartLine;
    private boolean unterminated;

    CsvRecordReader(BufferedReader reader) {
        this.reader = reader;
    }

    /**
     * Reads the next record, or returns null at end of input.
     */
    List<String> next() throws IOException {
        String line = readLine();
        if (line == null) {
            return null;
        }
        lineNumber++;
        recordStartLine = lineNumber;
        unterminated = false;

        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        List<String> continuation = new ArrayList<>();
        int i = 0;
        while (true) {
            if (i >= line.length()) {
                if (!quoted) {
                    break;
                }
                // Quoted field spans a line break
                String next = continuation.size() < MAX_CONTINUATION_LINES ? readLine() : null;
                if (next == null) {
                    unterminated = true;
                    unread(continuation);
                    break;
                }
                lineNumber++;
                continuation.add(next);
                field.append('\n');
                line = next;
                i = 0;
                continue;
            }

            char c = line.charAt(i);
            if (quoted) {
                if (c == QUOTE) {
                    if (i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
                        field.append(QUOTE);
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    field.append(c);
                }
            } else if (c == QUOTE && field.toString().isBlank()) {
                field.setLength(0);
                quoted = true;
            } else if (c == SEPARATOR) {
                fields.add(field.toString());
                field.setLength(0);
            } else {
                field.append(c);
            }
            i++;
        }
        fields.add(field.toString());
        return fields;
    }

    private String readLine() throws IOException {
        return pending.isEmpty() ? reader.readLine() : pending.pollFirst();
    }

    private void unread(List<String> lines) {
        for (int j = lines.size() - 1; j >= 0; j--) {
            pending.addFirst(lines.get(j));
        }
        lineNumber -= lines.size();
    }

    /**
     * Source line on which the last returned record started (1-based).
     */
    long recordLine() {
        return recordStartLine;
    }

    boolean lastRecordUnterminated() {
        return unterminated;
    }
}
