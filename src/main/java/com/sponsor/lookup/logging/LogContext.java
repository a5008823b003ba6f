package com.sponsor.lookup.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries for one lookup operation.
 * Closing the scope puts back whatever the keys held when it was opened, so a
 * search run inside a URL check keeps the check's correlation id afterwards.
 *
 * <pre>
 * try (LogContext ignored = LogContext.forQuery(LogContext.generateCorrelationId(), "search")) {
 *     log.debug("search.completed results={}", results.size());
 * }
 * </pre>
 */
public final class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String OPERATION = "operation";
    public static final String SOURCE = "source";
    public static final String URL = "url";

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forQuery(String correlationId, String operation) {
        return new LogContext()
                .put(CORRELATION_ID, correlationId)
                .put(OPERATION, operation);
    }

    /**
     * Query scope for a job posting URL check; the URL is logged with every line.
     */
    public static LogContext forUrl(String correlationId, String url) {
        return forQuery(correlationId, "url").put(URL, url);
    }

    public static LogContext forLoad(String source) {
        return new LogContext()
                .put(SOURCE, source)
                .put(OPERATION, "load");
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    private LogContext put(String key, String value) {
        previous.putIfAbsent(key, MDC.get(key));
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
        return this;
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
