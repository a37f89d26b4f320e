package com.flagship.invoice_ocr.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id for one extraction request.
 *
 * The id comes from the X-Correlation-ID header or is generated, and is
 * mirrored into the MDC so every log line of the request carries it. The
 * caller's document id, when supplied, is added to the MDC as well.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String DOCUMENT_ID_MDC_KEY = "documentId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Starts a context for the current thread. A blank id is replaced by a generated one.
     *
     * @return the id in effect
     */
    public static String begin(String id) {
        String effective = id == null || id.isBlank() ? generateCorrelationId() : id;
        correlationId.set(effective);
        MDC.put(CORRELATION_ID_MDC_KEY, effective);
        return effective;
    }

    /**
     * Gets the current correlation id, generating one if none is set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        return id != null ? id : begin(null);
    }

    public static void tagDocument(String documentId) {
        if (documentId != null && !documentId.isBlank()) {
            MDC.put(DOCUMENT_ID_MDC_KEY, documentId);
        }
    }

    /**
     * Clears the thread-local and the MDC keys. Call at the end of the request.
     */
    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(DOCUMENT_ID_MDC_KEY);
    }

    /**
     * Short id, readable in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
