package com.facility.resolution.tracing;

/**
 * A traced resolution operation, ended when closed.
 *
 * <pre>
 * try (Span span = tracingService.startSpan(SpanOperation.FIND_DUPLICATE_GROUPS)) {
 *     span.setAttribute(SpanAttribute.RECORDS, records.size());
 *     span.succeed();
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(SpanAttribute attribute, String value);

    void setAttribute(SpanAttribute attribute, long value);

    /**
     * Marks the operation as completed.
     */
    void succeed();

    /**
     * Records {@code cause} on the span and marks the operation as failed.
     */
    void fail(Throwable cause);

    @Override
    void close();
}
