package com.facility.resolution.tracing;

/**
 * Tracing integration. The default {@link NoOpTracingService} does nothing.
 */
public interface TracingService {

    Span startSpan(SpanOperation operation);

    /**
     * Starts a span about one facility, tagged with {@link SpanAttribute#FACILITY_ID}.
     * A null id leaves the tag off.
     */
    Span startSpan(SpanOperation operation, String facilityId);
}
