package com.facility.resolution.tracing;

/**
 * {@link TracingService} that records nothing. All operations share one inert span.
 */
public class NoOpTracingService implements TracingService {

    static final Span INERT = new Span() {
        @Override
        public void setAttribute(SpanAttribute attribute, String value) {
        }

        @Override
        public void setAttribute(SpanAttribute attribute, long value) {
        }

        @Override
        public void succeed() {
        }

        @Override
        public void fail(Throwable cause) {
        }

        @Override
        public void close() {
        }
    };

    @Override
    public Span startSpan(SpanOperation operation) {
        return INERT;
    }

    @Override
    public Span startSpan(SpanOperation operation, String facilityId) {
        return INERT;
    }
}
