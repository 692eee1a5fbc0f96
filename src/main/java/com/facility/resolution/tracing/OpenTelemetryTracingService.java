package com.facility.resolution.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * {@link TracingService} backed by the OpenTelemetry API.
 *
 * <p>Spans are {@link SpanKind#INTERNAL}: resolution runs in-process inside the caller's own
 * request or batch span, which becomes the parent through the current context.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    public static final String INSTRUMENTATION_SCOPE = "com.facility.resolution";

    private final Tracer tracer;

    public OpenTelemetryTracingService(OpenTelemetry openTelemetry) {
        this(openTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(SpanOperation operation) {
        return startSpan(operation, null);
    }

    @Override
    public Span startSpan(SpanOperation operation, String facilityId) {
        SpanBuilder builder = tracer.spanBuilder(operation.spanName());
        builder.setSpanKind(SpanKind.INTERNAL);
        if (facilityId != null) {
            builder.setAttribute(SpanAttribute.FACILITY_ID.key(), facilityId);
        }
        return new ResolutionSpan(builder.startSpan());
    }

    private static final class ResolutionSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        ResolutionSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(SpanAttribute attribute, String value) {
            if (value != null) {
                delegate.setAttribute(attribute.key(), value);
            }
        }

        @Override
        public void setAttribute(SpanAttribute attribute, long value) {
            delegate.setAttribute(attribute.key(), value);
        }

        @Override
        public void succeed() {
            delegate.setStatus(StatusCode.OK);
        }

        @Override
        public void fail(Throwable cause) {
            delegate.recordException(cause);
            delegate.setStatus(StatusCode.ERROR, String.valueOf(cause.getMessage()));
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
