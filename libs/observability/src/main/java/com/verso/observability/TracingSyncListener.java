package com.verso.observability;

import com.verso.versioner.SyncEvent;
import com.verso.versioner.SyncListener;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;

/**
 * Records syncs as OpenTelemetry spans.
 *
 * <p>A {@value #SYNC_SPAN} span covers start to end and holds one {@value #CHANGE_SPAN} child per
 * version applied. Failures are recorded on the span they happened in and set its status to
 * {@link StatusCode#ERROR}.
 *
 * <p>This helper does NOT configure the SDK: exporter, sampler and resource come from the
 * application's {@link Tracer}. Never vetoes. A sync aborted by another listener leaves its spans
 * open; they are ended with an error status when the next sync starts.
 */
public final class TracingSyncListener implements SyncListener {

    public static final String SYNC_SPAN = "versioner.sync";
    public static final String CHANGE_SPAN = "versioner.change";

    /** Number of the version a change span applies. */
    public static final AttributeKey<Long> VERSION = AttributeKey.longKey("versioner.version");

    private final Tracer tracer;
    private Span syncSpan;
    private Span changeSpan;

    /**
     * @param tracer the OpenTelemetry tracer (typically obtained from {@code GlobalOpenTelemetry})
     */
    public TracingSyncListener(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    @Override
    public void on(SyncEvent event) {
        switch (event.type()) {
            case START -> {
                abandonOpenSpans();
                syncSpan = tracer.spanBuilder(SYNC_SPAN).setSpanKind(SpanKind.INTERNAL).startSpan();
            }
            case BEFORE_SYNC, AFTER_SYNC -> {
                if (syncSpan != null) {
                    syncSpan.addEvent(event.type().value());
                }
            }
            case BEFORE_CHANGE -> {
                var builder =
                        tracer.spanBuilder(CHANGE_SPAN)
                                .setSpanKind(SpanKind.INTERNAL)
                                .setAttribute(VERSION, (long) event.version().number());
                if (syncSpan != null) {
                    builder.setParent(Context.current().with(syncSpan));
                }
                changeSpan = builder.startSpan();
            }
            case AFTER_CHANGE -> changeSpan = end(changeSpan, null);
            case ERROR_DURING_CHANGE -> changeSpan = end(changeSpan, event.error());
            case ERROR -> syncSpan = end(syncSpan, event.error());
            case END -> syncSpan = end(syncSpan, null);
        }
    }

    private void abandonOpenSpans() {
        for (Span span : new Span[] {changeSpan, syncSpan}) {
            if (span != null) {
                span.setStatus(StatusCode.ERROR, "sync aborted");
                span.end();
            }
        }
        changeSpan = null;
        syncSpan = null;
    }

    /** Ends {@code span} if open and returns null, the new value of the slot. */
    private static Span end(Span span, Throwable error) {
        if (span == null) {
            return null;
        }
        if (error == null) {
            span.setStatus(StatusCode.OK);
        } else {
            span.setStatus(StatusCode.ERROR, String.valueOf(error.getMessage()));
            span.recordException(error);
        }
        span.end();
        return null;
    }

    public Tracer tracer() {
        return tracer;
    }
}
