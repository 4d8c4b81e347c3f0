package io.tracebridge.core.backend.otlp;

import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Delegating exporter that remembers the result of every export since the
 * last {@link #takePending()}, so a caller can tell whether the spans it just
 * ended actually left the process.
 */
final class TrackingSpanExporter implements SpanExporter {
    private final SpanExporter delegate;
    private final List<CompletableResultCode> pending = new ArrayList<>();

    TrackingSpanExporter(SpanExporter delegate) {
        this.delegate = delegate;
    }

    @Override
    public CompletableResultCode export(Collection<SpanData> spans) {
        CompletableResultCode result = delegate.export(spans);
        synchronized (pending) {
            pending.add(result);
        }
        return result;
    }

    CompletableResultCode takePending() {
        synchronized (pending) {
            CompletableResultCode all = CompletableResultCode.ofAll(pending);
            pending.clear();
            return all;
        }
    }

    @Override
    public CompletableResultCode flush() {
        return delegate.flush();
    }

    @Override
    public CompletableResultCode shutdown() {
        return delegate.shutdown();
    }
}
