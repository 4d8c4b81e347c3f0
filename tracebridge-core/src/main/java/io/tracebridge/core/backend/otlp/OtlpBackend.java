package io.tracebridge.core.backend.otlp;

import com.fasterxml.jackson.databind.JsonNode;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporterBuilder;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.tracebridge.core.backend.DeliveryResult;
import io.tracebridge.core.backend.EndpointProbe;
import io.tracebridge.core.backend.TraceBackend;
import io.tracebridge.core.backend.TurnTrace;
import io.tracebridge.core.backend.TurnTraceBuilder;
import io.tracebridge.core.config.model.OtlpConfig;
import io.tracebridge.core.turn.Turn;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exports each turn as OpenTelemetry spans over OTLP/HTTP. Span and trace ids
 * are derived from the session id and turn number, so a replayed turn is
 * exported with the ids it had the first time.
 */
public final class OtlpBackend implements TraceBackend {
    public static final String NAME = "otlp";
    private static final Logger LOG = LoggerFactory.getLogger(OtlpBackend.class);
    private static final Duration EXPORT_TIMEOUT = Duration.ofSeconds(10);

    static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    static final AttributeKey<String> SESSION_ID = AttributeKey.stringKey("session.id");
    static final AttributeKey<Long> TURN_NUMBER = AttributeKey.longKey("turn.number");
    static final AttributeKey<String> PROJECT = AttributeKey.stringKey("project");
    static final AttributeKey<List<String>> TAGS = AttributeKey.stringArrayKey("tags");
    static final AttributeKey<String> INPUT = AttributeKey.stringKey("input.value");
    static final AttributeKey<String> OUTPUT = AttributeKey.stringKey("output.value");
    static final AttributeKey<String> MODEL = AttributeKey.stringKey("gen_ai.request.model");
    static final AttributeKey<Long> TOOL_COUNT = AttributeKey.longKey("tool.count");
    static final AttributeKey<String> TOOL_NAME = AttributeKey.stringKey("tool.name");
    static final AttributeKey<String> TOOL_ID = AttributeKey.stringKey("tool.call.id");

    private final String endpoint;
    private final Duration healthTimeout;
    private final TurnTraceBuilder traceBuilder;
    private final TrackingSpanExporter exporter;
    private final TurnIdGenerator ids = new TurnIdGenerator();
    private final SdkTracerProvider tracerProvider;
    private final Tracer tracer;

    public OtlpBackend(
        String endpoint,
        String serviceName,
        SpanExporter exporter,
        Duration healthTimeout,
        TurnTraceBuilder traceBuilder
    ) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.healthTimeout = Objects.requireNonNull(healthTimeout, "healthTimeout must not be null");
        this.traceBuilder = Objects.requireNonNull(traceBuilder, "traceBuilder must not be null");
        this.exporter = new TrackingSpanExporter(Objects.requireNonNull(exporter, "exporter must not be null"));
        this.tracerProvider = SdkTracerProvider.builder()
            .setIdGenerator(ids)
            .setResource(Resource.getDefault().merge(Resource.create(Attributes.of(SERVICE_NAME, serviceName))))
            .addSpanProcessor(SimpleSpanProcessor.create(this.exporter))
            .build();
        this.tracer = tracerProvider.get("io.tracebridge");
    }

    public static OtlpBackend create(OtlpConfig config, Duration healthTimeout, TurnTraceBuilder traceBuilder) {
        OtlpHttpSpanExporterBuilder builder = OtlpHttpSpanExporter.builder()
            .setEndpoint(config.endpoint())
            .setTimeout(EXPORT_TIMEOUT);
        config.headers().forEach(builder::addHeader);
        return new OtlpBackend(config.endpoint(), config.serviceName(), builder.build(), healthTimeout, traceBuilder);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean healthCheck() {
        return EndpointProbe.reachable(endpoint, healthTimeout);
    }

    @Override
    public DeliveryResult emit(Turn turn) {
        TurnTrace trace = traceBuilder.build(turn);

        String turnKey = trace.sessionId() + ":" + trace.turnNumber();
        try {
            ids.assign(turnKey, "root");
            Span root = tracer.spanBuilder(trace.name())
                .setNoParent()
                .setSpanKind(SpanKind.INTERNAL)
                .setStartTimestamp(trace.startedAt())
                .setAttribute(SESSION_ID, trace.sessionId())
                .setAttribute(TURN_NUMBER, (long) trace.turnNumber())
                .setAttribute(PROJECT, trace.project())
                .setAttribute(TAGS, trace.tags())
                .setAttribute(INPUT, trace.userText())
                .setAttribute(OUTPUT, trace.assistantText())
                .startSpan();
            Context parent = Context.root().with(root);

            ids.assign(turnKey, "generation");
            tracer.spanBuilder(TurnTrace.GENERATION_NAME)
                .setParent(parent)
                .setSpanKind(SpanKind.CLIENT)
                .setStartTimestamp(trace.startedAt())
                .setAttribute(MODEL, trace.model())
                .setAttribute(INPUT, trace.userText())
                .setAttribute(OUTPUT, trace.assistantText())
                .setAttribute(TOOL_COUNT, (long) trace.tools().size())
                .startSpan()
                .end(trace.endedAt());

            List<TurnTrace.ToolSpan> tools = trace.tools();
            for (int i = 0; i < tools.size(); i++) {
                TurnTrace.ToolSpan tool = tools.get(i);
                ids.assign(turnKey, "tool:" + i + ":" + tool.id());
                Span span = tracer.spanBuilder(tool.spanName())
                    .setParent(parent)
                    .setStartTimestamp(trace.startedAt())
                    .setAttribute(TOOL_NAME, tool.name())
                    .setAttribute(TOOL_ID, tool.id())
                    .setAttribute(INPUT, render(tool.input()))
                    .startSpan();
                if (tool.hasOutput()) {
                    span.setAttribute(OUTPUT, render(tool.output()));
                }
                span.end(trace.endedAt());
            }
            root.end(trace.endedAt());
        } finally {
            ids.clear();
        }

        CompletableResultCode result = exporter.takePending().join(EXPORT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        if (!result.isSuccess()) {
            return DeliveryResult.error("span export failed or timed out for " + trace.name());
        }
        LOG.debug("Exported {} with {} tool spans over OTLP", trace.name(), trace.tools().size());
        return DeliveryResult.ok();
    }

    @Override
    public void flush() {
        tracerProvider.forceFlush().join(EXPORT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        tracerProvider.shutdown().join(EXPORT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    }

    private String render(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        return node.isTextual() ? node.asText() : node.toString();
    }
}
