package io.tracebridge.core.backend.langfuse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tracebridge.core.backend.DeliveryResult;
import io.tracebridge.core.backend.EndpointProbe;
import io.tracebridge.core.backend.TraceBackend;
import io.tracebridge.core.backend.TurnTrace;
import io.tracebridge.core.backend.TurnTraceBuilder;
import io.tracebridge.core.config.model.LangfuseConfig;
import io.tracebridge.core.turn.Turn;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import okhttp3.Credentials;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends each turn to the Langfuse public ingestion API as one batch of
 * trace, span and generation events.
 * <p>
 * Trace and observation ids are name-based UUIDs of the session id and turn
 * number, so replaying a turn updates the existing trace in place.
 */
public final class LangfuseBackend implements TraceBackend {
    public static final String NAME = "langfuse";
    private static final Logger LOG = LoggerFactory.getLogger(LangfuseBackend.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final HttpUrl host;
    private final String authorization;
    private final Duration healthTimeout;
    private final TurnTraceBuilder traceBuilder;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final int maxAttempts;

    public LangfuseBackend(LangfuseConfig config, Duration healthTimeout, TurnTraceBuilder traceBuilder) {
        this(
            config,
            healthTimeout,
            traceBuilder,
            new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(30))
                .writeTimeout(Duration.ofSeconds(30))
                .build(),
            3
        );
    }

    public LangfuseBackend(
        LangfuseConfig config,
        Duration healthTimeout,
        TurnTraceBuilder traceBuilder,
        OkHttpClient client,
        int maxAttempts
    ) {
        Objects.requireNonNull(config, "config must not be null");
        this.host = HttpUrl.get(Objects.requireNonNull(config.host(), "host must not be null"));
        this.authorization = Credentials.basic(config.publicKey(), config.secretKey(), StandardCharsets.UTF_8);
        this.healthTimeout = Objects.requireNonNull(healthTimeout, "healthTimeout must not be null");
        this.traceBuilder = Objects.requireNonNull(traceBuilder, "traceBuilder must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.maxAttempts = Math.max(1, maxAttempts);
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean healthCheck() {
        return EndpointProbe.reachable(host.toString(), healthTimeout);
    }

    @Override
    public DeliveryResult emit(Turn turn) {
        TurnTrace trace = traceBuilder.build(turn);
        String body;
        try {
            body = mapper.writeValueAsString(batch(trace));
        } catch (IOException e) {
            return DeliveryResult.error("could not serialize turn: " + e.getMessage());
        }

        long delayMs = 250;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Request request = new Request.Builder()
                .url(ingestionUrl())
                .post(RequestBody.create(body, JSON))
                .header("Authorization", authorization)
                .build();
            try (Response response = client.newCall(request).execute()) {
                String responseBody = response.body() == null ? "" : response.body().string();
                if (!response.isSuccessful()) {
                    boolean retryable = response.code() == 429 || response.code() >= 500;
                    if (retryable && attempt < maxAttempts) {
                        sleep(delayMs);
                        delayMs = Math.min(delayMs * 2, 2000);
                        continue;
                    }
                    return DeliveryResult.error("HTTP " + response.code() + " " + responseBody);
                }
                String rejected = rejectedEvents(responseBody);
                if (!rejected.isEmpty()) {
                    return DeliveryResult.error("ingestion rejected events: " + rejected);
                }
                LOG.debug("Sent {} with {} tool spans to Langfuse", trace.name(), trace.tools().size());
                return DeliveryResult.ok();
            } catch (IOException ioe) {
                if (attempt < maxAttempts) {
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 2000);
                    continue;
                }
                return DeliveryResult.error(ioe.getMessage());
            }
        }
        return DeliveryResult.error("exhausted retries");
    }

    ObjectNode batch(TurnTrace trace) {
        String traceId = id(trace, "trace");
        String rootId = id(trace, "root");
        ObjectNode userInput = message("user", trace.userText());
        ObjectNode assistantOutput = message("assistant", trace.assistantText());

        ObjectNode payload = mapper.createObjectNode();
        ArrayNode batch = payload.putArray("batch");

        ObjectNode traceBody = mapper.createObjectNode();
        traceBody.put("id", traceId);
        traceBody.put("timestamp", trace.startedAt().toString());
        traceBody.put("name", trace.name());
        traceBody.put("sessionId", trace.sessionId());
        traceBody.set("input", userInput);
        traceBody.set("output", assistantOutput);
        traceBody.set("tags", mapper.valueToTree(trace.tags()));
        ObjectNode traceMetadata = metadata(trace);
        traceMetadata.put("session_id", trace.sessionId());
        traceBody.set("metadata", traceMetadata);
        batch.add(event("trace-create", trace, traceBody));

        ObjectNode root = observation(trace, rootId, traceId, null, trace.name());
        root.set("input", userInput);
        root.set("output", assistantOutput);
        root.set("metadata", metadata(trace));
        batch.add(event("span-create", trace, root));

        ObjectNode generation = observation(trace, id(trace, "generation"), traceId, rootId, TurnTrace.GENERATION_NAME);
        generation.put("model", trace.model());
        generation.set("input", userInput);
        generation.set("output", assistantOutput);
        generation.putObject("metadata").put("tool_count", trace.tools().size());
        batch.add(event("generation-create", trace, generation));

        List<TurnTrace.ToolSpan> tools = trace.tools();
        for (int i = 0; i < tools.size(); i++) {
            TurnTrace.ToolSpan tool = tools.get(i);
            ObjectNode span = observation(trace, id(trace, "tool:" + i + ":" + tool.id()), traceId, rootId, tool.spanName());
            span.set("input", tool.input());
            span.set("output", tool.hasOutput() ? tool.output() : mapper.nullNode());
            ObjectNode toolMetadata = span.putObject("metadata");
            toolMetadata.put("tool_name", tool.name());
            toolMetadata.put("tool_id", tool.id());
            batch.add(event("span-create", trace, span));
        }
        return payload;
    }

    private ObjectNode observation(TurnTrace trace, String id, String traceId, String parentId, String name) {
        ObjectNode body = mapper.createObjectNode();
        body.put("id", id);
        body.put("traceId", traceId);
        if (parentId != null) {
            body.put("parentObservationId", parentId);
        }
        body.put("name", name);
        body.put("startTime", trace.startedAt().toString());
        body.put("endTime", trace.endedAt().toString());
        return body;
    }

    private ObjectNode event(String type, TurnTrace trace, ObjectNode body) {
        ObjectNode event = mapper.createObjectNode();
        event.put("id", UUID.randomUUID().toString());
        event.put("timestamp", trace.endedAt().toString());
        event.put("type", type);
        event.set("body", body);
        return event;
    }

    private ObjectNode metadata(TurnTrace trace) {
        ObjectNode metadata = mapper.createObjectNode();
        metadata.put("source", TurnTraceBuilder.SOURCE_TAG);
        metadata.put("turn_number", trace.turnNumber());
        metadata.put("project", trace.project());
        return metadata;
    }

    private ObjectNode message(String role, String content) {
        ObjectNode message = mapper.createObjectNode();
        message.put("role", role);
        message.put("content", content);
        return message;
    }

    static String id(TurnTrace trace, String suffix) {
        String key = trace.sessionId() + ":" + trace.turnNumber() + ":" + suffix;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private String rejectedEvents(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return "";
        }
        try {
            JsonNode errors = mapper.readTree(responseBody).path("errors");
            if (errors.isArray() && errors.size() > 0) {
                return errors.toString();
            }
            return "";
        } catch (IOException e) {
            LOG.debug("Ignoring non-JSON ingestion response: {}", e.getMessage());
            return "";
        }
    }

    private HttpUrl ingestionUrl() {
        return host.newBuilder()
            .addPathSegments("api/public/ingestion")
            .build();
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
