package io.tracebridge.core.backend;

import io.tracebridge.core.backend.langfuse.LangfuseBackend;
import io.tracebridge.core.backend.otlp.OtlpBackend;
import io.tracebridge.core.config.model.LangfuseConfig;
import io.tracebridge.core.config.model.OtlpConfig;
import io.tracebridge.core.config.model.TracebridgeConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds one backend per enabled entry of the configuration. An enabled
 * backend that cannot be built is replaced by a {@link DisabledBackend} so
 * the rest of the run carries on.
 */
public final class BackendFactory {
    private static final Logger LOG = LoggerFactory.getLogger(BackendFactory.class);

    private final TurnTraceBuilder traceBuilder;

    public BackendFactory(TurnTraceBuilder traceBuilder) {
        this.traceBuilder = traceBuilder;
    }

    public List<TraceBackend> create(TracebridgeConfig config) {
        Duration healthTimeout = config.pipeline().healthCheckTimeout();
        List<TraceBackend> backends = new ArrayList<>();

        LangfuseConfig langfuse = config.backends().langfuse();
        if (langfuse != null && langfuse.enabled()) {
            backends.add(buildLangfuse(langfuse, healthTimeout));
        }
        OtlpConfig otlp = config.backends().otlp();
        if (otlp != null && otlp.enabled()) {
            backends.add(buildOtlp(otlp, healthTimeout));
        }
        return backends;
    }

    private TraceBackend buildLangfuse(LangfuseConfig config, Duration healthTimeout) {
        if (!config.configured()) {
            return disabled(LangfuseBackend.NAME, "missing LANGFUSE_PUBLIC_KEY or LANGFUSE_SECRET_KEY");
        }
        try {
            return new LangfuseBackend(config, healthTimeout, traceBuilder);
        } catch (RuntimeException e) {
            return disabled(LangfuseBackend.NAME, "invalid configuration: " + e.getMessage());
        }
    }

    private TraceBackend buildOtlp(OtlpConfig config, Duration healthTimeout) {
        if (!config.configured()) {
            return disabled(OtlpBackend.NAME, "missing OTEL_EXPORTER_OTLP_ENDPOINT");
        }
        try {
            return OtlpBackend.create(config, healthTimeout, traceBuilder);
        } catch (RuntimeException e) {
            return disabled(OtlpBackend.NAME, "invalid configuration: " + e.getMessage());
        }
    }

    private TraceBackend disabled(String name, String reason) {
        LOG.error("Backend {} disabled for this run: {}", name, reason);
        return new DisabledBackend(name, reason);
    }
}
