package io.tracebridge.core.config;

import io.tracebridge.core.config.model.BackendsConfig;
import io.tracebridge.core.config.model.LangfuseConfig;
import io.tracebridge.core.config.model.OtlpConfig;
import io.tracebridge.core.config.model.PathsConfig;
import io.tracebridge.core.config.model.PipelineConfig;
import io.tracebridge.core.config.model.TracebridgeConfig;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps the hook's environment variables onto a {@link TracebridgeConfig}.
 * Unset or blank variables leave the file/default value untouched.
 */
public final class EnvironmentOverrides {

    public TracebridgeConfig apply(TracebridgeConfig config, Map<String, String> env) {
        if (env == null || env.isEmpty()) {
            return config;
        }
        return config
            .withPaths(paths(config.paths(), env))
            .withPipeline(pipeline(config.pipeline(), env))
            .withBackends(new BackendsConfig(
                langfuse(config.backends().langfuse(), env),
                otlp(config.backends().otlp(), env)
            ));
    }

    private PathsConfig paths(PathsConfig base, Map<String, String> env) {
        return new PathsConfig(
            str(env, "TRACEBRIDGE_PROJECTS_DIR", base.projectsDir()),
            str(env, "TRACEBRIDGE_STATE_DIR", base.stateDir())
        );
    }

    private PipelineConfig pipeline(PipelineConfig base, Map<String, String> env) {
        return new PipelineConfig(
            intValue(env, "TRACEBRIDGE_MAX_SESSIONS", base.maxSessionsPerRun()),
            intValue(env, "TRACEBRIDGE_HEALTH_TIMEOUT_MS", base.healthCheckTimeoutMs()),
            base.slowRunWarningSeconds(),
            intValue(env, "TRACEBRIDGE_SETTLE_SECONDS", base.trailingTurnSettleSeconds()),
            bool(env, "CC_LANGFUSE_REDACT", base.redactSecrets()),
            bool(env, "CC_LANGFUSE_DEBUG", base.debug())
        );
    }

    private LangfuseConfig langfuse(LangfuseConfig base, Map<String, String> env) {
        return new LangfuseConfig(
            bool(env, "TRACE_TO_LANGFUSE", base.enabled()),
            str(env, "LANGFUSE_PUBLIC_KEY", base.publicKey()),
            str(env, "LANGFUSE_SECRET_KEY", base.secretKey()),
            str(env, "LANGFUSE_HOST", base.host())
        );
    }

    private OtlpConfig otlp(OtlpConfig base, Map<String, String> env) {
        String rawHeaders = env.get("OTEL_EXPORTER_OTLP_HEADERS");
        Map<String, String> headers = rawHeaders == null || rawHeaders.isBlank()
            ? base.headers()
            : parseHeaders(rawHeaders);
        return new OtlpConfig(
            bool(env, "TRACE_TO_OTLP", base.enabled()),
            str(env, "OTEL_EXPORTER_OTLP_ENDPOINT", base.endpoint()),
            headers,
            str(env, "OTEL_SERVICE_NAME", base.serviceName())
        );
    }

    static Map<String, String> parseHeaders(String raw) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String pair : raw.split(",")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = pair.substring(0, eq).trim();
            String value = pair.substring(eq + 1).trim();
            if (!key.isEmpty()) {
                headers.put(key, value);
            }
        }
        return headers;
    }

    private static String str(Map<String, String> env, String key, String fallback) {
        String value = env.get(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static boolean bool(Map<String, String> env, String key, boolean fallback) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return "true".equals(value.trim().toLowerCase(Locale.ROOT));
    }

    private static int intValue(Map<String, String> env, String key, int fallback) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
