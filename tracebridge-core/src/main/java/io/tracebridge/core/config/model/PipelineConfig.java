package io.tracebridge.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PipelineConfig(
    @JsonAlias({"max_sessions_per_run"}) int maxSessionsPerRun,
    @JsonAlias({"health_check_timeout_ms"}) int healthCheckTimeoutMs,
    @JsonAlias({"slow_run_warning_seconds"}) int slowRunWarningSeconds,
    @JsonAlias({"trailing_turn_settle_seconds"}) int trailingTurnSettleSeconds,
    @JsonAlias({"redact_secrets"}) boolean redactSecrets,
    boolean debug
) {
    public PipelineConfig {
        maxSessionsPerRun = Math.max(1, maxSessionsPerRun);
        healthCheckTimeoutMs = Math.max(1, healthCheckTimeoutMs);
        slowRunWarningSeconds = Math.max(1, slowRunWarningSeconds);
        trailingTurnSettleSeconds = Math.max(0, trailingTurnSettleSeconds);
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(10, 2_000, 180, 300, true, false);
    }

    public Duration healthCheckTimeout() {
        return Duration.ofMillis(healthCheckTimeoutMs);
    }

    public Duration slowRunWarning() {
        return Duration.ofSeconds(slowRunWarningSeconds);
    }

    public Duration trailingTurnSettle() {
        return Duration.ofSeconds(trailingTurnSettleSeconds);
    }
}
