package io.tracebridge.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BackendsConfig(
    LangfuseConfig langfuse,
    OtlpConfig otlp
) {

    public static BackendsConfig defaults() {
        return new BackendsConfig(LangfuseConfig.defaults(), OtlpConfig.defaults());
    }

    public boolean anyEnabled() {
        return (langfuse != null && langfuse.enabled()) || (otlp != null && otlp.enabled());
    }
}
