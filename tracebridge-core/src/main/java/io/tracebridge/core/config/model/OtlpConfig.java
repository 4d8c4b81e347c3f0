package io.tracebridge.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OtlpConfig(
    boolean enabled,
    String endpoint,
    Map<String, String> headers,
    @JsonAlias({"service_name"}) String serviceName
) {
    public OtlpConfig {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        serviceName = serviceName == null || serviceName.isBlank() ? "claude-code" : serviceName;
    }

    public static OtlpConfig defaults() {
        return new OtlpConfig(false, "http://localhost:4318/v1/traces", Map.of(), "claude-code");
    }

    public boolean configured() {
        return endpoint != null && !endpoint.isBlank();
    }
}
