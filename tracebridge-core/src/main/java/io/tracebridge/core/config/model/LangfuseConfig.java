package io.tracebridge.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LangfuseConfig(
    boolean enabled,
    @JsonAlias({"public_key"}) String publicKey,
    @JsonAlias({"secret_key"}) String secretKey,
    String host
) {

    public static LangfuseConfig defaults() {
        return new LangfuseConfig(false, "", "", "http://localhost:3050");
    }

    public boolean configured() {
        return publicKey != null && !publicKey.isBlank()
            && secretKey != null && !secretKey.isBlank()
            && host != null && !host.isBlank();
    }
}
