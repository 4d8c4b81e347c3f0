package io.tracebridge.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PathsConfig(
    @JsonAlias({"projects_dir"}) String projectsDir,
    @JsonAlias({"state_dir"}) String stateDir
) {

    public static PathsConfig defaults() {
        return new PathsConfig("~/.claude/projects", "~/.claude/state");
    }
}
