package io.tracebridge.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TracebridgeConfig(
    PathsConfig paths,
    PipelineConfig pipeline,
    BackendsConfig backends
) {

    public static TracebridgeConfig defaults() {
        return new TracebridgeConfig(
            PathsConfig.defaults(),
            PipelineConfig.defaults(),
            BackendsConfig.defaults()
        );
    }

    public TracebridgeConfig withPaths(PathsConfig paths) {
        return new TracebridgeConfig(paths, pipeline, backends);
    }

    public TracebridgeConfig withPipeline(PipelineConfig pipeline) {
        return new TracebridgeConfig(paths, pipeline, backends);
    }

    public TracebridgeConfig withBackends(BackendsConfig backends) {
        return new TracebridgeConfig(paths, pipeline, backends);
    }
}
