package io.tracebridge.cli;

import io.tracebridge.core.config.model.TracebridgeConfig;
import io.tracebridge.core.pipeline.TracePipeline;

@FunctionalInterface
public interface PipelineFactory {
    TracePipeline create(TracebridgeConfig config);
}
