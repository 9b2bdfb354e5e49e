package com.vtb.supplychain.pipeline;

import com.vtb.supplychain.config.AnalyzerConfig;

import java.time.Duration;

class PipelineSettings {
    private final AnalyzerConfig.Pipeline config;

    PipelineSettings(AnalyzerConfig.Pipeline config) {
        this.config = config;
    }

    Duration globalBudget() {
        int seconds = config != null && config.getGlobalBudgetSec() != null ? config.getGlobalBudgetSec() : 90;
        return Duration.ofSeconds(seconds);
    }

    Duration timeout(String stage) {
        return Duration.ofSeconds(stage(stage).getTimeoutSec());
    }

    int retries(String stage) {
        return stage(stage).getRetries();
    }

    Duration retryDelay(String stage) {
        return Duration.ofMillis(stage(stage).getRetryDelayMs());
    }

    Duration minimumBudget(String stage) {
        return Duration.ofMillis(stage(stage).getMinimumBudgetMs());
    }

    private AnalyzerConfig.StageSettings stage(String name) {
        AnalyzerConfig.Pipeline pipeline = config;
        if (pipeline == null) {
            pipeline = AnalyzerConfig.defaults().getPipeline();
        }
        return pipeline.stage(name);
    }
}
