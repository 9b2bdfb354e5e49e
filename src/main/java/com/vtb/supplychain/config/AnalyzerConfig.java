package com.vtb.supplychain.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.supplychain.graph.DepthPolicy;
import com.vtb.supplychain.models.Severity;
import lombok.Data;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Конфигурация анализатора из YAML файла
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalyzerConfig {

    public static final String RESOURCE_NAME = "analyzer-config.yaml";

    private Graph graph;
    private Pipeline pipeline;
    private SkipRules skipRules;

    private static AnalyzerConfig instance;

    /**
     * Загрузить конфигурацию из classpath
     */
    public static synchronized AnalyzerConfig load() {
        if (instance == null) {
            try (InputStream is = AnalyzerConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
                if (is == null) {
                    throw new IllegalStateException(RESOURCE_NAME + " не найден в classpath");
                }
                instance = fromYaml(is);
            } catch (IOException e) {
                throw new RuntimeException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
            }
        }
        return instance;
    }

    /**
     * Прочитать конфигурацию из потока; отсутствующие секции заполняются значениями по умолчанию.
     */
    public static AnalyzerConfig fromYaml(InputStream is) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AnalyzerConfig config = mapper.readValue(is, AnalyzerConfig.class);
        if (config == null) {
            config = new AnalyzerConfig();
        }
        config.ensureDefaults();
        return config;
    }

    public static AnalyzerConfig defaults() {
        AnalyzerConfig config = new AnalyzerConfig();
        config.ensureDefaults();
        return config;
    }

    private void ensureDefaults() {
        if (graph == null) {
            graph = new Graph();
        }
        graph.ensureDefaults();
        if (pipeline == null) {
            pipeline = new Pipeline();
        }
        pipeline.ensureDefaults();
        if (skipRules == null) {
            skipRules = new SkipRules();
        }
        skipRules.ensureDefaults();
    }

    @Data
    public static class Graph {
        private static final int DEFAULT_MAX_DEPTH = 10;

        private Integer maxDepth;
        private DepthPolicy depthPolicy;

        public void ensureDefaults() {
            if (maxDepth == null || maxDepth < 0) {
                maxDepth = DEFAULT_MAX_DEPTH;
            }
            if (depthPolicy == null) {
                depthPolicy = DepthPolicy.FIRST_SEEN;
            }
        }
    }

    @Data
    public static class Pipeline {
        private static final int DEFAULT_GLOBAL_BUDGET_SEC = 90;
        private static final Map<String, Integer> DEFAULT_TIMEOUTS = Map.of(
            "vulnerability_analysis", 20,
            "reputation_analysis", 15,
            "code_analysis", 25,
            "supply_chain_analysis", 20,
            "synthesis", 15
        );

        private Integer globalBudgetSec;
        private Map<String, StageSettings> stages;

        public void ensureDefaults() {
            if (globalBudgetSec == null || globalBudgetSec <= 0) {
                globalBudgetSec = DEFAULT_GLOBAL_BUDGET_SEC;
            }
            if (stages == null) {
                stages = new LinkedHashMap<>();
            }
            DEFAULT_TIMEOUTS.forEach((name, timeout) -> stages.putIfAbsent(name, new StageSettings()));
            stages.forEach((name, settings) -> {
                if (settings != null) {
                    settings.ensureDefaults(DEFAULT_TIMEOUTS.getOrDefault(name, StageSettings.DEFAULT_TIMEOUT_SEC));
                }
            });
            stages.replaceAll((name, settings) -> settings != null ? settings : defaultStage(name));
        }

        public StageSettings stage(String name) {
            StageSettings settings = stages != null ? stages.get(name) : null;
            return settings != null ? settings : defaultStage(name);
        }

        private static StageSettings defaultStage(String name) {
            StageSettings settings = new StageSettings();
            settings.ensureDefaults(DEFAULT_TIMEOUTS.getOrDefault(name, StageSettings.DEFAULT_TIMEOUT_SEC));
            return settings;
        }
    }

    @Data
    public static class StageSettings {
        private static final int DEFAULT_TIMEOUT_SEC = 20;
        private static final int DEFAULT_RETRIES = 1;
        private static final long DEFAULT_RETRY_DELAY_MS = 500L;
        private static final long DEFAULT_MINIMUM_BUDGET_MS = 1000L;

        private Integer timeoutSec;
        private Integer retries;
        private Long retryDelayMs;
        private Long minimumBudgetMs;

        public void ensureDefaults(int defaultTimeoutSec) {
            if (timeoutSec == null || timeoutSec <= 0) {
                timeoutSec = defaultTimeoutSec;
            }
            // больше одного повтора не допускается
            if (retries == null || retries < 0) {
                retries = DEFAULT_RETRIES;
            }
            retries = Math.min(retries, 1);
            if (retryDelayMs == null || retryDelayMs < 0) {
                retryDelayMs = DEFAULT_RETRY_DELAY_MS;
            }
            if (minimumBudgetMs == null || minimumBudgetMs < 0) {
                minimumBudgetMs = DEFAULT_MINIMUM_BUDGET_MS;
            }
        }
    }

    @Data
    public static class SkipRules {
        private static final List<String> DEFAULT_SCRIPT_MARKERS = List.of(
            "preinstall", "postinstall", "install script", "obfuscated",
            "suspicious_script", "eval(", "child_process", "curl ", "wget "
        );

        private List<String> suspiciousScriptMarkers;
        private Severity reputationSeverityThreshold;

        public void ensureDefaults() {
            if (suspiciousScriptMarkers == null || suspiciousScriptMarkers.isEmpty()) {
                suspiciousScriptMarkers = new ArrayList<>(DEFAULT_SCRIPT_MARKERS);
            }
            if (reputationSeverityThreshold == null) {
                reputationSeverityThreshold = Severity.HIGH;
            }
        }
    }
}
