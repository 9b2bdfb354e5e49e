package com.vtb.supplychain.pipeline;

import com.vtb.supplychain.config.AnalyzerConfig;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Стандартный конвейер: уязвимости, репутация, анализ кода, supply chain, синтез.
 * Таймауты, повторы и бюджеты берутся из {@link AnalyzerConfig}.
 */
public final class StandardPipeline {

    public static final String VULNERABILITY_ANALYSIS = "vulnerability_analysis";
    public static final String REPUTATION_ANALYSIS = "reputation_analysis";
    public static final String CODE_ANALYSIS = "code_analysis";
    public static final String SUPPLY_CHAIN_ANALYSIS = "supply_chain_analysis";
    public static final String SYNTHESIS = "synthesis";

    public static final List<String> STAGE_ORDER = List.of(
        VULNERABILITY_ANALYSIS, REPUTATION_ANALYSIS, CODE_ANALYSIS, SUPPLY_CHAIN_ANALYSIS, SYNTHESIS);

    private StandardPipeline() {
    }

    public static List<StageDescriptor> build(AnalyzerConfig config,
                                              StageExecutor vulnerability,
                                              StageExecutor reputation,
                                              StageExecutor code,
                                              StageExecutor supplyChain,
                                              StageExecutor synthesis) {
        Objects.requireNonNull(config, "config");
        PipelineSettings settings = new PipelineSettings(config.getPipeline());
        AnalyzerConfig.SkipRules rules = config.getSkipRules();
        return List.of(
            stage(settings, VULNERABILITY_ANALYSIS, vulnerability, StagePredicates.never(), false),
            stage(settings, REPUTATION_ANALYSIS, reputation, StagePredicates.never(), false),
            stage(settings, CODE_ANALYSIS, code, StagePredicates.codeAnalysis(rules), false),
            stage(settings, SUPPLY_CHAIN_ANALYSIS, supplyChain, StagePredicates.supplyChainAnalysis(rules), false),
            stage(settings, SYNTHESIS, synthesis, StagePredicates.never(), true)
        );
    }

    public static Duration globalBudget(AnalyzerConfig config) {
        return new PipelineSettings(config != null ? config.getPipeline() : null).globalBudget();
    }

    private static StageDescriptor stage(PipelineSettings settings,
                                         String name,
                                         StageExecutor executor,
                                         SkipPredicate predicate,
                                         boolean synthesis) {
        return StageDescriptor.builder()
            .name(name)
            .executor(Objects.requireNonNull(executor, name))
            .skipPredicate(predicate)
            .timeout(settings.timeout(name))
            .retries(settings.retries(name))
            .retryDelay(settings.retryDelay(name))
            .minimumBudget(settings.minimumBudget(name))
            .synthesis(synthesis)
            .build();
    }
}
