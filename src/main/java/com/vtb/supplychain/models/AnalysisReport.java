package com.vtb.supplychain.models;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Итоговый отчет анализа. Неизменяем после завершения конвейера:
 * находки, итоги этапов и синтез копируются при сборке и при каждом чтении.
 */
@Value
public class AnalysisReport {

    int packagesAnalyzed;
    List<Finding> findings;
    List<StageResult> stageResults;
    boolean degraded;
    DegradationLevel degradationLevel;
    double confidence;
    DependencyGraphSummary dependencyGraphSummary;
    SynthesisResult synthesis;
    Instant startedAt;
    Instant completedAt;
    long totalDurationMs;

    @Builder(toBuilder = true)
    private AnalysisReport(int packagesAnalyzed,
                           List<Finding> findings,
                           List<StageResult> stageResults,
                           boolean degraded,
                           DegradationLevel degradationLevel,
                           double confidence,
                           DependencyGraphSummary dependencyGraphSummary,
                           SynthesisResult synthesis,
                           Instant startedAt,
                           Instant completedAt,
                           long totalDurationMs) {
        this.packagesAnalyzed = packagesAnalyzed;
        this.findings = findings != null ? copyFindings(findings) : List.of();
        this.stageResults = stageResults != null ? copyStageResults(stageResults) : List.of();
        this.degraded = degraded;
        this.degradationLevel = degradationLevel != null ? degradationLevel : DegradationLevel.MINIMAL;
        this.confidence = confidence;
        this.dependencyGraphSummary = dependencyGraphSummary != null
            ? dependencyGraphSummary
            : DependencyGraphSummary.empty();
        this.synthesis = synthesis != null ? synthesis.copy() : null;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.totalDurationMs = totalDurationMs;
    }

    public List<Finding> getFindings() {
        return copyFindings(findings);
    }

    public List<StageResult> getStageResults() {
        return copyStageResults(stageResults);
    }

    public SynthesisResult getSynthesis() {
        return synthesis != null ? synthesis.copy() : null;
    }

    public StageResult stageResult(String stageName) {
        return stageResults.stream()
            .filter(result -> result.getStageName().equals(stageName))
            .findFirst()
            .map(StageResult::copy)
            .orElse(null);
    }

    public long countBySeverity(Severity severity) {
        return findings.stream()
            .filter(finding -> finding.getSeverity() == severity)
            .count();
    }

    private static List<Finding> copyFindings(List<Finding> source) {
        return source.stream()
            .map(Finding::copy)
            .collect(Collectors.toUnmodifiableList());
    }

    private static List<StageResult> copyStageResults(List<StageResult> source) {
        return source.stream()
            .map(StageResult::copy)
            .collect(Collectors.toUnmodifiableList());
    }
}
