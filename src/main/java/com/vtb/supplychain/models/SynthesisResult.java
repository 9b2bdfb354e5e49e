package com.vtb.supplychain.models;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Итог этапа синтеза: сводка по критичности, оценка риска проекта и рекомендации.
 * Формируется либо исполнителем синтеза, либо локальным fallback.
 */
@Data
@Builder(toBuilder = true)
public class SynthesisResult {

    public enum Source {
        AGENT,
        FALLBACK
    }

    @Builder.Default
    private Source source = Source.AGENT;
    private SeveritySummary summary;
    private RiskAssessment riskAssessment;
    @Builder.Default
    private List<String> recommendations = new ArrayList<>();
    private Instant generatedAt;

    public boolean isFallback() {
        return source == Source.FALLBACK;
    }

    public SynthesisResult copy() {
        return toBuilder()
            .summary(summary != null
                ? summary.toBuilder()
                    .ecosystems(summary.getEcosystems() != null
                        ? new ArrayList<>(summary.getEcosystems())
                        : new ArrayList<>())
                    .build()
                : null)
            .riskAssessment(riskAssessment != null ? riskAssessment.toBuilder().build() : null)
            .recommendations(recommendations != null ? new ArrayList<>(recommendations) : new ArrayList<>())
            .build();
    }

    @Data
    @Builder(toBuilder = true)
    public static class SeveritySummary {
        private int totalPackages;
        private int totalFindings;
        private int criticalFindings;
        private int highFindings;
        private int mediumFindings;
        private int lowFindings;
        @Builder.Default
        private List<Ecosystem> ecosystems = new ArrayList<>();
    }

    @Data
    @Builder(toBuilder = true)
    public static class RiskAssessment {
        private Severity overallRisk;
        private double riskScore;
        private String reasoning;
        @Builder.Default
        private double confidence = 0.9;
    }
}
