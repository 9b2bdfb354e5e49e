package com.vtb.supplychain.pipeline;

import com.vtb.supplychain.config.AnalyzerConfig;
import com.vtb.supplychain.models.Finding;
import com.vtb.supplychain.models.FindingType;
import com.vtb.supplychain.models.Severity;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Стандартные условия пропуска этапов.
 */
public final class StagePredicates {

    private static final SkipPredicate NEVER = findings -> false;

    private StagePredicates() {
    }

    public static SkipPredicate never() {
        return NEVER;
    }

    /**
     * Анализ кода нужен, только если среди находок есть вредоносный скрипт
     * или evidence упоминает подозрительный install-скрипт.
     */
    public static SkipPredicate unlessSuspiciousScripts(List<String> markers) {
        List<String> normalized = markers == null ? List.of() : markers.stream()
            .filter(marker -> marker != null && !marker.isBlank())
            .map(marker -> marker.toLowerCase(Locale.ROOT))
            .collect(Collectors.toList());
        return findings -> findings.stream()
            .noneMatch(finding -> finding.getFindingType() == FindingType.MALICIOUS_SCRIPT
                || mentionsAny(finding, normalized));
    }

    /**
     * Анализ цепочки поставок нужен при вредоносном пакете
     * или при находке низкой репутации не ниже порога.
     */
    public static SkipPredicate unlessHighRiskPackages(Severity reputationThreshold) {
        Severity threshold = reputationThreshold != null ? reputationThreshold : Severity.HIGH;
        return findings -> findings.stream()
            .noneMatch(finding -> finding.getFindingType() == FindingType.MALICIOUS_PACKAGE
                || (finding.getFindingType() == FindingType.LOW_REPUTATION
                    && finding.getSeverity() != null
                    && finding.getSeverity().isAtLeast(threshold)));
    }

    public static SkipPredicate codeAnalysis(AnalyzerConfig.SkipRules rules) {
        return unlessSuspiciousScripts(rules != null ? rules.getSuspiciousScriptMarkers() : null);
    }

    public static SkipPredicate supplyChainAnalysis(AnalyzerConfig.SkipRules rules) {
        return unlessHighRiskPackages(rules != null ? rules.getReputationSeverityThreshold() : null);
    }

    private static boolean mentionsAny(Finding finding, List<String> markers) {
        if (markers.isEmpty() || finding.getEvidence() == null) {
            return false;
        }
        for (String evidence : finding.getEvidence()) {
            if (evidence == null) {
                continue;
            }
            String text = evidence.toLowerCase(Locale.ROOT);
            for (String marker : markers) {
                if (text.contains(marker)) {
                    return true;
                }
            }
        }
        return false;
    }
}
