package com.vtb.supplychain.pipeline;

import com.vtb.supplychain.models.Ecosystem;
import com.vtb.supplychain.models.Finding;
import com.vtb.supplychain.models.FindingType;
import com.vtb.supplychain.models.PackageIdentity;
import com.vtb.supplychain.models.Severity;
import com.vtb.supplychain.models.SynthesisResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.vtb.supplychain.pipeline.StageOrchestratorTest.finding;
import static org.junit.jupiter.api.Assertions.*;

class FallbackSynthesizerTest {

    private final FallbackSynthesizer synthesizer = new FallbackSynthesizer();
    private final Set<PackageIdentity> packages = Set.of(
        PackageIdentity.of("express", "4.18.2", Ecosystem.NPM),
        PackageIdentity.of("requests", "2.31.0", Ecosystem.PYPI));

    @Test
    void maliciousPackageMeansCriticalRisk() {
        SynthesisResult result = synthesizer.synthesize(List.of(
            finding("evil-pkg", FindingType.MALICIOUS_PACKAGE, Severity.HIGH),
            finding("evil-pkg", FindingType.MALICIOUS_SCRIPT, Severity.HIGH)), packages);

        assertTrue(result.isFallback());
        assertEquals(Severity.CRITICAL, result.getRiskAssessment().getOverallRisk());
        assertEquals(0.95, result.getRiskAssessment().getRiskScore(), 1e-9, "Один вредоносный пакет: 0.9 + 0.05");
        assertTrue(result.getRecommendations().get(0).startsWith("Немедленно удалите"));
        assertNotNull(result.getGeneratedAt());
    }

    @Test
    void riskLevelsFollowSeverityCounts() {
        assertEquals(Severity.HIGH, riskOf(Severity.HIGH, Severity.HIGH, Severity.HIGH));
        assertEquals(Severity.MEDIUM, riskOf(Severity.HIGH));
        assertEquals(Severity.MEDIUM, riskOf(Severity.MEDIUM, Severity.MEDIUM, Severity.MEDIUM, Severity.MEDIUM));
        assertEquals(Severity.LOW, riskOf(Severity.MEDIUM, Severity.LOW));
        assertEquals(Severity.CRITICAL, riskOf(Severity.CRITICAL));
    }

    @Test
    void scoreIsCappedAtOne() {
        List<Finding> findings = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            findings.add(finding("pkg" + i, FindingType.MALICIOUS_PACKAGE, Severity.CRITICAL));
        }
        SynthesisResult result = synthesizer.synthesize(findings, packages);
        assertEquals(1.0, result.getRiskAssessment().getRiskScore(), 1e-9);
    }

    @Test
    void summaryCountsFindingsAndEcosystems() {
        SynthesisResult result = synthesizer.synthesize(List.of(
            finding("express", FindingType.VULNERABILITY, Severity.CRITICAL),
            finding("express", FindingType.VULNERABILITY, Severity.HIGH),
            finding("requests", FindingType.LOW_REPUTATION, Severity.LOW)), packages);

        SynthesisResult.SeveritySummary summary = result.getSummary();
        assertEquals(2, summary.getTotalPackages());
        assertEquals(3, summary.getTotalFindings());
        assertEquals(1, summary.getCriticalFindings());
        assertEquals(1, summary.getHighFindings());
        assertEquals(0, summary.getMediumFindings());
        assertEquals(1, summary.getLowFindings());
        assertTrue(summary.getEcosystems().containsAll(List.of(Ecosystem.NPM, Ecosystem.PYPI)));
    }

    @Test
    void noFindingsGiveLowRiskAndGeneralAdvice() {
        SynthesisResult result = synthesizer.synthesize(null, null);

        assertEquals(Severity.LOW, result.getRiskAssessment().getOverallRisk());
        assertEquals(0.3, result.getRiskAssessment().getRiskScore(), 1e-9);
        assertEquals(FallbackSynthesizer.GENERAL_RECOMMENDATIONS, result.getRecommendations());
        assertEquals(0, result.getSummary().getTotalPackages());
    }

    @Test
    void fallbackOutputPassesValidation() {
        SynthesisResult result = synthesizer.synthesize(List.of(
            finding("express", FindingType.VULNERABILITY, Severity.MEDIUM)), packages);
        assertDoesNotThrow(() -> new SynthesisValidator().validate(result));
    }

    private Severity riskOf(Severity... severities) {
        List<Finding> findings = new ArrayList<>();
        int i = 0;
        for (Severity severity : severities) {
            findings.add(finding("pkg" + i++, FindingType.VULNERABILITY, severity));
        }
        return synthesizer.synthesize(findings, packages).getRiskAssessment().getOverallRisk();
    }
}
