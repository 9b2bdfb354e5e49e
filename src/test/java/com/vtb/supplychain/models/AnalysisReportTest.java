package com.vtb.supplychain.models;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisReportTest {

    @Test
    void reportIsNotChangedThroughReturnedObjects() {
        Finding finding = Finding.builder()
            .packageName("lodash")
            .packageVersion("4.17.20")
            .findingType(FindingType.VULNERABILITY)
            .severity(Severity.HIGH)
            .evidence(new ArrayList<>(List.of("CVE-2021-23337")))
            .build();
        StageResult stage = StageResult.builder()
            .stageName("vulnerability_analysis")
            .status(StageStatus.SUCCESS)
            .producedFindings(new ArrayList<>(List.of(finding)))
            .attempts(1)
            .build();
        SynthesisResult synthesis = SynthesisResult.builder()
            .source(SynthesisResult.Source.AGENT)
            .recommendations(new ArrayList<>(List.of("Обновить lodash")))
            .build();

        AnalysisReport report = AnalysisReport.builder()
            .packagesAnalyzed(1)
            .findings(List.of(finding))
            .stageResults(List.of(stage))
            .synthesis(synthesis)
            .degradationLevel(DegradationLevel.FULL)
            .build();

        // исходные объекты после сборки отчета
        finding.setSeverity(Severity.LOW);
        stage.setStatus(StageStatus.FAILED);

        // объекты, полученные из отчета
        report.getFindings().get(0).setSeverity(Severity.CRITICAL);
        report.getFindings().get(0).getEvidence().add("forged");
        report.getStageResults().get(0).setStatus(StageStatus.FAILED);
        report.stageResult("vulnerability_analysis").getProducedFindings().get(0).setSeverity(Severity.LOW);
        report.getSynthesis().getRecommendations().clear();
        report.getSynthesis().setSource(SynthesisResult.Source.FALLBACK);

        assertEquals(Severity.HIGH, report.getFindings().get(0).getSeverity());
        assertEquals(List.of("CVE-2021-23337"), report.getFindings().get(0).getEvidence());
        assertEquals(1, report.countBySeverity(Severity.HIGH));
        assertEquals(StageStatus.SUCCESS, report.getStageResults().get(0).getStatus());
        assertEquals(Severity.HIGH,
            report.stageResult("vulnerability_analysis").getProducedFindings().get(0).getSeverity());
        assertEquals(List.of("Обновить lodash"), report.getSynthesis().getRecommendations());
        assertFalse(report.getSynthesis().isFallback());
    }

    @Test
    void returnedListsAreUnmodifiable() {
        AnalysisReport report = AnalysisReport.builder().build();

        assertTrue(report.getFindings().isEmpty());
        assertThrows(UnsupportedOperationException.class,
            () -> report.getStageResults().add(StageResult.builder().stageName("x").build()));
        assertNull(report.getSynthesis());
        assertEquals(DegradationLevel.MINIMAL, report.getDegradationLevel());
    }
}
