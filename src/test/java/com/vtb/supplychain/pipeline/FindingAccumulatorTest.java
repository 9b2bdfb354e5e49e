package com.vtb.supplychain.pipeline;

import com.vtb.supplychain.models.Finding;
import com.vtb.supplychain.models.FindingType;
import com.vtb.supplychain.models.Severity;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.vtb.supplychain.pipeline.StageOrchestratorTest.finding;
import static org.junit.jupiter.api.Assertions.*;

class FindingAccumulatorTest {

    @Test
    void sameKeyMergesEvidenceAndKeepsMaxConfidence() {
        FindingAccumulator accumulator = new FindingAccumulator();
        Finding first = finding("lodash", FindingType.VULNERABILITY, Severity.HIGH, "CVE-2021-23337", "npm audit");
        first.setConfidence(0.9);
        Finding second = finding("lodash", FindingType.VULNERABILITY, Severity.HIGH, "npm audit", "OSV");
        second.setConfidence(0.4);

        assertEquals(1, accumulator.merge(List.of(first)));
        assertEquals(0, accumulator.merge(List.of(second)));

        Finding merged = accumulator.snapshot().get(0);
        assertEquals(List.of("CVE-2021-23337", "npm audit", "OSV"), merged.getEvidence());
        assertEquals(0.9, merged.getConfidence(), 1e-9);
    }

    @Test
    void missingAndUnknownVersionShareOneKey() {
        FindingAccumulator accumulator = new FindingAccumulator();
        Finding withoutVersion = finding("left-pad", FindingType.VULNERABILITY, Severity.HIGH, "OSV");
        withoutVersion.setPackageVersion(null);
        Finding unknownVersion = finding(" left-pad ", FindingType.VULNERABILITY, Severity.HIGH, "npm audit");
        unknownVersion.setPackageVersion("unknown");

        assertEquals(1, accumulator.merge(List.of(withoutVersion)));
        assertEquals(0, accumulator.merge(List.of(unknownVersion)));

        assertEquals(1, accumulator.size());
        Finding merged = accumulator.snapshot().get(0);
        assertEquals("left-pad@unknown", merged.packageIdentity());
        assertEquals(List.of("OSV", "npm audit"), merged.getEvidence());
    }

    @Test
    void differentSeverityOrTypeStaysSeparate() {
        FindingAccumulator accumulator = new FindingAccumulator();
        accumulator.merge(List.of(
            finding("lodash", FindingType.VULNERABILITY, Severity.HIGH),
            finding("lodash", FindingType.VULNERABILITY, Severity.MEDIUM),
            finding("lodash", FindingType.LOW_REPUTATION, Severity.HIGH)));

        assertEquals(3, accumulator.size());
    }

    @Test
    void missingDescriptionIsFilledFromLaterFinding() {
        FindingAccumulator accumulator = new FindingAccumulator();
        Finding bare = finding("minimist", FindingType.VULNERABILITY, Severity.CRITICAL);
        bare.setDescription(null);
        Finding detailed = finding("minimist", FindingType.VULNERABILITY, Severity.CRITICAL);
        detailed.setDescription("Prototype pollution");
        detailed.setRemediation("Обновить до 1.2.6");

        accumulator.merge(List.of(bare));
        accumulator.merge(List.of(detailed));

        Finding merged = accumulator.snapshot().get(0);
        assertEquals("Prototype pollution", merged.getDescription());
        assertEquals("Обновить до 1.2.6", merged.getRemediation());
    }

    @Test
    void snapshotIsDetachedFromAccumulator() {
        FindingAccumulator accumulator = new FindingAccumulator();
        Finding original = finding("left-pad", FindingType.MALICIOUS_PACKAGE, Severity.CRITICAL, "typosquat");
        accumulator.merge(List.of(original));

        original.getEvidence().add("changed after merge");
        accumulator.snapshot().get(0).getEvidence().add("changed in snapshot");

        assertEquals(List.of("typosquat"), accumulator.snapshot().get(0).getEvidence());
    }

    @Test
    void nullInputIsIgnored() {
        FindingAccumulator accumulator = new FindingAccumulator();
        assertEquals(0, accumulator.merge(null));
        assertEquals(0, accumulator.merge(Arrays.asList(null, null)));
        assertTrue(accumulator.isEmpty());
    }
}
