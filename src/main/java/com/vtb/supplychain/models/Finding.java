package com.vtb.supplychain.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Находка по пакету: уязвимость, вредоносный пакет/скрипт, низкая репутация
 * или риск цепочки поставок.
 */
@Data
@Builder(toBuilder = true)
public class Finding {

    private String packageName;
    private String packageVersion;
    private FindingType findingType;
    private Severity severity;
    private String description;
    @Builder.Default
    private DetectionMethod detectionMethod = DetectionMethod.RULE_BASED;
    @Builder.Default
    private double confidence = 1.0;
    @Builder.Default
    private List<String> evidence = new ArrayList<>();
    private String remediation;

    /**
     * Ключ дедупликации: две находки с одинаковым ключом считаются одной.
     */
    public Key identityKey() {
        String name = packageName != null ? packageName.trim() : null;
        return new Key(name, PackageIdentity.normalizeVersion(packageVersion), findingType, severity);
    }

    public String packageIdentity() {
        return PackageIdentity.identityOf(packageName, packageVersion);
    }

    public void setConfidence(double confidence) {
        this.confidence = clamp(confidence);
    }

    /**
     * Глубокая копия: список evidence не разделяется с оригиналом.
     */
    public Finding copy() {
        return toBuilder()
            .confidence(clamp(confidence))
            .evidence(evidence != null ? new ArrayList<>(evidence) : new ArrayList<>())
            .build();
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public record Key(String packageName, String packageVersion, FindingType findingType, Severity severity) {
    }
}
