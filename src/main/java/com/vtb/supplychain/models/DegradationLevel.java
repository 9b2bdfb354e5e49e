package com.vtb.supplychain.models;

/**
 * Уровень деградации анализа по доле успешно выполненных этапов.
 */
public enum DegradationLevel {
    FULL(0.95),
    PARTIAL(0.75),
    BASIC(0.55),
    MINIMAL(0.35);

    private final double confidence;

    DegradationLevel(double confidence) {
        this.confidence = confidence;
    }

    public double getConfidence() {
        return confidence;
    }

    public static DegradationLevel fromSuccessRate(double successRate) {
        if (successRate >= 1.0) {
            return FULL;
        }
        if (successRate > 0.69) {
            return PARTIAL;
        }
        if (successRate >= 0.4) {
            return BASIC;
        }
        return MINIMAL;
    }
}
