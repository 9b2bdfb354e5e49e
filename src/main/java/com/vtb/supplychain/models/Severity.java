package com.vtb.supplychain.models;

import java.util.Locale;

/**
 * Уровни критичности находок
 */
public enum Severity {
    CRITICAL("Критический", 4),
    HIGH("Высокий", 3),
    MEDIUM("Средний", 2),
    LOW("Низкий", 1);

    private final String russianName;
    private final int priority;

    Severity(String russianName, int priority) {
        this.russianName = russianName;
        this.priority = priority;
    }

    public String getRussianName() {
        return russianName;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isAtLeast(Severity other) {
        return other == null || priority >= other.priority;
    }

    /**
     * Разбор значения из внешних источников ("critical", "HIGH", "moderate").
     * Неизвестные значения понижаются до LOW.
     */
    public static Severity fromString(String value) {
        if (value == null || value.isBlank()) {
            return LOW;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "critical" -> CRITICAL;
            case "high" -> HIGH;
            case "medium", "moderate" -> MEDIUM;
            default -> LOW;
        };
    }
}
