package com.sentinel.scanner.models;

/**
 * Метод обнаружения, которым получена находка
 */
public enum DetectionMethod {
    SIGNATURE("Сигнатурный"),
    HEURISTIC("Эвристический"),
    BEHAVIORAL("Поведенческий"),
    AI_MODEL("AI-модель"),
    SANDBOX("Песочница");

    private final String russianName;

    DetectionMethod(String russianName) {
        this.russianName = russianName;
    }

    public String getRussianName() {
        return russianName;
    }
}
