package com.sentinel.scanner.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Результат сессии сканирования: вердикты и статистика.
 * Слой представления только читает эту модель.
 */
@Data
@Builder
public class ScanResult {
    private ScanType scanType;
    private ScanStatus status;

    @Builder.Default
    private List<Verdict> verdicts = new ArrayList<>();

    private ScanStatistics statistics;

    public List<Verdict> getVerdictsByClassification(Classification classification) {
        return verdicts.stream()
            .filter(v -> v.getClassification() == classification)
            .collect(Collectors.toList());
    }

    public List<Verdict> getThreats() {
        return verdicts.stream()
            .filter(Verdict::isThreat)
            .collect(Collectors.toList());
    }

    public boolean hasMaliciousFiles() {
        return verdicts.stream()
            .anyMatch(v -> v.getClassification() == Classification.MALICIOUS);
    }

    public boolean isCancelled() {
        return status == ScanStatus.CANCELLED;
    }
}
