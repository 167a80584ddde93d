package com.sentinel.scanner.detectors;

import com.sentinel.scanner.models.DetectionMethod;
import com.sentinel.scanner.models.Evidence;
import com.sentinel.scanner.models.Finding;
import com.sentinel.scanner.models.ScanPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Сопоставление индикаторов поведения с каталогом паттернов.
 * Заглушка до появления реального мониторинга: индикаторы приходят извне.
 */
@Slf4j
public class BehavioralDetector implements ThreatDetector {

    private final List<BehaviorPattern> catalog;
    private final BehaviorIndicatorSource indicatorSource;

    public BehavioralDetector(List<BehaviorPattern> catalog, BehaviorIndicatorSource indicatorSource) {
        this.catalog = catalog != null ? List.copyOf(catalog) : List.of();
        this.indicatorSource = indicatorSource != null ? indicatorSource : BehaviorIndicatorSource.none();
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.BEHAVIORAL;
    }

    public List<BehaviorPattern> getCatalog() {
        return catalog;
    }

    @Override
    public List<Finding> evaluate(Evidence evidence, ScanPolicy policy) {
        if (evidence == null || catalog.isEmpty()) {
            return List.of();
        }

        Set<String> observed;
        try {
            observed = indicatorSource.indicatorsFor(evidence.getPath());
        } catch (RuntimeException e) {
            throw new DetectorException("Источник индикаторов недоступен для " + evidence.getPath(), e);
        }
        if (observed == null || observed.isEmpty()) {
            return List.of();
        }

        List<Finding> findings = new ArrayList<>();
        for (BehaviorPattern pattern : catalog) {
            if (pattern.matches(observed)) {
                log.debug("Поведенческий паттерн {} для {}", pattern.getName(), evidence.getPath());
                findings.add(Finding.builder()
                    .detectorKind(DetectionMethod.BEHAVIORAL)
                    .category(pattern.getCategory())
                    .severity(Finding.clampSeverity(pattern.getSeverity()))
                    .rationale(pattern.getName() + ": " + pattern.getDescription())
                    .build());
            }
        }
        return findings;
    }
}
