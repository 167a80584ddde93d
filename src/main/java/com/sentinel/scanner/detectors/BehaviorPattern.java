package com.sentinel.scanner.detectors;

import com.sentinel.scanner.models.ThreatCategory;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Именованный поведенческий паттерн из каталога
 */
@Value
@Builder
public class BehaviorPattern {
    String name;
    ThreatCategory category;
    @Singular
    Set<String> indicators;
    int severity;
    String description;

    /**
     * Паттерн срабатывает, если наблюдается хотя бы один из его индикаторов
     */
    public boolean matches(Set<String> observed) {
        if (observed == null || observed.isEmpty()) {
            return false;
        }
        for (String indicator : indicators) {
            if (observed.contains(indicator)) {
                return true;
            }
        }
        return false;
    }
}
