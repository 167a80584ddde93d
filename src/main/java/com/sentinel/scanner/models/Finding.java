package com.sentinel.scanner.models;

import lombok.Builder;
import lombok.Value;

/**
 * Утверждение одного детектора о файле
 */
@Value
@Builder
public class Finding {
    public static final int MIN_SEVERITY = 1;
    public static final int MAX_SEVERITY = 10;

    DetectionMethod detectorKind;
    @Builder.Default
    ThreatCategory category = ThreatCategory.UNCLASSIFIED;
    /** Локальная шкала детектора 1-10 */
    int severity;
    String rationale;

    public static int clampSeverity(int severity) {
        return Math.max(MIN_SEVERITY, Math.min(MAX_SEVERITY, severity));
    }
}
