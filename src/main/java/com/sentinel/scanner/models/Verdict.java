package com.sentinel.scanner.models;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Агрегированный результат по одному файлу
 */
@Value
@Builder
public class Verdict {
    Path path;
    /** 0-100 */
    int riskScore;
    Classification classification;
    @Builder.Default
    List<Finding> findings = new ArrayList<>();
    String sha256;
    String md5;
    long sizeBytes;

    /**
     * Чистый файл, по которому детекторы все же оставили замечания
     */
    public boolean hasNotes() {
        return classification == Classification.CLEAN && findings != null && !findings.isEmpty();
    }

    public boolean isThreat() {
        return classification != Classification.CLEAN;
    }

    public String describeReasons() {
        if (findings == null || findings.isEmpty()) {
            return "";
        }
        return findings.stream()
            .map(Finding::getRationale)
            .collect(Collectors.joining(", "));
    }
}
