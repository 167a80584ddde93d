package com.sentinel.scanner.models;

import com.sentinel.scanner.util.DurationFormatter;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Статистика сканирования (снимок, зафиксированный по окончании сессии)
 */
@Data
@Builder
public class ScanStatistics {
    private long filesScanned;
    private long suspiciousCount;
    private long maliciousCount;
    private long errorCount;
    private long skippedCount;
    private long detectorErrorCount;
    private Instant startedAt;
    private Instant finishedAt;

    @Builder.Default
    private Map<SkipReason, Long> skippedByReason = new EnumMap<>(SkipReason.class);

    public long getDurationMs() {
        if (startedAt == null || finishedAt == null) {
            return 0L;
        }
        return Math.max(0L, finishedAt.toEpochMilli() - startedAt.toEpochMilli());
    }

    public String getFormattedDuration() {
        return DurationFormatter.format(getDurationMs());
    }

    public long getSkipped(SkipReason reason) {
        if (skippedByReason == null) {
            return 0L;
        }
        return skippedByReason.getOrDefault(reason, 0L);
    }
}
