package com.sentinel.scanner.core;

import com.sentinel.scanner.models.Classification;
import com.sentinel.scanner.models.ScanStatistics;
import com.sentinel.scanner.models.SkipReason;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Единственная разделяемая изменяемая часть сессии.
 * Счетчики только растут; после {@link #freeze()} изменения игнорируются.
 */
public class StatisticsAccumulator {

    private final AtomicLong filesScanned = new AtomicLong();
    private final AtomicLong suspicious = new AtomicLong();
    private final AtomicLong malicious = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong detectorErrors = new AtomicLong();
    private final Map<SkipReason, AtomicLong> skippedByReason = new EnumMap<>(SkipReason.class);

    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile boolean frozen;

    public StatisticsAccumulator() {
        for (SkipReason reason : SkipReason.values()) {
            skippedByReason.put(reason, new AtomicLong());
        }
    }

    public void markStarted() {
        if (startedAt == null) {
            startedAt = Instant.now();
        }
    }

    /**
     * Учесть оцененный файл
     *
     * @return сколько файлов оценено с учетом этого
     */
    public long recordVerdict(Classification classification) {
        if (frozen) {
            return filesScanned.get();
        }
        if (classification == Classification.SUSPICIOUS) {
            suspicious.incrementAndGet();
        } else if (classification == Classification.MALICIOUS) {
            malicious.incrementAndGet();
        }
        return filesScanned.incrementAndGet();
    }

    public void recordSkip(SkipReason reason) {
        if (frozen || reason == null) {
            return;
        }
        skippedByReason.get(reason).incrementAndGet();
        if (reason.isError()) {
            errors.incrementAndGet();
        } else {
            skipped.incrementAndGet();
        }
    }

    public void recordDetectorError() {
        if (!frozen) {
            detectorErrors.incrementAndGet();
        }
    }

    public long getFilesScanned() {
        return filesScanned.get();
    }

    public synchronized void freeze() {
        if (!frozen) {
            finishedAt = Instant.now();
            frozen = true;
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    public ScanStatistics snapshot() {
        Map<SkipReason, Long> reasons = new EnumMap<>(SkipReason.class);
        for (Map.Entry<SkipReason, AtomicLong> entry : skippedByReason.entrySet()) {
            long value = entry.getValue().get();
            if (value > 0) {
                reasons.put(entry.getKey(), value);
            }
        }
        return ScanStatistics.builder()
            .filesScanned(filesScanned.get())
            .suspiciousCount(suspicious.get())
            .maliciousCount(malicious.get())
            .errorCount(errors.get())
            .skippedCount(skipped.get())
            .detectorErrorCount(detectorErrors.get())
            .startedAt(startedAt)
            .finishedAt(finishedAt)
            .skippedByReason(reasons)
            .build();
    }
}
