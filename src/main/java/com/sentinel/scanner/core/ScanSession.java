package com.sentinel.scanner.core;

import com.sentinel.scanner.detectors.ThreatDetector;
import com.sentinel.scanner.evidence.EvidenceExtractor;
import com.sentinel.scanner.models.ScanPolicy;
import com.sentinel.scanner.models.ScanResult;
import com.sentinel.scanner.models.ScanStatistics;
import com.sentinel.scanner.models.ScanStatus;
import com.sentinel.scanner.models.ScanType;
import com.sentinel.scanner.models.Verdict;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Одна сессия сканирования: {@code create(policy) → run() → ScanResult}.
 *
 * <p>{@link #run()} синхронен для вызывающего, внутри работает пул воркеров {@link TraversalEngine}.
 * Отмена через {@link #cancel()} кооперативная: новые файлы перестают перечисляться,
 * статистика фиксируется по уже выполненной работе, возвращается частичный результат.
 * Единственный отказ, видимый вызывающему, - несуществующий корень пользовательского сканирования.
 */
@Slf4j
public class ScanSession {

    private final ScanPolicy policy;
    private final TraversalEngine engine;
    private final ScanProgressListener progressListener;
    private final CancellationToken cancellation;
    private final AtomicBoolean started = new AtomicBoolean(false);

    @Builder
    private ScanSession(ScanPolicy policy,
                        List<ThreatDetector> detectors,
                        EvidenceExtractor extractor,
                        ScoreAggregator aggregator,
                        EngineSettings engineSettings,
                        ScanProgressListener progressListener,
                        CancellationToken cancellation) {
        if (policy == null) {
            throw new IllegalArgumentException("ScanPolicy не может быть null");
        }
        this.policy = policy;
        this.engine = new TraversalEngine(extractor, detectors, aggregator, engineSettings);
        this.progressListener = progressListener != null ? progressListener : ScanProgressListener.noOp();
        this.cancellation = cancellation != null ? cancellation : new CancellationToken();
    }

    /**
     * Выполнить сессию. Повторный запуск той же сессии запрещен.
     *
     * @throws PathNotFoundException корень пользовательского сканирования не существует
     */
    public ScanResult run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Сессия уже была запущена");
        }
        checkRoots();

        log.info("=== Начало сканирования ({}) ===", policy.getScanType());
        log.info("Корней: {}, глубина: {}, детекторов: {}",
            policy.getRootPaths().size(), policy.getMaxDepth(), engine.getDetectors().size());

        StatisticsAccumulator statistics = new StatisticsAccumulator();
        statistics.markStarted();

        List<Verdict> verdicts = engine.run(policy, statistics, cancellation, progressListener);

        statistics.freeze();
        ScanStatistics snapshot = statistics.snapshot();
        TraversalEngine.notifyProgress(progressListener, snapshot.getFilesScanned(), null);

        ScanStatus status = cancellation.isCancelled() ? ScanStatus.CANCELLED : ScanStatus.COMPLETED;
        log.info("=== Сканирование завершено: {} за {} ===", status, snapshot.getFormattedDuration());
        log.info("Файлов: {}, подозрительных: {}, вредоносных: {}, ошибок: {}, пропущено: {}",
            snapshot.getFilesScanned(), snapshot.getSuspiciousCount(), snapshot.getMaliciousCount(),
            snapshot.getErrorCount(), snapshot.getSkippedCount());
        if (snapshot.getDetectorErrorCount() > 0) {
            log.warn("Сбоев детекторов: {}", snapshot.getDetectorErrorCount());
        }

        return ScanResult.builder()
            .scanType(policy.getScanType())
            .status(status)
            .verdicts(verdicts)
            .statistics(snapshot)
            .build();
    }

    /**
     * Запросить остановку. Безопасно вызывать из любого потока, в том числе до {@link #run()}.
     */
    public void cancel() {
        if (!cancellation.isCancelled()) {
            log.info("Запрошена отмена сканирования");
        }
        cancellation.cancel();
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public ScanPolicy getPolicy() {
        return policy;
    }

    public TraversalEngine getEngine() {
        return engine;
    }

    public int getActiveWorkers() {
        return engine.getActiveWorkers();
    }

    private void checkRoots() {
        if (policy.getScanType() != ScanType.CUSTOM) {
            return;
        }
        for (Path root : policy.getRootPaths()) {
            if (root == null || !Files.exists(root)) {
                throw new PathNotFoundException(root);
            }
        }
    }
}
