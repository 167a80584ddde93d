package com.sentinel.scanner.core;

import com.sentinel.scanner.config.ScannerConfig;
import com.sentinel.scanner.detectors.BehaviorIndicatorSource;
import com.sentinel.scanner.detectors.DetectorFactory;
import com.sentinel.scanner.detectors.SignatureStore;
import com.sentinel.scanner.evidence.EvidenceExtractor;
import com.sentinel.scanner.models.ScanPolicy;
import com.sentinel.scanner.models.ScanResult;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Точка входа движка: быстрое, глубокое и пользовательское сканирование.
 * Все три вида - одна и та же сессия с разными политиками.
 */
@Slf4j
public class SentinelScanner {

    private final ScannerConfig config;
    private final SignatureStore signatureStore;
    private final BehaviorIndicatorSource indicatorSource;
    private final EngineSettings engineSettings;
    private final AtomicReference<ScanSession> currentSession = new AtomicReference<>();

    private volatile ScanProgressListener progressListener = ScanProgressListener.noOp();

    public SentinelScanner(ScannerConfig config) {
        this(config, BehaviorIndicatorSource.none());
    }

    public SentinelScanner(ScannerConfig config, BehaviorIndicatorSource indicatorSource) {
        this(config, indicatorSource, EngineSettings.from(config != null ? config.getEngine() : null));
    }

    public SentinelScanner(ScannerConfig config,
                           BehaviorIndicatorSource indicatorSource,
                           EngineSettings engineSettings) {
        if (config == null) {
            throw new IllegalArgumentException("ScannerConfig не может быть null");
        }
        this.config = config;
        this.signatureStore = DetectorFactory.createSignatureStore(config);
        this.indicatorSource = indicatorSource != null ? indicatorSource : BehaviorIndicatorSource.none();
        this.engineSettings = engineSettings != null ? engineSettings : EngineSettings.defaults();
        log.info("Сканер инициализирован: {} сигнатур, {} воркеров",
            signatureStore.size(), this.engineSettings.getWorkerThreads());
    }

    public void setProgressListener(ScanProgressListener listener) {
        this.progressListener = listener != null ? listener : ScanProgressListener.noOp();
    }

    public ScanResult runQuickScan() {
        return run(ScanPolicies.quick(config));
    }

    public ScanResult runDeepScan() {
        return run(ScanPolicies.deep(config));
    }

    /**
     * @throws PathNotFoundException путь не существует; обход не начинается
     */
    public ScanResult runCustomScan(Path path) {
        if (path == null || !Files.exists(path)) {
            log.error("Путь для сканирования не найден: {}", path);
            throw new PathNotFoundException(path);
        }
        return run(ScanPolicies.custom(config, path.toAbsolutePath().normalize()));
    }

    public ScanResult run(ScanPolicy policy) {
        ScanSession session = createSession(policy);
        currentSession.set(session);
        try {
            return session.run();
        } finally {
            currentSession.compareAndSet(session, null);
        }
    }

    /**
     * Новая сессия со своим набором детекторов
     */
    public ScanSession createSession(ScanPolicy policy) {
        ScannerConfig.Engine engine = config.getEngine();
        return ScanSession.builder()
            .policy(policy)
            .detectors(DetectorFactory.createDefault(config, signatureStore, indicatorSource))
            .extractor(new EvidenceExtractor(engine.getContentSampleBytes(), engine.getReadChunkBytes()))
            .engineSettings(engineSettings)
            .progressListener(progressListener)
            .build();
    }

    /**
     * Отменить текущую сессию, если она идет
     */
    public boolean cancel() {
        ScanSession session = currentSession.get();
        if (session == null) {
            return false;
        }
        session.cancel();
        return true;
    }

    public ScannerConfig getConfig() {
        return config;
    }
}
