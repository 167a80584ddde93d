package com.sentinel.scanner.core;

import com.sentinel.scanner.config.ScannerConfig;
import lombok.Builder;
import lombok.Value;

/**
 * Параметры пула воркеров и ограничений ввода-вывода
 */
@Value
@Builder(toBuilder = true)
public class EngineSettings {
    @Builder.Default
    int workerThreads = Runtime.getRuntime().availableProcessors();
    @Builder.Default
    int queueCapacity = 256;
    @Builder.Default
    long operationTimeoutMs = 30_000L;
    @Builder.Default
    int progressInterval = 100;

    public static EngineSettings defaults() {
        return EngineSettings.builder().build();
    }

    public static EngineSettings from(ScannerConfig.Engine engine) {
        if (engine == null) {
            return defaults();
        }
        return EngineSettings.builder()
            .workerThreads(engine.getWorkerThreads())
            .queueCapacity(engine.getQueueCapacity())
            .operationTimeoutMs(engine.getOperationTimeoutMs())
            .progressInterval(engine.getProgressInterval())
            .build();
    }
}
