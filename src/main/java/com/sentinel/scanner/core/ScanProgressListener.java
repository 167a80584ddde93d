package com.sentinel.scanner.core;

import java.nio.file.Path;

/**
 * Слушатель прогресса сканирования.
 * Вызывается из потоков-воркеров каждые N оцененных файлов и один раз по завершении.
 */
@FunctionalInterface
public interface ScanProgressListener {

    /**
     * @param filesScannedSoFar сколько файлов оценено к этому моменту
     * @param currentPath последний оцененный файл (null в финальном вызове)
     */
    void onProgress(long filesScannedSoFar, Path currentPath);

    /**
     * Пустая реализация без операций.
     */
    static ScanProgressListener noOp() {
        return (files, path) -> { };
    }
}
