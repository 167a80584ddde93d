package com.sentinel.scanner.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Кооперативная отмена: производитель перестает обходить каталоги,
 * воркеры дорабатывают текущий файл и выходят.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
