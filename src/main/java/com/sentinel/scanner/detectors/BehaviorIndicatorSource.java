package com.sentinel.scanner.detectors;

import java.nio.file.Path;
import java.util.Set;

/**
 * Источник индикаторов поведения, наблюдаемых во время выполнения.
 * Реализуется внешним мониторингом; без него поведенческий детектор ничего не находит.
 */
@FunctionalInterface
public interface BehaviorIndicatorSource {

    Set<String> indicatorsFor(Path path);

    static BehaviorIndicatorSource none() {
        return path -> Set.of();
    }
}
