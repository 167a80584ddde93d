package com.sentinel.scanner.detectors;

import com.sentinel.scanner.models.DetectionMethod;
import com.sentinel.scanner.models.Evidence;
import com.sentinel.scanner.models.Finding;
import com.sentinel.scanner.models.ScanPolicy;

import java.util.List;

/**
 * Контракт детектора угроз.
 *
 * <p>Для одних и тех же признаков и состояния детектора результат одинаков.
 * Пустой список означает "ничего не найдено" и является обычным исходом.
 * Внутренние сбои сигнализируются {@link DetectorException}; движок гасит их
 * для этого детектора, не прерывая оценку файла остальными.
 */
public interface ThreatDetector {

    DetectionMethod getMethod();

    /**
     * Оценить признаки файла
     *
     * @param evidence признаки файла
     * @param policy политика текущей сессии
     * @return находки, никогда не null
     */
    List<Finding> evaluate(Evidence evidence, ScanPolicy policy);

    default String getName() {
        return getClass().getSimpleName();
    }
}
