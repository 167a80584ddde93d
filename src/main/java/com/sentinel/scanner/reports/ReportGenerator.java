package com.sentinel.scanner.reports;

import com.sentinel.scanner.models.ScanResult;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Интерфейс для генераторов отчетов.
 * Генератор только читает результат и ничего в нем не меняет.
 */
public interface ReportGenerator {

    /**
     * Сгенерировать отчет
     *
     * @param result результат сканирования
     * @param outputPath путь для сохранения отчета
     * @throws IOException если произошла ошибка записи
     */
    void generate(ScanResult result, Path outputPath) throws IOException;

    /**
     * Получить расширение файла отчета
     */
    String getFileExtension();
}
