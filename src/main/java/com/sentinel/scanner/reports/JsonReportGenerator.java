package com.sentinel.scanner.reports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sentinel.scanner.models.ScanResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Генератор отчетов в формате JSON
 */
@Slf4j
public class JsonReportGenerator implements ReportGenerator {

    public static final String DEFAULT_FILE_NAME = "scan-report.json";

    private final ObjectMapper objectMapper;

    public JsonReportGenerator() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void generate(ScanResult result, Path outputPath) throws IOException {
        if (result == null) {
            throw new IllegalArgumentException("ScanResult не может быть null");
        }
        log.info("Генерация JSON отчета: {}", outputPath);

        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, toJson(result));

        log.info("JSON отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    /**
     * Сериализовать результат без записи на диск
     */
    public String toJson(ScanResult result) throws IOException {
        return objectMapper.writeValueAsString(result);
    }

    @Override
    public String getFileExtension() {
        return "json";
    }
}
