package com.sentinel.scanner.models;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Признаки одного файла, извлеченные для детекторов.
 * Создается один раз на файл, не изменяется и не переживает оценку этого файла.
 */
@Value
@Builder
public class Evidence {
    Path path;
    String fileName;
    long sizeBytes;
    /** Расширение в нижнем регистре с точкой (".exe") или пустая строка */
    String extension;
    String sha256;
    /** Только когда профиль запрашивает legacy-дайджест, иначе null */
    String md5;
    /** Энтропия Шеннона, бит/байт, 0.0 - 8.0 */
    double entropy;
    /** Ограниченный префикс содержимого для поиска паттернов */
    byte[] contentSample;
    boolean hidden;
    boolean worldWritable;
    Instant createdAt;

    /**
     * Копия префикса: находки одного детектора не должны менять данные для следующих
     */
    public byte[] getContentSample() {
        return contentSample != null ? contentSample.clone() : new byte[0];
    }

    public boolean hasMd5() {
        return md5 != null && !md5.isEmpty();
    }
}
