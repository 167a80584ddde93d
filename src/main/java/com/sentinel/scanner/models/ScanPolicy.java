package com.sentinel.scanner.models;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Политика сессии: какие корни, расширения и глубину сканировать.
 * Неизменяема на протяжении всей сессии.
 */
@Value
@Builder(toBuilder = true)
public class ScanPolicy {
    public static final long DEFAULT_MAX_FILE_SIZE = 100L * 1024 * 1024;

    @Builder.Default
    ScanType scanType = ScanType.CUSTOM;
    @Singular
    List<Path> rootPaths;
    int maxDepth;
    /** Пустое множество означает "все расширения" */
    @Singular
    Set<String> targetExtensions;
    @Builder.Default
    long maxFileSizeBytes = DEFAULT_MAX_FILE_SIZE;
    @Builder.Default
    boolean followSymlinks = false;
    /** Считать MD5 для сигнатур старого формата */
    @Builder.Default
    boolean legacyDigest = false;

    public boolean acceptsAllExtensions() {
        return targetExtensions == null || targetExtensions.isEmpty();
    }

    public boolean acceptsExtension(String extension) {
        if (acceptsAllExtensions()) {
            return true;
        }
        if (extension == null || extension.isEmpty()) {
            return false;
        }
        return targetExtensions.contains(extension.toLowerCase(Locale.ROOT));
    }
}
