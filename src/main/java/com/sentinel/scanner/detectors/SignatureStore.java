package com.sentinel.scanner.detectors;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Таблица сигнатур: hex-дайджест (MD5 или SHA-256) → имя угрозы.
 * Только для чтения на время сессии.
 */
@Slf4j
public final class SignatureStore {

    private final Map<String, String> signatures;

    private SignatureStore(Map<String, String> signatures) {
        this.signatures = Collections.unmodifiableMap(signatures);
    }

    public static SignatureStore of(Map<String, String> digestToThreat) {
        Map<String, String> normalized = new LinkedHashMap<>();
        if (digestToThreat != null) {
            for (Map.Entry<String, String> entry : digestToThreat.entrySet()) {
                String digest = normalize(entry.getKey());
                if (digest == null || entry.getValue() == null || entry.getValue().isBlank()) {
                    log.warn("Пропущена некорректная сигнатура: {}", entry.getKey());
                    continue;
                }
                normalized.put(digest, entry.getValue().trim());
            }
        }
        log.debug("Загружено {} сигнатур", normalized.size());
        return new SignatureStore(normalized);
    }

    public static SignatureStore empty() {
        return new SignatureStore(new LinkedHashMap<>());
    }

    public Optional<String> lookup(String digest) {
        String key = normalize(digest);
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(signatures.get(key));
    }

    public int size() {
        return signatures.size();
    }

    private static String normalize(String digest) {
        if (digest == null) {
            return null;
        }
        String trimmed = digest.trim().toLowerCase(Locale.ROOT);
        return trimmed.isEmpty() ? null : trimmed;
    }
}
