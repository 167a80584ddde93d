package com.sentinel.scanner.models;

import java.util.Locale;

/**
 * Семейство угроз
 */
public enum ThreatCategory {
    RANSOMWARE,
    TROJAN,
    SPYWARE,
    ROOTKIT,
    CRYPTOMINER,
    BACKDOOR,
    WORM,
    ADWARE,
    UNCLASSIFIED;

    /**
     * Определить категорию по имени угрозы из базы сигнатур
     * ("Trojan.Generic" → TROJAN, "Ransomware.Crypto" → RANSOMWARE).
     */
    public static ThreatCategory fromThreatName(String threatName) {
        if (threatName == null || threatName.isBlank()) {
            return UNCLASSIFIED;
        }
        String lower = threatName.toLowerCase(Locale.ROOT);
        for (ThreatCategory category : values()) {
            if (category == UNCLASSIFIED) {
                continue;
            }
            if (lower.contains(category.name().toLowerCase(Locale.ROOT))) {
                return category;
            }
        }
        if (lower.contains("miner")) {
            return CRYPTOMINER;
        }
        return UNCLASSIFIED;
    }
}
