package com.sentinel.scanner.models;

/**
 * Итоговая классификация файла
 */
public enum Classification {
    CLEAN("clean", 0),
    SUSPICIOUS("suspicious", 1),
    MALICIOUS("malicious", 2);

    private final String label;
    private final int rank;

    Classification(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    public String getLabel() {
        return label;
    }

    public int getRank() {
        return rank;
    }

    public boolean isAtLeast(Classification other) {
        return rank >= other.rank;
    }
}
