package com.sentinel.scanner.util;

/**
 * Энтропия Шеннона по гистограмме байтов.
 * Упакованные и зашифрованные файлы дают значения, близкие к 8.0
 */
public final class EntropyCalculator {

    public static final int BUCKETS = 256;
    public static final double MAX_ENTROPY = 8.0;

    private final long[] histogram = new long[BUCKETS];
    private long total;

    public void update(byte[] buffer, int offset, int length) {
        for (int i = offset; i < offset + length; i++) {
            histogram[buffer[i] & 0xFF]++;
        }
        total += length;
    }

    public long getTotal() {
        return total;
    }

    public double entropy() {
        return entropy(histogram, total);
    }

    /**
     * H = -Σ p·log2(p) по ненулевым корзинам, 0 для пустого содержимого
     */
    public static double entropy(long[] histogram, long total) {
        if (total <= 0) {
            return 0.0;
        }
        double entropy = 0.0;
        for (long count : histogram) {
            if (count == 0) {
                continue;
            }
            double p = (double) count / total;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        // -0.0 для однородного содержимого
        return Math.max(0.0, Math.min(MAX_ENTROPY, entropy));
    }

    public static double entropy(byte[] data) {
        EntropyCalculator calculator = new EntropyCalculator();
        if (data != null) {
            calculator.update(data, 0, data.length);
        }
        return calculator.entropy();
    }
}
