package com.sentinel.scanner.util;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class EntropyCalculatorTest {

    @Test
    void testZeroBytesHaveNoEntropy() {
        assertEquals(0.0, EntropyCalculator.entropy(new byte[1]), 1e-9);
        assertEquals(0.0, EntropyCalculator.entropy(new byte[100_000]), 1e-9);
    }

    @Test
    void testEmptyContent() {
        assertEquals(0.0, EntropyCalculator.entropy(new byte[0]), 1e-9);
        assertEquals(0.0, EntropyCalculator.entropy((byte[]) null), 1e-9);
    }

    @Test
    void testUniformDistributionIsEightBits() {
        byte[] data = new byte[256 * 64];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) i;
        }
        assertEquals(8.0, EntropyCalculator.entropy(data), 1e-9, "Равномерное распределение дает 8 бит");
    }

    @Test
    void testRandomDataApproachesEight() {
        byte[] data = new byte[1 << 20];
        new Random(42).nextBytes(data);
        double entropy = EntropyCalculator.entropy(data);
        assertTrue(entropy > 7.99 && entropy <= 8.0, "Случайные данные: " + entropy);
    }

    @Test
    void testTwoSymbolsGiveOneBit() {
        byte[] data = new byte[1000];
        for (int i = 0; i < data.length; i += 2) {
            data[i] = 'a';
            data[i + 1] = 'b';
        }
        assertEquals(1.0, EntropyCalculator.entropy(data), 1e-9);
    }

    @Test
    void testIncrementalUpdatesMatchSinglePass() {
        byte[] data = "The quick brown fox jumps over the lazy dog".getBytes();
        EntropyCalculator calculator = new EntropyCalculator();
        calculator.update(data, 0, 10);
        calculator.update(data, 10, data.length - 10);

        assertEquals(data.length, calculator.getTotal());
        assertEquals(EntropyCalculator.entropy(data), calculator.entropy(), 1e-12);
    }
}
