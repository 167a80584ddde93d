package com.sentinel.scanner.detectors;

import com.sentinel.scanner.models.DetectionMethod;
import com.sentinel.scanner.models.Evidence;
import com.sentinel.scanner.models.Finding;
import com.sentinel.scanner.models.ThreatCategory;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для HeuristicDetector
 */
class HeuristicDetectorTest {

    private static final List<HeuristicRule> RULES = List.of(
        HeuristicRule.of("write-process-memory", "WriteProcessMemory", 4, ThreatCategory.TROJAN),
        HeuristicRule.of("cipher-names", "\\b(Rijndael|AES|RSA)\\b", 3, ThreatCategory.RANSOMWARE),
        HeuristicRule.of("registry-run-key", "\\bRun\\s*=", 3, ThreatCategory.TROJAN));

    private static Evidence evidence(String path, String content, long size) {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        String name = Path.of(path).getFileName().toString();
        int dot = name.lastIndexOf('.');
        return Evidence.builder()
            .path(Path.of(path))
            .fileName(name)
            .extension(dot > 0 ? name.substring(dot) : "")
            .sizeBytes(size)
            .sha256("00")
            .contentSample(bytes)
            .build();
    }

    @Test
    void testEachMatchingRuleYieldsFinding() {
        HeuristicDetector detector = new HeuristicDetector(RULES, null);

        List<Finding> findings = detector.evaluate(
            evidence("/scan/a.ps1", "call writeprocessmemory; use AES key", 5000), null);

        assertEquals(2, findings.size());
        assertTrue(findings.stream().allMatch(f -> f.getDetectorKind() == DetectionMethod.HEURISTIC));
        assertEquals(7, findings.stream().mapToInt(Finding::getSeverity).sum());
    }

    @Test
    void testWordBoundaries() {
        HeuristicDetector detector = new HeuristicDetector(RULES, null);

        assertTrue(detector.evaluate(evidence("/scan/a.js", "PAESANO rerun = 1", 5000), null).isEmpty(),
            "Совпадения внутри слова не считаются");
        assertEquals(1, detector.evaluate(evidence("/scan/a.js", "Run = evil.exe", 5000), null).size());
    }

    @Test
    void testBinaryContentDecodedPermissively() {
        HeuristicDetector detector = new HeuristicDetector(RULES, null);
        byte[] bytes = new byte[] {(byte) 0xFF, (byte) 0xFE, 'R', 'S', 'A', ' ', (byte) 0xC3};
        Evidence evidence = Evidence.builder()
            .path(Path.of("/scan/bin.dll"))
            .fileName("bin.dll")
            .extension(".dll")
            .sizeBytes(bytes.length)
            .contentSample(bytes)
            .build();

        assertEquals(1, detector.evaluateContent(evidence).size());
    }

    @Test
    void testAttributeFindings() {
        HeuristicDetector detector = new HeuristicDetector(List.of(), HeuristicDetector.AttributeRules.builder()
            .executableExtension(".exe")
            .smallExecutableBytes(1024)
            .suspiciousLocation("/tmp/drop")
            .build());
        Evidence evidence = Evidence.builder()
            .path(Path.of("/tmp/drop/x/.tiny.exe"))
            .fileName(".tiny.exe")
            .extension(".exe")
            .sizeBytes(100)
            .contentSample(new byte[0])
            .hidden(true)
            .worldWritable(true)
            .build();

        List<Finding> findings = detector.evaluate(evidence, null);

        assertEquals(4, findings.size(), "Скрытый, запись для всех, маленький exe, подозрительное место");
        assertEquals(1 + 2 + 2 + 1, findings.stream().mapToInt(Finding::getSeverity).sum());
    }

    @Test
    void testSuspiciousLocationMatchesWholeComponents() {
        HeuristicDetector detector = new HeuristicDetector(List.of(), HeuristicDetector.AttributeRules.builder()
            .suspiciousLocation("/tmp")
            .build());

        assertEquals(1, detector.evaluate(locatedAt("/tmp/x.exe"), null).size());
        assertEquals(1, detector.evaluate(locatedAt("/tmp/a/b/x.exe"), null).size());
        assertTrue(detector.evaluate(locatedAt("/tmpdata/x.exe"), null).isEmpty(),
            "Префикс имени каталога не является вложенностью");
    }

    private static Evidence locatedAt(String path) {
        Path file = Path.of(path);
        return Evidence.builder()
            .path(file)
            .fileName(file.getFileName().toString())
            .extension(".exe")
            .sizeBytes(4096)
            .contentSample(new byte[0])
            .build();
    }

    @Test
    void testCleanFileHasNoFindings() {
        HeuristicDetector detector = new HeuristicDetector(RULES, HeuristicDetector.AttributeRules.builder()
            .executableExtension(".exe")
            .build());

        assertTrue(detector.evaluate(evidence("/scan/clean.txt", "hello world", 11), null).isEmpty());
    }
}
