package com.sentinel.scanner.core;

import com.sentinel.scanner.models.Classification;
import com.sentinel.scanner.models.DetectionMethod;
import com.sentinel.scanner.models.Evidence;
import com.sentinel.scanner.models.Finding;
import com.sentinel.scanner.models.ThreatCategory;
import com.sentinel.scanner.models.Verdict;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для ScoreAggregator
 */
class ScoreAggregatorTest {

    private final ScoreAggregator aggregator = new ScoreAggregator();

    private static Finding finding(DetectionMethod kind, int severity, String rationale) {
        return Finding.builder()
            .detectorKind(kind)
            .category(ThreatCategory.UNCLASSIFIED)
            .severity(severity)
            .rationale(rationale)
            .build();
    }

    private static Finding heuristic(int severity) {
        return finding(DetectionMethod.HEURISTIC, severity, "rule-" + severity);
    }

    @Test
    void testNoFindingsIsClean() {
        Verdict verdict = aggregator.aggregate(List.of());

        assertEquals(0, verdict.getRiskScore());
        assertEquals(Classification.CLEAN, verdict.getClassification());
        assertFalse(verdict.hasNotes());
    }

    @Test
    void testThresholds() {
        assertEquals(Classification.CLEAN, aggregator.aggregate(List.of(heuristic(3))).getClassification());
        assertEquals(Classification.SUSPICIOUS, aggregator.aggregate(List.of(heuristic(4))).getClassification());
        assertEquals(Classification.SUSPICIOUS, aggregator.aggregate(List.of(heuristic(6))).getClassification());
        assertEquals(Classification.MALICIOUS, aggregator.aggregate(List.of(heuristic(7))).getClassification());
    }

    @Test
    void testLowScoreWithFindingsIsCleanWithNotes() {
        Verdict verdict = aggregator.aggregate(List.of(heuristic(1), heuristic(2)));

        assertEquals(30, verdict.getRiskScore());
        assertEquals(Classification.CLEAN, verdict.getClassification());
        assertTrue(verdict.hasNotes(), "Находки сохраняются как замечания");
    }

    @Test
    void testScoreCappedAt100() {
        List<Finding> findings = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            findings.add(heuristic(10));
        }

        assertEquals(100, aggregator.aggregate(findings).getRiskScore());
    }

    @Test
    void testSignatureMatchAlwaysMalicious() {
        Finding signature = finding(DetectionMethod.SIGNATURE, 10, "Known malware signature: Trojan.Generic (sha256)");

        Verdict verdict = aggregator.aggregate(List.of(signature));

        assertEquals(Classification.MALICIOUS, verdict.getClassification());
        assertEquals(100, verdict.getRiskScore());
    }

    @Test
    void testSeverityTenFromOtherDetectorIsNotOverride() {
        Finding ai = finding(DetectionMethod.AI_MODEL, 10, "AI model malicious");

        Verdict verdict = aggregator.aggregate(List.of(ai));

        assertEquals(100, verdict.getRiskScore());
        assertEquals(Classification.MALICIOUS, verdict.getClassification());

        Verdict lowSignature = aggregator.aggregate(List.of(finding(DetectionMethod.SIGNATURE, 3, "partial")));
        assertEquals(Classification.CLEAN, lowSignature.getClassification(),
            "Только совпадение severity 10 от сигнатур переопределяет порог");
    }

    @Test
    void testOrderIndependence() {
        List<Finding> findings = new ArrayList<>(List.of(
            heuristic(2),
            finding(DetectionMethod.AI_MODEL, 5, "ai"),
            finding(DetectionMethod.BEHAVIORAL, 1, "beh"),
            heuristic(1),
            heuristic(2)));
        Verdict reference = aggregator.aggregate(findings);

        Random random = new Random(7);
        for (int i = 0; i < 20; i++) {
            Collections.shuffle(findings, random);
            assertEquals(reference, aggregator.aggregate(findings), "Перестановка находок не меняет вердикт");
        }
    }

    @Test
    void testMonotonicity() {
        List<Finding> findings = new ArrayList<>();
        int previous = 0;
        for (int severity : new int[] {1, 3, 2, 10, 5, 1}) {
            findings.add(heuristic(severity));
            int score = aggregator.aggregate(findings).getRiskScore();
            assertTrue(score >= previous, "Новая находка не снижает риск");
            assertTrue(score >= 0 && score <= 100);
            previous = score;
        }
    }

    @Test
    void testEvidenceFieldsCopied() {
        Evidence evidence = Evidence.builder()
            .path(Path.of("/scan/a.exe"))
            .sha256("ab")
            .md5("cd")
            .sizeBytes(42)
            .build();

        Verdict verdict = aggregator.aggregate(List.of(heuristic(1)), evidence);

        assertEquals(Path.of("/scan/a.exe"), verdict.getPath());
        assertEquals("ab", verdict.getSha256());
        assertEquals("cd", verdict.getMd5());
        assertEquals(42, verdict.getSizeBytes());
    }
}
