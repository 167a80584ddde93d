package com.sentinel.scanner.core;

import com.sentinel.scanner.config.ScannerConfig;
import com.sentinel.scanner.detectors.BehaviorIndicatorSource;
import com.sentinel.scanner.detectors.DetectorFactory;
import com.sentinel.scanner.detectors.ThreatDetector;
import com.sentinel.scanner.models.Classification;
import com.sentinel.scanner.models.ScanPolicy;
import com.sentinel.scanner.models.ScanResult;
import com.sentinel.scanner.models.ScanStatus;
import com.sentinel.scanner.models.ScanType;
import com.sentinel.scanner.models.Verdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Сценарии полной сессии: извлечение → детекторы → агрегация → статистика
 */
class ScanSessionTest {

    private static final String SHA256_ABC = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @TempDir
    Path tempDir;

    private ScannerConfig config;

    @BeforeEach
    void setUp() throws IOException {
        try (InputStream in = ScannerConfig.class.getClassLoader()
                .getResourceAsStream(ScannerConfig.DEFAULT_RESOURCE)) {
            config = ScannerConfig.load(in);
        }
        // временный каталог теста сам попадает под подозрительные расположения
        config.getHeuristics().setSuspiciousLocations(new ArrayList<>());
    }

    private List<ThreatDetector> detectors() {
        return DetectorFactory.createDefault(config,
            DetectorFactory.createSignatureStore(config), BehaviorIndicatorSource.none());
    }

    private ScanSession.ScanSessionBuilder session(ScanPolicy policy) {
        return ScanSession.builder()
            .policy(policy)
            .detectors(detectors())
            .engineSettings(EngineSettings.builder().workerThreads(2).build());
    }

    @Test
    void testCleanFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("clean.txt"), "hello world");
        ScanPolicy policy = ScanPolicy.builder().rootPath(file).maxDepth(10).build();

        ScanResult result = session(policy).build().run();

        assertEquals(ScanStatus.COMPLETED, result.getStatus());
        assertEquals(1, result.getVerdicts().size());
        Verdict verdict = result.getVerdicts().get(0);
        assertEquals(0, verdict.getRiskScore());
        assertEquals(Classification.CLEAN, verdict.getClassification());
        assertEquals(1, result.getStatistics().getFilesScanned());
        assertEquals(0, result.getStatistics().getSuspiciousCount());
        assertNotNull(result.getStatistics().getStartedAt());
        assertNotNull(result.getStatistics().getFinishedAt());
    }

    @Test
    void testSmallKeygenExecutableIsAtLeastSuspicious() throws IOException {
        byte[] data = new byte[512];
        data[0] = 'M';
        data[1] = 'Z';
        Files.write(tempDir.resolve("virus_keygen.exe"), data);

        ScanResult result = session(ScanPolicies.custom(config, tempDir)).build().run();

        assertEquals(1, result.getVerdicts().size());
        Verdict verdict = result.getVerdicts().get(0);
        assertTrue(verdict.getClassification().isAtLeast(Classification.SUSPICIOUS),
            "Маленький exe с подозрительным именем: " + verdict.getClassification());
        assertTrue(verdict.describeReasons().contains("AI model"));
    }

    @Test
    void testSignatureMatchIsMalicious() throws IOException {
        Files.writeString(tempDir.resolve("sample.exe"), "abc");
        Files.writeString(tempDir.resolve("other.exe"), "harmless content of reasonable length ".repeat(40));
        config.getSignatures().put(SHA256_ABC, "Trojan.Test");

        ScanResult result = session(ScanPolicies.custom(config, tempDir)).build().run();

        assertTrue(result.hasMaliciousFiles());
        List<Verdict> malicious = result.getVerdictsByClassification(Classification.MALICIOUS);
        assertEquals(1, malicious.size());
        assertEquals(tempDir.resolve("sample.exe"), malicious.get(0).getPath());
        assertEquals(1, result.getStatistics().getMaliciousCount());
    }

    @Test
    void testCancellationReturnsPartialResult() throws IOException {
        Path tree = tempDir.resolve("tree");
        for (int d = 0; d < 10; d++) {
            Path dir = Files.createDirectories(tree.resolve("dir" + d));
            for (int f = 0; f < 100; f++) {
                Files.writeString(dir.resolve("file" + f + ".exe"), "payload " + d + "/" + f);
            }
        }
        CancellationToken token = new CancellationToken();
        ScanSession session = session(ScanPolicies.custom(config, tree))
            .engineSettings(EngineSettings.builder().workerThreads(2).progressInterval(1).build())
            .cancellation(token)
            .progressListener((files, path) -> {
                if (files >= 100) {
                    token.cancel();
                }
            })
            .build();

        ScanResult result = session.run();

        assertEquals(ScanStatus.CANCELLED, result.getStatus());
        assertTrue(result.isCancelled());
        long scanned = result.getStatistics().getFilesScanned();
        assertTrue(scanned > 0 && scanned < 1000, "Частичный результат: " + scanned);
        assertEquals(scanned, result.getVerdicts().size());
        assertEquals(0, session.getActiveWorkers(), "Ни один воркер не должен остаться");
    }

    @Test
    void testCancelBeforeRun() throws IOException {
        Files.writeString(tempDir.resolve("a.exe"), "a");
        ScanSession session = session(ScanPolicies.custom(config, tempDir)).build();

        session.cancel();
        ScanResult result = session.run();

        assertEquals(ScanStatus.CANCELLED, result.getStatus());
        assertEquals(0, result.getStatistics().getFilesScanned());
    }

    @Test
    void testFinalProgressCall() throws IOException {
        Files.writeString(tempDir.resolve("a.exe"), "a");
        Files.writeString(tempDir.resolve("b.exe"), "b");
        AtomicLong last = new AtomicLong(-1);
        List<Path> finalPaths = new ArrayList<>();

        session(ScanPolicies.custom(config, tempDir))
            .progressListener((files, path) -> {
                if (path == null) {
                    last.set(files);
                    finalPaths.add(null);
                }
            })
            .build()
            .run();

        assertEquals(2, last.get());
        assertEquals(1, finalPaths.size(), "Финальный вызов ровно один");
    }

    @Test
    void testMissingCustomRootFailsBeforeTraversal() {
        Path missing = tempDir.resolve("does-not-exist");
        ScanSession session = session(ScanPolicies.custom(config, missing)).build();

        PathNotFoundException e = assertThrows(PathNotFoundException.class, session::run);
        assertEquals(missing, e.getPath());
    }

    @Test
    void testSessionRunsOnce() throws IOException {
        Files.writeString(tempDir.resolve("a.exe"), "a");
        ScanSession session = session(ScanPolicies.custom(config, tempDir)).build();

        session.run();

        assertThrows(IllegalStateException.class, session::run);
    }

    @Test
    void testCustomPolicyUsesConfiguredLimits() {
        ScanPolicy policy = ScanPolicies.custom(config, tempDir);

        assertEquals(ScanType.CUSTOM, policy.getScanType());
        assertEquals(10, policy.getMaxDepth());
        assertEquals(List.of(tempDir), policy.getRootPaths());
        assertFalse(policy.isLegacyDigest());
        assertTrue(policy.acceptsExtension(".EXE"));
        assertFalse(policy.acceptsExtension(".txt"));
    }
}
