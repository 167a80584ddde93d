package com.sentinel.scanner.models;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ScanPolicyTest {

    @Test
    void testDefaults() {
        ScanPolicy policy = ScanPolicy.builder().rootPath(Path.of("/scan")).build();

        assertEquals(ScanType.CUSTOM, policy.getScanType());
        assertEquals(ScanPolicy.DEFAULT_MAX_FILE_SIZE, policy.getMaxFileSizeBytes());
        assertFalse(policy.isFollowSymlinks(), "Ссылки по умолчанию не обходятся");
        assertFalse(policy.isLegacyDigest());
        assertTrue(policy.acceptsAllExtensions());
        assertTrue(policy.acceptsExtension(""));
    }

    @Test
    void testExtensionAllowList() {
        ScanPolicy policy = ScanPolicy.builder()
            .targetExtension(".exe")
            .targetExtension(".ps1")
            .build();

        assertTrue(policy.acceptsExtension(".EXE"));
        assertTrue(policy.acceptsExtension(".ps1"));
        assertFalse(policy.acceptsExtension(".txt"));
        assertFalse(policy.acceptsExtension(""));
        assertFalse(policy.acceptsExtension(null));
    }

    @Test
    void testVerdictHelpers() {
        Verdict clean = Verdict.builder().classification(Classification.CLEAN).build();
        Verdict noted = Verdict.builder()
            .classification(Classification.CLEAN)
            .findings(java.util.List.of(Finding.builder()
                .detectorKind(DetectionMethod.HEURISTIC).severity(1).rationale("Hidden file").build()))
            .build();

        assertFalse(clean.hasNotes());
        assertFalse(clean.isThreat());
        assertTrue(noted.hasNotes());
        assertEquals("Hidden file", noted.describeReasons());
    }
}
