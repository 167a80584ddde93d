package com.sentinel.scanner.detectors;

import com.sentinel.scanner.models.DetectionMethod;
import com.sentinel.scanner.models.Evidence;
import com.sentinel.scanner.models.Finding;
import com.sentinel.scanner.models.ScanPolicy;
import com.sentinel.scanner.models.ThreatCategory;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Точное совпадение дайджеста с базой сигнатур.
 * Не более одной находки, severity всегда 10.
 */
@Slf4j
public class SignatureDetector implements ThreatDetector {

    public static final int MATCH_SEVERITY = Finding.MAX_SEVERITY;

    private final SignatureStore store;

    public SignatureDetector(SignatureStore store) {
        this.store = store != null ? store : SignatureStore.empty();
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.SIGNATURE;
    }

    @Override
    public List<Finding> evaluate(Evidence evidence, ScanPolicy policy) {
        if (evidence == null || store.size() == 0) {
            return List.of();
        }

        Optional<String> threat = store.lookup(evidence.getSha256());
        String digestKind = "sha256";
        if (threat.isEmpty() && evidence.hasMd5() && (policy == null || policy.isLegacyDigest())) {
            threat = store.lookup(evidence.getMd5());
            digestKind = "md5";
        }
        if (threat.isEmpty()) {
            return List.of();
        }

        String threatName = threat.get();
        log.warn("Совпадение сигнатуры {} ({}): {}", threatName, digestKind, evidence.getPath());
        return List.of(Finding.builder()
            .detectorKind(DetectionMethod.SIGNATURE)
            .category(ThreatCategory.fromThreatName(threatName))
            .severity(MATCH_SEVERITY)
            .rationale("Known malware signature: " + threatName + " (" + digestKind + ")")
            .build());
    }

    /**
     * Находка этого детектора, означающая точное совпадение с известной угрозой
     */
    public static boolean isExactMatch(Finding finding) {
        return finding != null
            && finding.getDetectorKind() == DetectionMethod.SIGNATURE
            && finding.getSeverity() >= MATCH_SEVERITY;
    }
}
