package com.sentinel.scanner.detectors;

import com.sentinel.scanner.models.DetectionMethod;
import com.sentinel.scanner.models.Evidence;
import com.sentinel.scanner.models.Finding;
import com.sentinel.scanner.models.ScanPolicy;
import com.sentinel.scanner.models.ThreatCategory;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Эвристическая замена ML-модели.
 *
 * <p>Считает уверенность 0..1 по признакам файла: высокая энтропия, маленький исполняемый файл,
 * подозрительные токены в имени. При {@code score >= maliciousThreshold} дает находку severity 10,
 * при {@code score >= suspiciousThreshold} - severity 5, иначе ничего.
 * Реальную модель можно подставить через тот же {@link ThreatDetector}, агрегатор об этом не знает.
 */
@Slf4j
public class AiModelDetector implements ThreatDetector {

    public static final int MALICIOUS_SEVERITY = 10;
    public static final int SUSPICIOUS_SEVERITY = 5;

    private final Settings settings;

    public AiModelDetector(Settings settings) {
        this.settings = settings != null ? settings : Settings.builder().build();
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.AI_MODEL;
    }

    @Override
    public List<Finding> evaluate(Evidence evidence, ScanPolicy policy) {
        if (evidence == null) {
            return List.of();
        }
        ModelScore score = score(evidence);

        int severity;
        String label;
        if (score.getScore() >= settings.getMaliciousThreshold()) {
            severity = MALICIOUS_SEVERITY;
            label = "malicious";
        } else if (score.getScore() >= settings.getSuspiciousThreshold()) {
            severity = SUSPICIOUS_SEVERITY;
            label = "suspicious";
        } else {
            return List.of();
        }

        log.debug("AI-модель: {} score={} ({})", evidence.getPath(), score.getScore(), label);
        return List.of(Finding.builder()
            .detectorKind(DetectionMethod.AI_MODEL)
            .category(score.getCategory())
            .severity(severity)
            .rationale(String.format(Locale.ROOT, "AI model %s (%.2f): %s",
                label, score.getScore(), String.join(", ", score.getReasons())))
            .build());
    }

    /**
     * Уверенность модели по признакам файла
     */
    public ModelScore score(Evidence evidence) {
        double score = 0.0;
        List<String> reasons = new ArrayList<>();
        ThreatCategory category = ThreatCategory.UNCLASSIFIED;

        if (evidence.getEntropy() > settings.getHighEntropyThreshold()) {
            score += settings.getEntropyWeight();
            reasons.add("High entropy (possible packing)");
        }

        if (settings.getExecutableExtensions().contains(evidence.getExtension())
                && evidence.getSizeBytes() < settings.getSmallExecutableBytes()) {
            score += settings.getSmallExecutableWeight();
            reasons.add("Unusually small executable");
        }

        String fileName = evidence.getFileName() != null
            ? evidence.getFileName().toLowerCase(Locale.ROOT) : "";
        for (String token : settings.getSuspiciousNameTokens()) {
            if (!token.isEmpty() && fileName.contains(token.toLowerCase(Locale.ROOT))) {
                score += settings.getFilenameWeight();
                reasons.add("Suspicious filename pattern: " + token);
                category = ThreatCategory.fromThreatName(token);
                break;
            }
        }

        return new ModelScore(clamp01(score), reasons, category);
    }

    private static double clamp01(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    @Value
    public static class ModelScore {
        double score;
        List<String> reasons;
        ThreatCategory category;
    }

    @Value
    @Builder
    public static class Settings {
        @Builder.Default
        double highEntropyThreshold = 7.0;
        @Builder.Default
        double entropyWeight = 0.3;
        @Builder.Default
        double smallExecutableWeight = 0.4;
        @Builder.Default
        double filenameWeight = 0.5;
        @Builder.Default
        double maliciousThreshold = 0.75;
        @Builder.Default
        double suspiciousThreshold = 0.4;
        @Builder.Default
        long smallExecutableBytes = 1024L;
        @Singular
        Set<String> executableExtensions;
        @Singular
        List<String> suspiciousNameTokens;
    }
}
