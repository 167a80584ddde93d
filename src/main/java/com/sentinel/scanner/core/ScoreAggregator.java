package com.sentinel.scanner.core;

import com.sentinel.scanner.detectors.SignatureDetector;
import com.sentinel.scanner.models.Classification;
import com.sentinel.scanner.models.Evidence;
import com.sentinel.scanner.models.Finding;
import com.sentinel.scanner.models.Verdict;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Сведение находок всех детекторов в один вердикт.
 *
 * <p>riskScore = min(100, Σ severity * 10). Точное совпадение сигнатуры
 * (severity 10 от сигнатурного детектора) делает файл вредоносным независимо от остального.
 * Иначе: >= 70 - malicious, 40..69 - suspicious, ниже - clean (с замечаниями, если находки есть).
 * Результат зависит только от мультимножества находок, но не от их порядка.
 */
public class ScoreAggregator {

    public static final int MAX_SCORE = 100;
    public static final int SEVERITY_MULTIPLIER = 10;
    public static final int MALICIOUS_THRESHOLD = 70;
    public static final int SUSPICIOUS_THRESHOLD = 40;

    private static final Comparator<Finding> FINDING_ORDER = Comparator
        .comparing(Finding::getDetectorKind, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(Finding::getSeverity, Comparator.reverseOrder())
        .thenComparing(Finding::getCategory, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(Finding::getRationale, Comparator.nullsLast(Comparator.naturalOrder()));

    public Verdict aggregate(Collection<Finding> findings) {
        return aggregate(findings, null);
    }

    /**
     * Вердикт по находкам файла; дайджесты копируются из признаков, если они переданы
     */
    public Verdict aggregate(Collection<Finding> findings, Evidence evidence) {
        List<Finding> ordered = new ArrayList<>();
        if (findings != null) {
            for (Finding finding : findings) {
                if (finding != null) {
                    ordered.add(finding);
                }
            }
        }
        ordered.sort(FINDING_ORDER);

        int score = riskScore(ordered);
        Classification classification = classify(score, ordered);

        Verdict.VerdictBuilder builder = Verdict.builder()
            .riskScore(score)
            .classification(classification)
            .findings(List.copyOf(ordered));
        if (evidence != null) {
            builder.path(evidence.getPath())
                .sha256(evidence.getSha256())
                .md5(evidence.getMd5())
                .sizeBytes(evidence.getSizeBytes());
        }
        return builder.build();
    }

    static int riskScore(Collection<Finding> findings) {
        long total = 0;
        for (Finding finding : findings) {
            total += (long) Math.max(0, finding.getSeverity()) * SEVERITY_MULTIPLIER;
            if (total >= MAX_SCORE) {
                return MAX_SCORE;
            }
        }
        return (int) total;
    }

    static Classification classify(int riskScore, Collection<Finding> findings) {
        for (Finding finding : findings) {
            if (SignatureDetector.isExactMatch(finding)) {
                return Classification.MALICIOUS;
            }
        }
        if (riskScore >= MALICIOUS_THRESHOLD) {
            return Classification.MALICIOUS;
        }
        if (riskScore >= SUSPICIOUS_THRESHOLD) {
            return Classification.SUSPICIOUS;
        }
        return Classification.CLEAN;
    }
}
