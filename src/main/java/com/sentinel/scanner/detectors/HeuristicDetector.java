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

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Эвристический анализ: паттерны в префиксе содержимого и атрибуты файла.
 *
 * <p>Каждое сработавшее правило дает отдельную находку со своим весом,
 * суммарный вес здесь не ограничивается (это делает агрегатор).
 * Атрибуты (скрытый файл, запись для всех, подозрительно маленький исполняемый файл,
 * подозрительное расположение) оцениваются независимо и дают находки низкой критичности.
 */
@Slf4j
public class HeuristicDetector implements ThreatDetector {

    private final List<HeuristicRule> rules;
    private final AttributeRules attributeRules;

    public HeuristicDetector(List<HeuristicRule> rules, AttributeRules attributeRules) {
        this.rules = rules != null ? List.copyOf(rules) : List.of();
        this.attributeRules = attributeRules != null ? attributeRules : AttributeRules.builder().build();
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.HEURISTIC;
    }

    public List<HeuristicRule> getRules() {
        return rules;
    }

    @Override
    public List<Finding> evaluate(Evidence evidence, ScanPolicy policy) {
        List<Finding> findings = new ArrayList<>();
        if (evidence == null) {
            return findings;
        }
        findings.addAll(evaluateContent(evidence));
        findings.addAll(evaluateAttributes(evidence));
        return findings;
    }

    List<Finding> evaluateContent(Evidence evidence) {
        List<Finding> findings = new ArrayList<>();
        byte[] sample = evidence.getContentSample();
        if (sample == null || sample.length == 0 || rules.isEmpty()) {
            return findings;
        }

        String content = decodePermissive(sample);
        for (HeuristicRule rule : rules) {
            boolean matched;
            try {
                matched = rule.matches(content);
            } catch (RuntimeException | StackOverflowError e) {
                // одно правило не должно ронять остальные
                log.warn("Правило {} не выполнено для {}: {}", rule.getName(), evidence.getPath(), e.toString());
                continue;
            }
            if (matched) {
                findings.add(Finding.builder()
                    .detectorKind(DetectionMethod.HEURISTIC)
                    .category(rule.getCategory())
                    .severity(rule.getSeverity())
                    .rationale("Suspicious pattern: " + rule.getName())
                    .build());
            }
        }
        return findings;
    }

    List<Finding> evaluateAttributes(Evidence evidence) {
        List<Finding> findings = new ArrayList<>();

        if (evidence.isHidden()) {
            findings.add(attributeFinding(attributeRules.getHiddenFileSeverity(), "Hidden file"));
        }
        if (evidence.isWorldWritable()) {
            findings.add(attributeFinding(attributeRules.getWorldWritableSeverity(), "World-writable permissions"));
        }
        if (attributeRules.getExecutableExtensions().contains(evidence.getExtension())
                && evidence.getSizeBytes() < attributeRules.getSmallExecutableBytes()) {
            findings.add(attributeFinding(attributeRules.getSmallExecutableSeverity(),
                "Unusually small executable (" + evidence.getSizeBytes() + " bytes)"));
        }
        String location = matchSuspiciousLocation(evidence.getPath());
        if (location != null) {
            findings.add(attributeFinding(attributeRules.getSuspiciousLocationSeverity(),
                "Suspicious location: " + location));
        }
        return findings;
    }

    private String matchSuspiciousLocation(Path path) {
        if (path == null || attributeRules.getSuspiciousLocations().isEmpty()) {
            return null;
        }
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent == null) {
            return null;
        }
        for (String location : attributeRules.getSuspiciousLocations()) {
            if (location == null || location.isBlank()) {
                continue;
            }
            // сравнение по компонентам: /tmp не покрывает /tmpdata
            Path base;
            try {
                base = Paths.get(location).toAbsolutePath().normalize();
            } catch (InvalidPathException e) {
                log.debug("Некорректное подозрительное место {}: {}", location, e.getMessage());
                continue;
            }
            if (parent.startsWith(base)) {
                return location;
            }
        }
        return null;
    }

    private static Finding attributeFinding(int severity, String rationale) {
        return Finding.builder()
            .detectorKind(DetectionMethod.HEURISTIC)
            .category(ThreatCategory.UNCLASSIFIED)
            .severity(Finding.clampSeverity(severity))
            .rationale(rationale)
            .build();
    }

    /**
     * UTF-8 с пропуском некорректных последовательностей
     */
    static String decodePermissive(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.IGNORE)
            .onUnmappableCharacter(CodingErrorAction.IGNORE);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            // при IGNORE недостижимо
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }

    /**
     * Пороги и веса проверок атрибутов файла
     */
    @Value
    @Builder
    public static class AttributeRules {
        @Singular
        Set<String> executableExtensions;
        @Builder.Default
        long smallExecutableBytes = 1024L;
        @Singular
        List<String> suspiciousLocations;
        @Builder.Default
        int hiddenFileSeverity = 1;
        @Builder.Default
        int worldWritableSeverity = 2;
        @Builder.Default
        int smallExecutableSeverity = 2;
        @Builder.Default
        int suspiciousLocationSeverity = 1;
    }
}
