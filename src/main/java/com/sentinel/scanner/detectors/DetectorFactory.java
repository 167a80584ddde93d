package com.sentinel.scanner.detectors;

import com.sentinel.scanner.config.ScannerConfig;
import com.sentinel.scanner.models.ThreatCategory;
import com.sentinel.scanner.util.PathTemplates;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.PatternSyntaxException;

/**
 * Сборка набора детекторов из конфигурации.
 * Каждая сессия получает свои экземпляры, общих глобальных детекторов нет.
 */
@Slf4j
public final class DetectorFactory {

    private DetectorFactory() {
    }

    /**
     * Стандартный набор: сигнатуры, эвристики, поведение, AI-модель
     */
    public static List<ThreatDetector> createDefault(ScannerConfig config,
                                                     SignatureStore signatureStore,
                                                     BehaviorIndicatorSource indicatorSource) {
        List<ThreatDetector> detectors = new ArrayList<>();
        detectors.add(new SignatureDetector(signatureStore));
        detectors.add(createHeuristic(config.getHeuristics()));
        detectors.add(createBehavioral(config.getBehaviorPatterns(), indicatorSource));
        detectors.add(createAiModel(config.getAiModel()));
        log.info("Инициализировано {} детекторов", detectors.size());
        return detectors;
    }

    public static SignatureStore createSignatureStore(ScannerConfig config) {
        return SignatureStore.of(config.getSignatures());
    }

    public static HeuristicDetector createHeuristic(ScannerConfig.Heuristics heuristics) {
        List<HeuristicRule> rules = new ArrayList<>();
        for (ScannerConfig.RuleConfig rule : heuristics.getRules()) {
            if (rule == null || rule.getPattern() == null || rule.getPattern().isBlank()) {
                continue;
            }
            try {
                rules.add(HeuristicRule.of(
                    rule.getName(),
                    rule.getPattern(),
                    rule.getSeverity() != null ? rule.getSeverity() : 1,
                    parseCategory(rule.getCategory())));
            } catch (PatternSyntaxException e) {
                log.warn("Некорректный паттерн правила {}: {}", rule.getName(), e.getDescription());
            }
        }

        HeuristicDetector.AttributeRules.AttributeRulesBuilder attributes = HeuristicDetector.AttributeRules.builder()
            .smallExecutableBytes(heuristics.getSmallExecutableBytes())
            .hiddenFileSeverity(heuristics.getHiddenFileSeverity())
            .worldWritableSeverity(heuristics.getWorldWritableSeverity())
            .smallExecutableSeverity(heuristics.getSmallExecutableSeverity())
            .suspiciousLocationSeverity(heuristics.getSuspiciousLocationSeverity());
        for (String ext : heuristics.getExecutableExtensions()) {
            attributes.executableExtension(normalizeExtension(ext));
        }
        for (String template : heuristics.getSuspiciousLocations()) {
            PathTemplates.resolve(template).ifPresent(attributes::suspiciousLocation);
        }
        return new HeuristicDetector(rules, attributes.build());
    }

    public static BehavioralDetector createBehavioral(List<ScannerConfig.BehaviorPatternConfig> patterns,
                                                      BehaviorIndicatorSource indicatorSource) {
        List<BehaviorPattern> catalog = new ArrayList<>();
        if (patterns != null) {
            for (ScannerConfig.BehaviorPatternConfig pattern : patterns) {
                if (pattern == null || pattern.getName() == null) {
                    continue;
                }
                catalog.add(BehaviorPattern.builder()
                    .name(pattern.getName())
                    .category(parseCategory(pattern.getCategory()))
                    .indicators(pattern.getIndicators() != null ? pattern.getIndicators() : List.of())
                    .severity(pattern.getSeverity() != null ? pattern.getSeverity() : 5)
                    .description(pattern.getDescription() != null ? pattern.getDescription() : "")
                    .build());
            }
        }
        return new BehavioralDetector(catalog, indicatorSource);
    }

    public static AiModelDetector createAiModel(ScannerConfig.AiModel model) {
        AiModelDetector.Settings.SettingsBuilder settings = AiModelDetector.Settings.builder()
            .highEntropyThreshold(model.getHighEntropyThreshold())
            .entropyWeight(model.getEntropyWeight())
            .smallExecutableWeight(model.getSmallExecutableWeight())
            .filenameWeight(model.getFilenameWeight())
            .maliciousThreshold(model.getMaliciousThreshold())
            .suspiciousThreshold(model.getSuspiciousThreshold())
            .smallExecutableBytes(model.getSmallExecutableBytes());
        for (String ext : model.getExecutableExtensions()) {
            settings.executableExtension(normalizeExtension(ext));
        }
        for (String token : model.getSuspiciousNameTokens()) {
            if (token != null && !token.isBlank()) {
                settings.suspiciousNameToken(token.trim().toLowerCase(Locale.ROOT));
            }
        }
        return new AiModelDetector(settings.build());
    }

    static ThreatCategory parseCategory(String value) {
        if (value == null || value.isBlank()) {
            return ThreatCategory.UNCLASSIFIED;
        }
        try {
            return ThreatCategory.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ThreatCategory.fromThreatName(value);
        }
    }

    private static String normalizeExtension(String ext) {
        if (ext == null) {
            return "";
        }
        String lower = ext.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith(".") ? lower : "." + lower;
    }
}
