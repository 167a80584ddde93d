package com.sentinel.scanner.detectors;

import com.sentinel.scanner.models.Finding;
import com.sentinel.scanner.models.ThreatCategory;
import lombok.Value;

import java.util.regex.Pattern;

/**
 * Правило поиска по содержимому: паттерн и его вес
 */
@Value
public class HeuristicRule {
    String name;
    Pattern pattern;
    int severity;
    ThreatCategory category;

    public static HeuristicRule of(String name, String regex, int severity, ThreatCategory category) {
        return new HeuristicRule(
            name != null ? name : regex,
            Pattern.compile(regex, Pattern.CASE_INSENSITIVE),
            Finding.clampSeverity(severity),
            category != null ? category : ThreatCategory.UNCLASSIFIED);
    }

    public boolean matches(CharSequence content) {
        return pattern.matcher(content).find();
    }
}
