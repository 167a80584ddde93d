package com.sentinel.scanner.util;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Подстановка плейсхолдеров в шаблоны путей из конфигурации:
 * ${user.home}, ${java.io.tmpdir}, ${env:NAME}, ${env:NAME:-default}.
 * Шаблон со ссылкой на неустановленную переменную без значения по умолчанию не раскрывается.
 */
public final class PathTemplates {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");

    private PathTemplates() {
    }

    public static Optional<String> resolve(String template) {
        return resolve(template, System.getenv());
    }

    public static Optional<String> resolve(String template, Map<String, String> environment) {
        if (template == null || template.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = lookup(matcher.group(1), environment);
            if (value == null || value.isEmpty()) {
                return Optional.empty();
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return Optional.of(out.toString());
    }

    private static String lookup(String expression, Map<String, String> environment) {
        if (expression.startsWith("env:")) {
            String body = expression.substring(4);
            String defaultValue = null;
            int separator = body.indexOf(":-");
            if (separator >= 0) {
                defaultValue = body.substring(separator + 2);
                body = body.substring(0, separator);
            }
            String value = environment != null ? environment.get(body) : null;
            return value != null && !value.isEmpty() ? value : defaultValue;
        }
        return System.getProperty(expression);
    }
}
