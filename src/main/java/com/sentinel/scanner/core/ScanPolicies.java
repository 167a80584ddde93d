package com.sentinel.scanner.core;

import com.sentinel.scanner.config.ScannerConfig;
import com.sentinel.scanner.models.ScanPolicy;
import com.sentinel.scanner.models.ScanType;
import com.sentinel.scanner.util.PathTemplates;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Построение политик трех видов сканирования из конфигурации.
 *
 * <p>Корни быстрого и глубокого сканирования берутся из шаблонов; несуществующие корни
 * пропускаются с предупреждением. Корень пользовательского сканирования не проверяется здесь,
 * это предусловие сессии.
 */
@Slf4j
public final class ScanPolicies {

    private ScanPolicies() {
    }

    public static ScanPolicy quick(ScannerConfig config) {
        return fromTemplates(ScanType.QUICK, config.getPolicies().getQuick(), config.getTargetExtensions());
    }

    public static ScanPolicy deep(ScannerConfig config) {
        return fromTemplates(ScanType.DEEP, config.getPolicies().getDeep(), config.getTargetExtensions());
    }

    public static ScanPolicy custom(ScannerConfig config, Path root) {
        ScannerConfig.PolicyConfig policy = config.getPolicies().getCustom();
        return base(ScanType.CUSTOM, policy, config.getTargetExtensions())
            .rootPath(root)
            .build();
    }

    private static ScanPolicy fromTemplates(ScanType type,
                                            ScannerConfig.PolicyConfig policy,
                                            List<String> extensions) {
        List<Path> roots = resolveRoots(policy.getRoots());
        if (roots.isEmpty()) {
            log.warn("{}: ни один корень сканирования не найден", type);
        }
        return base(type, policy, extensions)
            .rootPaths(roots)
            .build();
    }

    private static ScanPolicy.ScanPolicyBuilder base(ScanType type,
                                                     ScannerConfig.PolicyConfig policy,
                                                     List<String> extensions) {
        return ScanPolicy.builder()
            .scanType(type)
            .maxDepth(policy.getMaxDepth())
            .maxFileSizeBytes(policy.getMaxFileSizeBytes())
            .followSymlinks(Boolean.TRUE.equals(policy.getFollowSymlinks()))
            .legacyDigest(Boolean.TRUE.equals(policy.getLegacyDigest()))
            .targetExtensions(extensions != null ? extensions : List.of());
    }

    /**
     * Раскрыть шаблоны, убрать дубликаты и несуществующие каталоги
     */
    static List<Path> resolveRoots(List<String> templates) {
        Set<Path> roots = new LinkedHashSet<>();
        if (templates == null) {
            return new ArrayList<>();
        }
        for (String template : templates) {
            Optional<String> resolved = PathTemplates.resolve(template);
            if (resolved.isEmpty()) {
                log.debug("Шаблон корня не раскрыт: {}", template);
                continue;
            }
            Path root;
            try {
                root = Paths.get(resolved.get()).toAbsolutePath().normalize();
            } catch (InvalidPathException e) {
                log.warn("Некорректный путь корня {}: {}", resolved.get(), e.getMessage());
                continue;
            }
            if (!Files.exists(root)) {
                log.warn("Корень сканирования не существует, пропуск: {}", root);
                continue;
            }
            roots.add(root);
        }
        return new ArrayList<>(roots);
    }
}
