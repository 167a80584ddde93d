package com.sentinel.scanner.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Конфигурация сканера из YAML файла.
 * Профили, сигнатуры, правила эвристик и пороги AI-модели живут здесь, а не в коде детекторов.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScannerConfig {

    public static final String DEFAULT_RESOURCE = "scanner-config.yaml";

    private Engine engine;
    private Policies policies;
    private List<String> targetExtensions;
    private Map<String, String> signatures;
    private Heuristics heuristics;
    private List<BehaviorPatternConfig> behaviorPatterns;
    private AiModel aiModel;

    private static ScannerConfig instance;

    /**
     * Загрузить конфигурацию из classpath (кэшируется после первого чтения)
     */
    public static synchronized ScannerConfig load() {
        if (instance == null) {
            try (InputStream is = ScannerConfig.class.getClassLoader()
                    .getResourceAsStream(DEFAULT_RESOURCE)) {
                if (is == null) {
                    throw new IllegalStateException(DEFAULT_RESOURCE + " не найден в classpath");
                }
                instance = load(is);
            } catch (IOException e) {
                throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
            }
        }
        return instance;
    }

    /**
     * Разобрать конфигурацию из произвольного потока (без кэширования)
     */
    public static ScannerConfig load(InputStream is) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        ScannerConfig config = mapper.readValue(is, ScannerConfig.class);
        config.ensureDefaults();
        return config;
    }

    void ensureDefaults() {
        if (engine == null) {
            engine = new Engine();
        }
        engine.ensureDefaults();
        if (policies == null) {
            policies = new Policies();
        }
        policies.ensureDefaults();
        if (targetExtensions == null) {
            targetExtensions = new ArrayList<>();
        }
        List<String> normalized = new ArrayList<>();
        for (String ext : targetExtensions) {
            if (ext == null || ext.isBlank()) {
                continue;
            }
            String lower = ext.trim().toLowerCase(Locale.ROOT);
            normalized.add(lower.startsWith(".") ? lower : "." + lower);
        }
        targetExtensions = normalized;
        if (signatures == null) {
            signatures = new LinkedHashMap<>();
        }
        if (heuristics == null) {
            heuristics = new Heuristics();
        }
        heuristics.ensureDefaults();
        if (behaviorPatterns == null) {
            behaviorPatterns = new ArrayList<>();
        }
        if (aiModel == null) {
            aiModel = new AiModel();
        }
        aiModel.ensureDefaults();
    }

    @Data
    public static class Engine {
        private static final int DEFAULT_QUEUE_CAPACITY = 256;
        private static final long DEFAULT_OPERATION_TIMEOUT_MS = 30_000L;
        private static final int DEFAULT_PROGRESS_INTERVAL = 100;
        private static final int DEFAULT_CONTENT_SAMPLE_BYTES = 256 * 1024;
        private static final int DEFAULT_READ_CHUNK_BYTES = 4096;

        private Integer workerThreads;
        private Integer queueCapacity;
        private Long operationTimeoutMs;
        private Integer progressInterval;
        private Integer contentSampleBytes;
        private Integer readChunkBytes;

        public void ensureDefaults() {
            if (workerThreads == null || workerThreads <= 0) {
                workerThreads = Runtime.getRuntime().availableProcessors();
            }
            if (queueCapacity == null || queueCapacity <= 0) {
                queueCapacity = DEFAULT_QUEUE_CAPACITY;
            }
            if (operationTimeoutMs == null || operationTimeoutMs <= 0) {
                operationTimeoutMs = DEFAULT_OPERATION_TIMEOUT_MS;
            }
            if (progressInterval == null || progressInterval <= 0) {
                progressInterval = DEFAULT_PROGRESS_INTERVAL;
            }
            if (contentSampleBytes == null || contentSampleBytes < 0) {
                contentSampleBytes = DEFAULT_CONTENT_SAMPLE_BYTES;
            }
            if (readChunkBytes == null || readChunkBytes <= 0) {
                readChunkBytes = DEFAULT_READ_CHUNK_BYTES;
            }
        }
    }

    @Data
    public static class Policies {
        private PolicyConfig quick;
        private PolicyConfig deep;
        private PolicyConfig custom;

        void ensureDefaults() {
            if (quick == null) {
                quick = new PolicyConfig();
            }
            quick.ensureDefaults(2, false);
            if (deep == null) {
                deep = new PolicyConfig();
            }
            deep.ensureDefaults(5, true);
            if (custom == null) {
                custom = new PolicyConfig();
            }
            custom.ensureDefaults(10, false);
        }
    }

    @Data
    public static class PolicyConfig {
        private static final long DEFAULT_MAX_FILE_SIZE = 100L * 1024 * 1024;

        /** Шаблоны путей: ${user.home}, ${java.io.tmpdir}, ${env:NAME}, ${env:NAME:-default} */
        private List<String> roots;
        private Integer maxDepth;
        private Long maxFileSizeBytes;
        private Boolean followSymlinks;
        private Boolean legacyDigest;

        void ensureDefaults(int defaultDepth, boolean defaultLegacyDigest) {
            if (roots == null) {
                roots = new ArrayList<>();
            }
            if (maxDepth == null || maxDepth < 0) {
                maxDepth = defaultDepth;
            }
            if (maxFileSizeBytes == null || maxFileSizeBytes <= 0) {
                maxFileSizeBytes = DEFAULT_MAX_FILE_SIZE;
            }
            if (followSymlinks == null) {
                followSymlinks = Boolean.FALSE;
            }
            if (legacyDigest == null) {
                legacyDigest = defaultLegacyDigest;
            }
        }
    }

    @Data
    public static class Heuristics {
        private static final long DEFAULT_SMALL_EXECUTABLE_BYTES = 1024L;

        private List<RuleConfig> rules;
        private List<String> executableExtensions;
        private Long smallExecutableBytes;
        private List<String> suspiciousLocations;
        private Integer hiddenFileSeverity;
        private Integer worldWritableSeverity;
        private Integer smallExecutableSeverity;
        private Integer suspiciousLocationSeverity;

        void ensureDefaults() {
            if (rules == null) {
                rules = new ArrayList<>();
            }
            if (executableExtensions == null || executableExtensions.isEmpty()) {
                executableExtensions = new ArrayList<>(List.of(".exe", ".dll"));
            }
            if (smallExecutableBytes == null || smallExecutableBytes <= 0) {
                smallExecutableBytes = DEFAULT_SMALL_EXECUTABLE_BYTES;
            }
            if (suspiciousLocations == null) {
                suspiciousLocations = new ArrayList<>();
            }
            if (hiddenFileSeverity == null) {
                hiddenFileSeverity = 1;
            }
            if (worldWritableSeverity == null) {
                worldWritableSeverity = 2;
            }
            if (smallExecutableSeverity == null) {
                smallExecutableSeverity = 2;
            }
            if (suspiciousLocationSeverity == null) {
                suspiciousLocationSeverity = 1;
            }
        }
    }

    @Data
    public static class RuleConfig {
        private String name;
        private String pattern;
        private Integer severity;
        private String category;
    }

    @Data
    public static class BehaviorPatternConfig {
        private String name;
        private String category;
        private List<String> indicators;
        private Integer severity;
        private String description;
    }

    @Data
    public static class AiModel {
        private Double highEntropyThreshold;
        private Double entropyWeight;
        private Double smallExecutableWeight;
        private Double filenameWeight;
        private Double maliciousThreshold;
        private Double suspiciousThreshold;
        private Long smallExecutableBytes;
        private List<String> executableExtensions;
        private List<String> suspiciousNameTokens;

        void ensureDefaults() {
            if (highEntropyThreshold == null) {
                highEntropyThreshold = 7.0;
            }
            if (entropyWeight == null) {
                entropyWeight = 0.3;
            }
            if (smallExecutableWeight == null) {
                smallExecutableWeight = 0.4;
            }
            if (filenameWeight == null) {
                filenameWeight = 0.5;
            }
            if (maliciousThreshold == null) {
                maliciousThreshold = 0.75;
            }
            if (suspiciousThreshold == null) {
                suspiciousThreshold = 0.4;
            }
            if (smallExecutableBytes == null || smallExecutableBytes <= 0) {
                smallExecutableBytes = 1024L;
            }
            if (executableExtensions == null || executableExtensions.isEmpty()) {
                executableExtensions = new ArrayList<>(List.of(".exe"));
            }
            if (suspiciousNameTokens == null) {
                suspiciousNameTokens = new ArrayList<>();
            }
        }
    }
}
