package com.sentinel.scanner.cli;

import com.sentinel.scanner.config.ScannerConfig;
import com.sentinel.scanner.core.EngineSettings;
import com.sentinel.scanner.core.PathNotFoundException;
import com.sentinel.scanner.core.SentinelScanner;
import com.sentinel.scanner.detectors.BehaviorIndicatorSource;
import com.sentinel.scanner.models.Classification;
import com.sentinel.scanner.models.ScanResult;
import com.sentinel.scanner.models.ScanStatistics;
import com.sentinel.scanner.models.ScanType;
import com.sentinel.scanner.models.SkipReason;
import com.sentinel.scanner.models.Verdict;
import com.sentinel.scanner.reports.JsonReportGenerator;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Главная CLI команда сканера
 */
@Slf4j
@Command(
    name = "sentinel-scanner",
    mixinStandardHelpOptions = true,
    version = "Sentinel Scanner 1.0.0",
    description = """

        Sentinel Scanner

        Сканирование файловой системы на вредоносные файлы

        Режимы:
          • quick  - системные и пользовательские каталоги, глубина 2
          • deep   - расширенный набор каталогов, глубина 5, MD5 сигнатуры
          • custom - один каталог, глубина 10

        """
)
public class MainCommand implements Callable<Integer> {

    public static final int EXIT_CLEAN = 0;
    public static final int EXIT_THREATS = 1;
    public static final int EXIT_PATH_NOT_FOUND = 2;
    /** Ошибка аргументов; picocli печатает usage и возвращает этот код */
    public static final int EXIT_USAGE = CommandLine.ExitCode.USAGE;

    private static final long SHUTDOWN_WAIT_SECONDS = 10L;

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Режим сканирования: ${COMPLETION-CANDIDATES}"
    )
    private ScanType mode;

    @Parameters(
        index = "1",
        arity = "0..1",
        description = "Каталог для режима custom"
    )
    private Path target;

    @Option(
        names = {"-o", "--output"},
        description = "Директория для сохранения отчета (по умолчанию: ./reports)"
    )
    private String outputDir = "./reports";

    @Option(
        names = {"-t", "--threads"},
        description = "Число воркеров (по умолчанию из конфигурации)"
    )
    private Integer threads;

    @Option(
        names = {"-c", "--config"},
        description = "Путь к YAML конфигурации (по умолчанию встроенная)"
    )
    private Path configPath;

    @Option(
        names = {"--no-report"},
        description = "Не сохранять JSON отчет"
    )
    private boolean noReport = false;

    @Option(
        names = {"--ci"},
        description = "Режим CI/CD (краткий вывод + exit codes)"
    )
    private boolean ciMode = false;

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    @Override
    public Integer call() {
        if (mode == ScanType.CUSTOM && target == null) {
            throw new ParameterException(spec.commandLine(), "Для режима custom нужно указать каталог");
        }

        printBanner();

        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = null;
        try {
            ScannerConfig config = loadConfig();
            EngineSettings settings = EngineSettings.from(config.getEngine());
            if (threads != null && threads > 0) {
                settings = settings.toBuilder().workerThreads(threads).build();
            }
            SentinelScanner scanner = new SentinelScanner(config, BehaviorIndicatorSource.none(), settings);

            shutdownHook = new Thread(() -> {
                if (scanner.cancel()) {
                    awaitQuietly(finished);
                }
            }, "sentinel-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);

            ScanResult result = runScan(scanner);

            if (!noReport) {
                Path outputPath = Paths.get(outputDir);
                JsonReportGenerator jsonGen = new JsonReportGenerator();
                jsonGen.generate(result, outputPath.resolve(JsonReportGenerator.DEFAULT_FILE_NAME));
            }

            if (ciMode) {
                printCISummary(result);
            } else {
                printDetailedResults(result);
            }

            if (result.hasMaliciousFiles()) {
                log.error("Обнаружены вредоносные файлы: {}", result.getStatistics().getMaliciousCount());
                return EXIT_THREATS;
            }
            log.info("Сканирование завершено, вредоносных файлов нет");
            return EXIT_CLEAN;

        } catch (PathNotFoundException e) {
            log.error("Путь не найден: {}", e.getPath());
            return EXIT_PATH_NOT_FOUND;
        } catch (Exception e) {
            log.error("Ошибка при сканировании: {}", e.getMessage(), e);
            return EXIT_THREATS;
        } finally {
            finished.countDown();
            removeHook(shutdownHook);
        }
    }

    private ScanResult runScan(SentinelScanner scanner) {
        switch (mode) {
            case QUICK:
                return scanner.runQuickScan();
            case DEEP:
                return scanner.runDeepScan();
            case CUSTOM:
            default:
                return scanner.runCustomScan(target);
        }
    }

    private ScannerConfig loadConfig() throws IOException {
        if (configPath == null) {
            return ScannerConfig.load();
        }
        log.info("Загрузка конфигурации: {}", configPath);
        try (InputStream in = Files.newInputStream(configPath)) {
            return ScannerConfig.load(in);
        }
    }

    private static void awaitQuietly(CountDownLatch finished) {
        try {
            if (!finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Сканирование не успело завершиться за {} с", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeHook(Thread hook) {
        if (hook == null) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM уже завершается, хук остается: {}", e.getMessage());
        }
    }

    /**
     * Краткая сводка для CI/CD
     */
    private void printCISummary(ScanResult result) {
        ScanStatistics stats = result.getStatistics();
        System.out.println("\n=== Sentinel Scan Summary ===");
        System.out.println("Mode:       " + result.getScanType());
        System.out.println("Status:     " + result.getStatus());
        System.out.println("Scanned:    " + stats.getFilesScanned());
        System.out.println("Malicious:  " + stats.getMaliciousCount());
        System.out.println("Suspicious: " + stats.getSuspiciousCount());
        System.out.println("Errors:     " + stats.getErrorCount());
        System.out.println("Skipped:    " + stats.getSkippedCount());
        System.out.println("Duration:   " + stats.getFormattedDuration());
        System.out.println("=============================\n");
    }

    /**
     * Вывести детальные результаты
     */
    private void printDetailedResults(ScanResult result) {
        ScanStatistics stats = result.getStatistics();
        System.out.println("\n" + "=".repeat(80));
        System.out.println("SENTINEL SCAN REPORT");
        System.out.println("=".repeat(80));
        System.out.println();
        System.out.println("Режим: " + result.getScanType());
        System.out.println("Статус: " + result.getStatus());
        System.out.println("Время сканирования: " + stats.getFormattedDuration());
        System.out.println();

        System.out.println("СТАТИСТИКА:");
        System.out.println("   Проверено файлов: " + stats.getFilesScanned());
        System.out.println("   Вредоносных:      " + stats.getMaliciousCount());
        System.out.println("   Подозрительных:   " + stats.getSuspiciousCount());
        System.out.println("   Ошибок:           " + stats.getErrorCount());
        System.out.println("   Пропущено:        " + stats.getSkippedCount());
        for (SkipReason reason : SkipReason.values()) {
            long count = stats.getSkipped(reason);
            if (count > 0) {
                System.out.printf("      %-16s %d%n", reason.getCode(), count);
            }
        }
        if (stats.getDetectorErrorCount() > 0) {
            System.out.println("   Сбоев детекторов: " + stats.getDetectorErrorCount());
        }
        System.out.println();

        printThreats("ВРЕДОНОСНЫЕ ФАЙЛЫ:", result.getVerdictsByClassification(Classification.MALICIOUS));
        printThreats("ПОДОЗРИТЕЛЬНЫЕ ФАЙЛЫ:", result.getVerdictsByClassification(Classification.SUSPICIOUS));

        if (!noReport) {
            System.out.println("Отчет сохранен в: " + outputDir);
        }
        System.out.println("=".repeat(80));
        System.out.println();
    }

    private static void printThreats(String title, List<Verdict> verdicts) {
        if (verdicts.isEmpty()) {
            return;
        }
        System.out.println(title);
        for (Verdict v : verdicts) {
            System.out.printf("   [%d/100] %s%n", v.getRiskScore(), v.getPath());
            System.out.printf("      → %s%n", v.describeReasons());
        }
        System.out.println();
    }

    /**
     * Вывести баннер
     */
    private void printBanner() {
        if (ciMode) return;  // Не показываем в CI режиме

        System.out.println("""

            ╔═══════════════════════════════════════════════════════════╗
            ║                                                           ║
            ║     Sentinel Scanner v1.0.0                               ║
            ║                                                           ║
            ║     Поиск вредоносных файлов                              ║
            ║     • Сигнатуры  • Эвристики                              ║
            ║     • Поведение  • AI-модель                              ║
            ║                                                           ║
            ╚═══════════════════════════════════════════════════════════╝

            """);
    }
}
