package com.sentinel.scanner.core;

import com.sentinel.scanner.detectors.ThreatDetector;
import com.sentinel.scanner.evidence.EvidenceExtractor;
import com.sentinel.scanner.models.Evidence;
import com.sentinel.scanner.models.Finding;
import com.sentinel.scanner.models.ScanPolicy;
import com.sentinel.scanner.models.SkipReason;
import com.sentinel.scanner.models.Verdict;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Обход корней политики и оценка подходящих файлов.
 *
 * <p>Один производитель (вызывающий поток) последовательно обходит каталоги и кладет
 * кандидатов в ограниченную очередь; пул воркеров выполняет для каждого файла
 * извлечение признаков → детекторы → агрегацию. Заполненная очередь тормозит обход.
 *
 * <p>Переходы пути: символическая ссылка → Skipped(symlink); глубже maxDepth → Skipped(depth-limit);
 * каталог → обход детей; файл → фильтр расширений (кроме файла-корня), фильтр размера, оценка.
 * Ошибка чтения каталога или файла → Skipped(io-error), превышение таймаута → Skipped(timeout);
 * соседние пути продолжают обрабатываться.
 */
@Slf4j
public class TraversalEngine {

    private static final long POLL_INTERVAL_MS = 50L;

    private final EvidenceExtractor extractor;
    private final List<ThreatDetector> detectors;
    private final ScoreAggregator aggregator;
    private final EngineSettings settings;

    private final AtomicInteger activeWorkers = new AtomicInteger();

    public TraversalEngine(EvidenceExtractor extractor,
                           List<ThreatDetector> detectors,
                           ScoreAggregator aggregator,
                           EngineSettings settings) {
        this.extractor = extractor != null ? extractor : new EvidenceExtractor();
        this.detectors = detectors != null ? List.copyOf(detectors) : List.of();
        this.aggregator = aggregator != null ? aggregator : new ScoreAggregator();
        this.settings = settings != null ? settings : EngineSettings.defaults();
    }

    public List<ThreatDetector> getDetectors() {
        return detectors;
    }

    /**
     * Сколько воркеров выполняется прямо сейчас
     */
    public int getActiveWorkers() {
        return activeWorkers.get();
    }

    /**
     * Выполнить обход. Возвращает управление только после остановки всех воркеров.
     *
     * @return вердикты, отсортированные по пути
     */
    public List<Verdict> run(ScanPolicy policy,
                             StatisticsAccumulator statistics,
                             CancellationToken cancellation,
                             ScanProgressListener listener) {
        int workerCount = Math.max(1, settings.getWorkerThreads());
        ExecutorService io = Executors.newCachedThreadPool(namedThreadFactory("sentinel-io-", true));
        ExecutorService workers = Executors.newFixedThreadPool(workerCount, namedThreadFactory("sentinel-worker-", false));
        RunContext ctx = new RunContext(policy, statistics,
            cancellation != null ? cancellation : new CancellationToken(),
            listener != null ? listener : ScanProgressListener.noOp(),
            io, Math.max(1, settings.getQueueCapacity()));

        try {
            for (int i = 0; i < workerCount; i++) {
                workers.submit(() -> workerLoop(ctx));
            }

            try {
                for (Path root : policy.getRootPaths()) {
                    if (ctx.cancellation.isCancelled()) {
                        break;
                    }
                    log.info("Сканирование {}", root);
                    visit(root, 0, ctx);
                }
            } finally {
                ctx.producerDone.set(true);
            }

            workers.shutdown();
            awaitWorkers(workers, ctx);
        } finally {
            workers.shutdownNow();
            io.shutdownNow();
        }

        List<Verdict> verdicts = new ArrayList<>(ctx.verdicts);
        verdicts.sort(Comparator.comparing(v -> String.valueOf(v.getPath())));
        return verdicts;
    }

    private void awaitWorkers(ExecutorService workers, RunContext ctx) {
        try {
            while (!workers.awaitTermination(1, TimeUnit.SECONDS)) {
                log.debug("Ожидание воркеров, в очереди {}", ctx.queue.size());
            }
        } catch (InterruptedException e) {
            log.warn("Ожидание воркеров прервано, сессия отменяется");
            ctx.cancellation.cancel();
            workers.shutdownNow();
            Thread.currentThread().interrupt();
            try {
                workers.awaitTermination(settings.getOperationTimeoutMs(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // ─── производитель ───────────────────────────────────────────────

    private void visit(Path path, int depth, RunContext ctx) {
        if (ctx.cancellation.isCancelled()) {
            return;
        }

        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        } catch (IOException e) {
            skip(path, SkipReason.IO_ERROR, ctx, e.toString());
            return;
        }

        if (attrs.isSymbolicLink()) {
            attrs = resolveSymlink(path, ctx);
            if (attrs == null) {
                return;
            }
        }

        if (depth > ctx.policy.getMaxDepth()) {
            skip(path, SkipReason.DEPTH_LIMIT, ctx, null);
            return;
        }

        if (attrs.isDirectory()) {
            List<Path> children;
            try {
                children = listChildren(path, ctx);
            } catch (TimeoutException e) {
                skip(path, SkipReason.TIMEOUT, ctx, "листинг каталога дольше " + settings.getOperationTimeoutMs() + " мс");
                return;
            } catch (IOException e) {
                skip(path, SkipReason.IO_ERROR, ctx, e.toString());
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ctx.cancellation.cancel();
                return;
            }
            for (Path child : children) {
                if (ctx.cancellation.isCancelled()) {
                    return;
                }
                visit(child, depth + 1, ctx);
            }
            return;
        }

        if (!attrs.isRegularFile()) {
            log.debug("Не обычный файл, пропуск: {}", path);
            return;
        }

        Path name = path.getFileName();
        String extension = EvidenceExtractor.extensionOf(name != null ? name.toString() : "");
        // явно заданный файл-корень оценивается независимо от фильтра расширений
        if (depth > 0 && !ctx.policy.acceptsExtension(extension)) {
            skip(path, SkipReason.EXTENSION_FILTER, ctx, null);
            return;
        }
        if (attrs.size() > ctx.policy.getMaxFileSizeBytes()) {
            skip(path, SkipReason.SIZE_LIMIT, ctx, attrs.size() + " байт");
            return;
        }

        enqueue(path, ctx);
    }

    /**
     * Каталоги по ссылкам не обходятся никогда; файлы по ссылкам - только если политика разрешает
     */
    private BasicFileAttributes resolveSymlink(Path path, RunContext ctx) {
        if (!ctx.policy.isFollowSymlinks()) {
            skip(path, SkipReason.SYMLINK, ctx, null);
            return null;
        }
        BasicFileAttributes target;
        try {
            target = Files.readAttributes(path, BasicFileAttributes.class);
        } catch (IOException e) {
            skip(path, SkipReason.IO_ERROR, ctx, "битая ссылка: " + e);
            return null;
        }
        if (!target.isRegularFile()) {
            skip(path, SkipReason.SYMLINK, ctx, null);
            return null;
        }
        return target;
    }

    private List<Path> listChildren(Path dir, RunContext ctx)
            throws IOException, TimeoutException, InterruptedException {
        Future<List<Path>> listing = ctx.io.submit(() -> {
            List<Path> out = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
                for (Path child : stream) {
                    out.add(child);
                }
            }
            return out;
        });
        try {
            return listing.get(settings.getOperationTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            listing.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("Ошибка чтения каталога " + dir, cause);
        }
    }

    private void enqueue(Path path, RunContext ctx) {
        try {
            while (!ctx.queue.offer(path, POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                if (ctx.cancellation.isCancelled()) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.cancellation.cancel();
        }
    }

    private void skip(Path path, SkipReason reason, RunContext ctx, String detail) {
        ctx.statistics.recordSkip(reason);
        if (reason.isError()) {
            log.warn("Пропуск {} ({}): {}", path, reason.getCode(), detail);
        } else if (log.isDebugEnabled()) {
            log.debug("Пропуск {} ({}){}", path, reason.getCode(), detail != null ? ": " + detail : "");
        }
    }

    // ─── воркеры ─────────────────────────────────────────────────────

    private void workerLoop(RunContext ctx) {
        activeWorkers.incrementAndGet();
        try {
            while (!ctx.cancellation.isCancelled()) {
                Path path = ctx.queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (path == null) {
                    if (ctx.producerDone.get() && ctx.queue.isEmpty()) {
                        break;
                    }
                    continue;
                }
                try {
                    evaluate(path, ctx);
                } catch (RuntimeException e) {
                    ctx.statistics.recordSkip(SkipReason.IO_ERROR);
                    log.error("Непредвиденная ошибка при оценке {}: {}", path, e.getMessage(), e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            activeWorkers.decrementAndGet();
        }
    }

    private void evaluate(Path path, RunContext ctx) throws InterruptedException {
        Evidence evidence = extractWithTimeout(path, ctx);
        if (evidence == null) {
            return;
        }

        List<Finding> findings = new ArrayList<>();
        for (ThreatDetector detector : detectors) {
            try {
                List<Finding> result = detector.evaluate(evidence, ctx.policy);
                if (result != null) {
                    findings.addAll(result);
                }
            } catch (RuntimeException e) {
                ctx.statistics.recordDetectorError();
                log.warn("Ошибка детектора {} на {}: {}", detector.getName(), path, e.getMessage());
            }
        }

        Verdict verdict = aggregator.aggregate(findings, evidence);
        ctx.verdicts.add(verdict);
        long scanned = ctx.statistics.recordVerdict(verdict.getClassification());

        if (verdict.isThreat()) {
            log.warn("{}: {} (risk {}) - {}", verdict.getClassification().getLabel(), path,
                verdict.getRiskScore(), verdict.describeReasons());
        } else {
            log.debug("Чисто: {} (risk {})", path, verdict.getRiskScore());
        }

        if (scanned % Math.max(1, settings.getProgressInterval()) == 0) {
            notifyProgress(ctx.listener, scanned, path);
        }
    }

    private Evidence extractWithTimeout(Path path, RunContext ctx) throws InterruptedException {
        Future<Evidence> extraction = ctx.io.submit(() -> extractor.extract(path, ctx.policy.isLegacyDigest()));
        try {
            return extraction.get(settings.getOperationTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            extraction.cancel(true);
            skip(path, SkipReason.TIMEOUT, ctx, "чтение дольше " + settings.getOperationTimeoutMs() + " мс");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            skip(path, SkipReason.IO_ERROR, ctx, cause.toString());
        } catch (InterruptedException e) {
            extraction.cancel(true);
            throw e;
        }
        return null;
    }

    static void notifyProgress(ScanProgressListener listener, long scanned, Path path) {
        try {
            listener.onProgress(scanned, path);
        } catch (RuntimeException e) {
            log.warn("Слушатель прогресса выбросил исключение: {}", e.getMessage());
        }
    }

    private static ThreadFactory namedThreadFactory(String prefix, boolean daemon) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        };
    }

    private static final class RunContext {
        final ScanPolicy policy;
        final StatisticsAccumulator statistics;
        final CancellationToken cancellation;
        final ScanProgressListener listener;
        final BlockingQueue<Path> queue;
        final AtomicBoolean producerDone = new AtomicBoolean(false);
        final ConcurrentLinkedQueue<Verdict> verdicts = new ConcurrentLinkedQueue<>();
        final ExecutorService io;

        RunContext(ScanPolicy policy, StatisticsAccumulator statistics,
                   CancellationToken cancellation, ScanProgressListener listener,
                   ExecutorService io, int queueCapacity) {
            this.policy = policy;
            this.statistics = statistics;
            this.cancellation = cancellation;
            this.listener = listener;
            this.io = io;
            this.queue = new ArrayBlockingQueue<>(queueCapacity);
        }
    }
}
