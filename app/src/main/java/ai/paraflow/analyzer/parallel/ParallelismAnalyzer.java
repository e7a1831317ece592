package ai.paraflow.analyzer.parallel;

import ai.paraflow.analyzer.AnalyzerProgressCallback;
import ai.paraflow.analyzer.ProjectFile;
import ai.paraflow.analyzer.rust.ParseResult;
import ai.paraflow.analyzer.rust.RustSourceParser;
import ai.paraflow.settings.AnalysisSettings;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs the whole analysis over a set of Rust files.
 *
 * <ol>
 *   <li>parse and summarize every file on the worker pool (files are independent)
 *   <li>barrier: merge the summaries into the {@link FunctionArena}
 *   <li>resolve visibility and call edges per module on the worker pool
 *   <li>propagate to the fixed point, pass by pass
 * </ol>
 */
public final class ParallelismAnalyzer {
    private static final Logger logger = LogManager.getLogger(ParallelismAnalyzer.class);

    private final AnalysisSettings settings;
    private final RustSourceParser parser;
    private final FileSummarizer summarizer;
    private final CallGraphExtractor extractor;
    private final AnalyzerProgressCallback progress;
    private final PropagationListener listener;

    public ParallelismAnalyzer(
            AnalysisSettings settings, AnalyzerProgressCallback progress, PropagationListener listener) {
        this.settings = settings;
        this.progress = progress;
        this.listener = listener;
        var moduleKeys = new ModuleKeys(settings.chapterPattern());
        this.parser = new RustSourceParser(settings.lenientParsing());
        this.summarizer = new FileSummarizer(moduleKeys, new PrimitiveDetector(settings.primitives()));
        this.extractor = new CallGraphExtractor(new HeuristicResolutionStrategy(
                new ModuleAliases(settings.aliasMarker()), moduleKeys, settings.receiverScope()));
    }

    public ParallelismAnalyzer(AnalysisSettings settings) {
        this(settings, AnalyzerProgressCallback.NOOP, PropagationListener.NOOP);
    }

    private record FileOutcome(@Nullable FileSummary summary, @Nullable FileFailure failure) {}

    public AnalysisResult analyze(List<ProjectFile> files) {
        return run(files.size(), files.stream()
                .<Callable<FileOutcome>>map(file -> () -> summarize(parser.parse(file)))
                .toList());
    }

    /** Analyzes files that were parsed elsewhere. */
    public AnalysisResult analyzeParsed(List<ParseResult> parsed) {
        return run(parsed.size(), parsed.stream()
                .<Callable<FileOutcome>>map(result -> () -> summarize(result))
                .toList());
    }

    private FileOutcome summarize(ParseResult result) {
        if (result instanceof ParseResult.Failed failed) {
            return new FileOutcome(null, new FileFailure(failed.file(), failed.line(), failed.reason()));
        }
        return new FileOutcome(summarizer.summarize((ParseResult.Parsed) result), null);
    }

    private AnalysisResult run(int total, List<Callable<FileOutcome>> fileTasks) {
        long start = System.currentTimeMillis();
        var executor = Executors.newFixedThreadPool(settings.threads(), new WorkerThreadFactory());
        try {
            var completed = new AtomicInteger();
            var tracked = fileTasks.stream()
                    .<Callable<FileOutcome>>map(task -> () -> {
                        var outcome = task.call();
                        progress.onProgress(completed.incrementAndGet(), total, "Analyzing Rust files");
                        return outcome;
                    })
                    .toList();

            var summaries = new ArrayList<FileSummary>();
            var failures = new ArrayList<FileFailure>();
            for (var outcome : invokeAll(executor, tracked)) {
                if (outcome.summary() != null) {
                    summaries.add(outcome.summary());
                }
                if (outcome.failure() != null) {
                    failures.add(outcome.failure());
                }
            }

            var arena = FunctionArena.build(summaries);
            var extractions = arena.moduleRecords().stream()
                    .<Callable<Integer>>map(module -> () -> extractor.extractModule(module, arena))
                    .toList();
            int edges = invokeAll(executor, extractions).stream().mapToInt(Integer::intValue).sum();
            logger.info(
                    "Summarized {} modules ({} functions, {} call edges); {} files failed",
                    arena.moduleRecords().size(),
                    arena.functionCount(),
                    edges,
                    failures.size());

            var registry = ParallelRegistry.seededFrom(arena);
            var stats = new FixedPointPropagator(listener, executor, settings.threads()).propagate(arena, registry);

            var modules = arena.moduleRecords().stream()
                    .map(m -> new ModuleResult(
                            m.key(), m.file(), m.functions().stream().map(FunctionResult::of).toList()))
                    .toList();
            logger.debug("Analysis took {} ms", System.currentTimeMillis() - start);
            return new AnalysisResult(modules, failures, stats);
        } finally {
            executor.shutdownNow();
        }
    }

    /** Runs {@code tasks} to completion; a failing task or an interrupt aborts the run. */
    static <T> List<T> invokeAll(ExecutorService executor, List<Callable<T>> tasks) {
        try {
            var results = new ArrayList<T>(tasks.size());
            for (var future : executor.invokeAll(tasks)) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisException("Analysis interrupted", e);
        } catch (ExecutionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            throw new AnalysisException("Analysis task failed: " + cause.getMessage(), cause);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final ThreadFactory delegate = Executors.defaultThreadFactory();
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            var t = delegate.newThread(r);
            t.setDaemon(true);
            t.setName("paraflow-worker-" + counter.incrementAndGet());
            return t;
        }
    }
}
