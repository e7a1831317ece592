package ai.paraflow.cli;

import ai.paraflow.analyzer.ProjectFile;
import ai.paraflow.analyzer.RustFileFinder;
import ai.paraflow.analyzer.parallel.ParallelismAnalyzer;
import ai.paraflow.analyzer.parallel.ReceiverScope;
import ai.paraflow.report.ReportFormat;
import ai.paraflow.settings.AnalysisSettings;
import ai.paraflow.settings.SettingsLoader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "paraflow",
        mixinStandardHelpOptions = true,
        version = "paraflow 1.0.0",
        description = "Reports which functions of a Rust code base are parallel, directly or through their calls.")
public final class ParaflowCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(ParaflowCli.class);

    static final int EXIT_USAGE = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
            arity = "0..*",
            paramLabel = "PATH",
            description = "Files or directories to analyze (default: src under the base directory).")
    private List<Path> paths = new ArrayList<>();

    @CommandLine.Option(
            names = {"-d", "--base-dir"},
            description = "Directory that relative paths and reported file names are relative to.")
    private Path baseDir = Path.of("");

    @CommandLine.Option(names = "--name-contains", description = "Only analyze files whose name contains this text.")
    @Nullable
    private String nameContains;

    @CommandLine.Option(
            names = "--format",
            description = "Report format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
    private ReportFormat format = ReportFormat.TEXT;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Also write the report to this file.")
    @Nullable
    private Path output;

    @CommandLine.Option(names = "--config", description = "JSON settings file.")
    @Nullable
    private Path config;

    @CommandLine.Option(names = "--threads", description = "Worker threads (default: available processors).")
    @Nullable
    private Integer threads;

    @CommandLine.Option(
            names = "--receiver-scope",
            description = "Modules searched for expr.method() targets: ${COMPLETION-CANDIDATES}.")
    @Nullable
    private ReceiverScope receiverScope;

    @CommandLine.Option(names = "--lenient", description = "Analyze files with syntax errors instead of skipping them.")
    private boolean lenient;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ParaflowCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        long start = System.currentTimeMillis();
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        AnalysisSettings settings;
        try {
            settings = settings();
        } catch (IllegalArgumentException | IOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        List<ProjectFile> files;
        try {
            files = new RustFileFinder(baseDir, settings.nameContains()).find(paths);
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
        logger.info("Analyzing {} Rust files under {}", files.size(), baseDir.toAbsolutePath().normalize());

        var result = new ParallelismAnalyzer(settings).analyze(files);
        var report = format.formatter().format(result);
        if (format == ReportFormat.TEXT) {
            report += "Completed in " + (System.currentTimeMillis() - start) + "ms\n";
        }

        out.print(report);
        out.flush();
        if (output != null) {
            var parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, report, StandardCharsets.UTF_8);
        }
        return 0;
    }

    private AnalysisSettings settings() throws IOException {
        var settings = config != null ? SettingsLoader.load(config) : AnalysisSettings.defaults();
        if (threads != null) {
            settings = settings.withThreads(threads);
        }
        if (receiverScope != null) {
            settings = settings.withReceiverScope(receiverScope);
        }
        if (lenient) {
            settings = settings.withLenientParsing(true);
        }
        if (nameContains != null) {
            settings = settings.withNameContains(nameContains);
        }
        return settings;
    }
}
