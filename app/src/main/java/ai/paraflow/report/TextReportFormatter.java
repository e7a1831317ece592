package ai.paraflow.report;

import ai.paraflow.analyzer.ProjectFile;
import ai.paraflow.analyzer.parallel.AnalysisResult;
import ai.paraflow.analyzer.parallel.ModuleResult;
import ai.paraflow.analyzer.parallel.ParallelStatus;

/**
 * Human-readable report. Every entry starts with {@code path:line:} so editors can jump to it; module entries point
 * at line 1.
 */
public final class TextReportFormatter implements ReportFormatter {
    static final String RULE = "=".repeat(80);

    @Override
    public String format(AnalysisResult result) {
        var out = new StringBuilder();

        section(out, "MODULES WITH INHERENT PARALLELISM:", "(Functions that call a parallel primitive directly)");
        for (var module : result.modules()) {
            var inherent = module.withStatus(ParallelStatus.INHERENT);
            if (inherent.isEmpty()) {
                continue;
            }
            moduleHeader(out, module, "Inherent parallel functions: " + inherent.size());
            for (var function : inherent) {
                entry(out, module.file(), function.line(), "  " + function.name());
            }
            out.append('\n');
        }

        section(out, "MODULES WITH TRANSITIVE PARALLELISM:", "(Functions that call parallel functions)");
        for (var module : result.modules()) {
            var transitive = module.withStatus(ParallelStatus.TRANSITIVE);
            if (transitive.isEmpty()) {
                continue;
            }
            moduleHeader(out, module, "Transitive parallel functions: " + transitive.size());
            for (var function : transitive) {
                entry(out, module.file(), function.line(), "  " + function.name() + " calls:");
                for (var cause : function.provenance()) {
                    entry(out, module.file(), cause.callLine(), "    " + cause.module() + "::" + cause.function());
                }
            }
            out.append('\n');
        }

        section(out, "MODULES NOT PARALLEL:", "(Functions with no inherent or transitive parallelism, per module)");
        for (var module : result.modules()) {
            var notParallel = module.withStatus(ParallelStatus.NOT_PARALLEL);
            if (notParallel.isEmpty() && module.isParallel()) {
                continue;
            }
            moduleHeader(
                    out,
                    module,
                    (module.isParallel() ? "Not parallel functions: " : "Module not parallel, functions: ")
                            + notParallel.size());
            for (var function : notParallel) {
                entry(out, module.file(), function.line(), "  " + function.name());
            }
            out.append('\n');
        }

        if (!result.failures().isEmpty()) {
            section(out, "PARSE FAILURES:", "(Files excluded from the analysis)");
            for (var failure : result.failures()) {
                entry(out, failure.file(), failure.line(), " " + failure.reason());
            }
            out.append('\n');
        }

        summary(out, ReportSummary.of(result));
        return out.toString();
    }

    private static void section(StringBuilder out, String title, String subtitle) {
        out.append('\n')
                .append(RULE)
                .append('\n')
                .append(title)
                .append('\n')
                .append(subtitle)
                .append('\n')
                .append(RULE)
                .append("\n\n");
    }

    private static void moduleHeader(StringBuilder out, ModuleResult module, String text) {
        entry(out, module.file(), 1, " " + module.key() + ": " + text);
    }

    private static void entry(StringBuilder out, ProjectFile file, int line, String text) {
        out.append(file).append(':').append(line).append(':').append(text).append('\n');
    }

    private static void summary(StringBuilder out, ReportSummary summary) {
        out.append(RULE).append('\n');
        out.append("SUMMARY:\n");
        out.append("  Total modules analyzed: ").append(summary.modules()).append('\n');
        out.append("  Modules with inherent parallelism: ")
                .append(summary.modulesWithInherent())
                .append('\n');
        out.append("  Modules with transitive parallelism only: ")
                .append(summary.modulesWithTransitiveOnly())
                .append('\n');
        out.append("  Modules not parallel: ").append(summary.modulesNotParallel()).append('\n');
        out.append("  Total inherent parallel functions: ")
                .append(summary.inherentFunctions())
                .append('\n');
        out.append("  Total transitive parallel functions: ")
                .append(summary.transitiveFunctions())
                .append('\n');
        out.append("  Total not parallel functions: ")
                .append(summary.notParallelFunctions())
                .append('\n');
        out.append("  Parse failures: ").append(summary.parseFailures()).append('\n');
        out.append(RULE).append('\n');
    }
}
