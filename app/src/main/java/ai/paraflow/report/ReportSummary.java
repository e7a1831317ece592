package ai.paraflow.report;

import ai.paraflow.analyzer.parallel.AnalysisResult;
import ai.paraflow.analyzer.parallel.ModuleResult;
import ai.paraflow.analyzer.parallel.ParallelStatus;

/** Aggregate counters of a report. */
public record ReportSummary(
        int modules,
        int modulesWithInherent,
        int modulesWithTransitiveOnly,
        int modulesNotParallel,
        int inherentFunctions,
        int transitiveFunctions,
        int notParallelFunctions,
        int parseFailures) {

    public static ReportSummary of(AnalysisResult result) {
        int withInherent = 0;
        int transitiveOnly = 0;
        int notParallel = 0;
        int inherentFns = 0;
        int transitiveFns = 0;
        int notParallelFns = 0;
        for (ModuleResult module : result.modules()) {
            if (module.hasInherent()) {
                withInherent++;
            } else if (module.hasTransitive()) {
                transitiveOnly++;
            } else {
                notParallel++;
            }
            inherentFns += module.withStatus(ParallelStatus.INHERENT).size();
            transitiveFns += module.withStatus(ParallelStatus.TRANSITIVE).size();
            notParallelFns += module.withStatus(ParallelStatus.NOT_PARALLEL).size();
        }
        return new ReportSummary(
                result.modules().size(),
                withInherent,
                transitiveOnly,
                notParallel,
                inherentFns,
                transitiveFns,
                notParallelFns,
                result.failures().size());
    }
}
