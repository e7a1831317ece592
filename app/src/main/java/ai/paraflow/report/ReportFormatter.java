package ai.paraflow.report;

import ai.paraflow.analyzer.parallel.AnalysisResult;

public interface ReportFormatter {

    String format(AnalysisResult result);
}
