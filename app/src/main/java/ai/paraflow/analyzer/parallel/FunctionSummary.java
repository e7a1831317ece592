package ai.paraflow.analyzer.parallel;

import ai.paraflow.analyzer.CallSite;
import java.util.List;

/** What one {@code fn} item contributes to the analysis; produced per file, before any module is known. */
public record FunctionSummary(String name, int line, boolean inherent, List<CallSite> callSites) {

    public FunctionSummary {
        callSites = List.copyOf(callSites);
    }
}
