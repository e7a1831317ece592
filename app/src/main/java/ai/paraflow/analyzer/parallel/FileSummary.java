package ai.paraflow.analyzer.parallel;

import ai.paraflow.analyzer.ImportRecord;
import ai.paraflow.analyzer.ModuleKey;
import ai.paraflow.analyzer.ProjectFile;
import java.util.List;

/** Syntax-derived facts of one parsed file. Immutable; safe to hand from worker threads to the merge step. */
public record FileSummary(
        ProjectFile file, ModuleKey module, List<FunctionSummary> functions, List<ImportRecord> imports) {

    public FileSummary {
        functions = List.copyOf(functions);
        imports = List.copyOf(imports);
    }

    public FileSummary withModule(ModuleKey module) {
        return new FileSummary(file, module, functions, imports);
    }
}
