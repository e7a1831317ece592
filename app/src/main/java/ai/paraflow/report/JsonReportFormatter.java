package ai.paraflow.report;

import ai.paraflow.analyzer.Provenance;
import ai.paraflow.analyzer.parallel.AnalysisResult;
import ai.paraflow.analyzer.parallel.FunctionResult;
import ai.paraflow.analyzer.parallel.ModuleResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.List;

/** The report as JSON, with the same ordering as the text report. */
public final class JsonReportFormatter implements ReportFormatter {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    record JsonCall(int line, String module, String function) {
        static JsonCall of(Provenance provenance) {
            return new JsonCall(provenance.callLine(), provenance.module().key(), provenance.function());
        }
    }

    record JsonFunction(String name, int line, String status, List<JsonCall> calls) {
        static JsonFunction of(FunctionResult function) {
            return new JsonFunction(
                    function.name(),
                    function.line(),
                    function.status().name(),
                    function.provenance().stream().map(JsonCall::of).toList());
        }
    }

    record JsonModule(String module, String path, List<JsonFunction> functions) {
        static JsonModule of(ModuleResult module) {
            return new JsonModule(
                    module.key().key(),
                    module.file().toString(),
                    module.functions().stream().map(JsonFunction::of).toList());
        }
    }

    record JsonFailure(String path, int line, String reason) {}

    record JsonReport(List<JsonModule> modules, List<JsonFailure> failures, ReportSummary summary) {}

    @Override
    public String format(AnalysisResult result) {
        var report = new JsonReport(
                result.modules().stream().map(JsonModule::of).toList(),
                result.failures().stream()
                        .map(f -> new JsonFailure(f.file().toString(), f.line(), f.reason()))
                        .toList(),
                ReportSummary.of(result));
        try {
            return MAPPER.writeValueAsString(report) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report", e);
        }
    }
}
