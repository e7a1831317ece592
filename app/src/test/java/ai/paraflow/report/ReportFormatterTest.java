package ai.paraflow.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.paraflow.analyzer.parallel.AnalysisResult;
import ai.paraflow.testutil.RustTestProject;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReportFormatterTest {

    @TempDir
    Path root;

    private AnalysisResult result;

    @BeforeEach
    void setUp() throws Exception {
        var project = new RustTestProject(root);
        project.write(
                "src/A.rs",
                """
                pub fn p() {
                    rayon::join(|| 1, || 2);
                }
                pub fn plain() {}
                """);
        project.write(
                "src/B.rs",
                """
                use crate::A::*;
                pub fn q() {
                    A::p();
                }
                """);
        project.write("src/C.rs", "pub fn idle() {}\n");
        project.write("src/D.rs", "pub fn broken( {\n");
        result = project.analyze();
    }

    @Test
    void textReportPrefixesEveryEntryWithItsLocation() {
        var text = new TextReportFormatter().format(result);
        var lines = text.lines().toList();

        assertTrue(lines.contains("src/A.rs:1: A: Inherent parallel functions: 1"), text);
        assertTrue(lines.contains("src/A.rs:1:  p"), text);
        assertTrue(lines.contains("src/B.rs:1: B: Transitive parallel functions: 1"), text);
        assertTrue(lines.contains("src/B.rs:2:  q calls:"), text);
        assertTrue(lines.contains("src/B.rs:3:    A::p"), text);
        assertTrue(lines.contains("src/A.rs:4:  plain"), text);
        assertTrue(lines.contains("src/C.rs:1: C: Module not parallel, functions: 1"), text);
        assertTrue(lines.contains("src/C.rs:1:  idle"), text);
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("src/D.rs:") && l.endsWith(" syntax error")), text);
    }

    @Test
    void textReportSectionsAppearInOrderAndEndWithSummary() {
        var text = new TextReportFormatter().format(result);

        int inherent = text.indexOf("MODULES WITH INHERENT PARALLELISM:");
        int transitive = text.indexOf("MODULES WITH TRANSITIVE PARALLELISM:");
        int notParallel = text.indexOf("MODULES NOT PARALLEL:");
        int failures = text.indexOf("PARSE FAILURES:");
        int summary = text.indexOf("SUMMARY:");
        assertTrue(0 <= inherent && inherent < transitive && transitive < notParallel);
        assertTrue(notParallel < failures && failures < summary);
        assertTrue(text.contains(TextReportFormatter.RULE));
        assertTrue(text.contains("  Total modules analyzed: 3\n"));
        assertTrue(text.contains("  Modules with inherent parallelism: 1\n"));
        assertTrue(text.contains("  Modules with transitive parallelism only: 1\n"));
        assertTrue(text.contains("  Modules not parallel: 1\n"));
        assertTrue(text.contains("  Total inherent parallel functions: 1\n"));
        assertTrue(text.contains("  Total transitive parallel functions: 1\n"));
        assertTrue(text.contains("  Total not parallel functions: 2\n"));
        assertTrue(text.contains("  Parse failures: 1\n"));
    }

    @Test
    void summaryCountsModulesByTheirStrongestStatus() {
        assertEquals(new ReportSummary(3, 1, 1, 1, 1, 1, 2, 1), ReportSummary.of(result));
    }

    @Test
    void jsonReportCarriesTheSameData() throws Exception {
        var json = new ObjectMapper().readTree(ReportFormat.JSON.formatter().format(result));

        var modules = json.get("modules");
        assertEquals(3, modules.size());
        assertEquals("A", modules.get(0).get("module").asText());
        assertEquals("src/A.rs", modules.get(0).get("path").asText());
        var q = modules.get(1).get("functions").get(0);
        assertEquals("q", q.get("name").asText());
        assertEquals("TRANSITIVE", q.get("status").asText());
        assertEquals(3, q.get("calls").get(0).get("line").asInt());
        assertEquals("A", q.get("calls").get(0).get("module").asText());
        assertEquals("p", q.get("calls").get(0).get("function").asText());
        assertEquals("src/D.rs", json.get("failures").get(0).get("path").asText());
        assertEquals(2, json.get("summary").get("notParallelFunctions").asInt());
    }
}
