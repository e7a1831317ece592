package ai.paraflow.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ParaflowCliTest {

    @TempDir
    Path root;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(root.resolve("src/Chap01"));
        Files.writeString(root.resolve("src/Chap01/PoolMt.rs"), "pub fn run() {\n    rayon::join(|| 1, || 2);\n}\n");
        Files.writeString(
                root.resolve("src/Chap01/UserMt.rs"),
                "use crate::Chap01::PoolMt::PoolMt::*;\npub fn go() {\n    run();\n}\n");
        Files.writeString(root.resolve("src/Chap01/PlainSt.rs"), "pub fn idle() {}\n");
    }

    private int run(String... args) {
        var cmd = new CommandLine(new ParaflowCli());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void textReportGoesToStdout() {
        int exit = run("--base-dir", root.toString(), "--threads", "1");

        var text = out.toString();
        assertEquals(0, exit, err.toString());
        assertTrue(text.contains("src/Chap01/PoolMt.rs:1:  run"), text);
        assertTrue(text.contains("src/Chap01/UserMt.rs:2:  go calls:"), text);
        assertTrue(text.contains("src/Chap01/UserMt.rs:3:    Chap01/PoolMt::run"), text);
        assertTrue(text.contains("  Total modules analyzed: 3"), text);
        assertTrue(text.contains("Completed in "), text);
    }

    @Test
    void nameFilterJsonFormatAndOutputFile() throws Exception {
        var output = root.resolve("reports/paraflow.json");

        int exit = run("-d", root.toString(), "--name-contains", "Mt", "--format", "json", "-o", output.toString());

        assertEquals(0, exit, err.toString());
        var json = new ObjectMapper().readTree(out.toString());
        assertEquals(2, json.get("modules").size());
        assertEquals(json, new ObjectMapper().readTree(Files.readString(output)));
    }

    @Test
    void configFileIsAppliedAndOptionsOverrideIt() throws Exception {
        var config = root.resolve("settings.json");
        Files.writeString(config, "{\"primitives\": {\"functions\": [], \"macros\": [], \"methods\": []}}");

        int exit = run("-d", root.toString(), "--config", config.toString(), "--format", "json");

        assertEquals(0, exit, err.toString());
        var summary = new ObjectMapper().readTree(out.toString()).get("summary");
        assertEquals(0, summary.get("inherentFunctions").asInt());
        assertEquals(3, summary.get("modulesNotParallel").asInt());
    }

    @Test
    void usageAndConfigurationErrorsExitWithTwo() throws Exception {
        assertEquals(2, run("--bogus"));
        assertEquals(2, run("-d", root.toString(), "--threads", "0"));
        assertEquals(2, run("-d", root.toString(), "missing/dir"));

        var config = root.resolve("bad.json");
        Files.writeString(config, "{\"unknown\": true}");
        assertEquals(2, run("-d", root.toString(), "--config", config.toString()));
        assertTrue(err.toString().contains("Error:"));
    }

    @Test
    void helpDescribesTheCommand() {
        assertEquals(0, run("--help"));
        assertTrue(out.toString().contains("paraflow"));
        assertTrue(out.toString().contains("--receiver-scope"));
    }
}
