package ai.paraflow.analyzer.parallel;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ai.paraflow.analyzer.CallKind;
import ai.paraflow.analyzer.CallSite;
import ai.paraflow.analyzer.FunctionId;
import ai.paraflow.analyzer.ImportRecord;
import ai.paraflow.analyzer.ModuleKey;
import ai.paraflow.analyzer.ProjectFile;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HeuristicResolutionStrategyTest {

    private static final ModuleKey CHAP18_SEQ = new ModuleKey("Chap18", "ArraySeq");
    private static final ModuleKey CHAP19_SEQ = new ModuleKey("Chap19", "ArraySeq");
    private static final ModuleKey GRAPH = new ModuleKey("Chap06", "Graph");
    private static final ModuleKey TYPES = ModuleKey.of("Types");

    private final ModuleKeys moduleKeys = new ModuleKeys("Chap.*");
    private FunctionArena arena;

    @BeforeEach
    void setUp() {
        arena = FunctionArena.build(
                List.of(
                        module(CHAP18_SEQ, "new", "map_par"),
                        module(CHAP19_SEQ, "new", "map_par"),
                        module(GRAPH, "build", "helper"),
                        module(TYPES, "helper", "describe")));
    }

    private static FileSummary module(ModuleKey key, String... functions) {
        var path = (key.hasChapter() ? "src/" + key.chapter() + "/" : "src/") + key.name() + ".rs";
        var summaries = Arrays.stream(functions)
                .map(name -> new FunctionSummary(name, 1, false, List.of()))
                .toList();
        return new FileSummary(new ProjectFile(Path.of("project"), path), key, summaries, List.of());
    }

    private HeuristicResolutionStrategy strategy(ReceiverScope scope) {
        return new HeuristicResolutionStrategy(new ModuleAliases("S"), moduleKeys, scope);
    }

    private static ImportRecord glob(String... path) {
        return new ImportRecord("src/User.rs", path[path.length - 1], true, List.of(path));
    }

    @Test
    void chapterInImportPathPinsTheModule() {
        var visible = strategy(ReceiverScope.ALL_MODULES)
                .visibleModules(GRAPH, List.of(glob("crate", "Chap18", "ArraySeq", "ArraySeq")), arena);
        assertEquals(Set.of(CHAP18_SEQ), visible);
    }

    @Test
    void unpinnedImportPrefersImporterChapterElseTakesAllVariants() {
        var strategy = strategy(ReceiverScope.ALL_MODULES);
        var imports = List.of(glob("super", "ArraySeq"));

        assertEquals(Set.of(CHAP19_SEQ), strategy.visibleModules(new ModuleKey("Chap19", "User"), imports, arena));
        assertEquals(
                Set.of(CHAP18_SEQ, CHAP19_SEQ),
                strategy.visibleModules(new ModuleKey("Chap07", "User"), imports, arena));
    }

    @Test
    void aliasedImportFindsTheModule() {
        var visible = strategy(ReceiverScope.ALL_MODULES)
                .visibleModules(GRAPH, List.of(glob("crate", "Chap18", "ArraySeq", "ArraySeqS")), arena);
        assertEquals(Set.of(CHAP18_SEQ), visible);
    }

    @Test
    void moduleNeverSeesItselfAndNonGlobImportsAreIgnored() {
        var strategy = strategy(ReceiverScope.ALL_MODULES);
        var imports = List.of(
                glob("crate", "Chap18", "ArraySeq", "ArraySeq"),
                new ImportRecord("src/User.rs", "Types", false, List.of("crate", "Types")));

        assertEquals(Set.of(), strategy.visibleModules(CHAP18_SEQ, imports, arena));
        assertEquals(Set.of(CHAP18_SEQ), strategy.visibleModules(GRAPH, imports, arena));
    }

    @Test
    void unqualifiedCallsPreferTheOwnModule() {
        var strategy = strategy(ReceiverScope.ALL_MODULES);
        var caller = new FunctionId(GRAPH, "build");
        var visible = Set.of(TYPES);

        assertEquals(
                Set.of(GRAPH),
                strategy.resolveCall(caller, CallSite.unqualified("helper", 3), visible, arena));
        assertEquals(
                Set.of(TYPES),
                strategy.resolveCall(caller, CallSite.unqualified("describe", 3), visible, arena));
        assertEquals(
                Set.of(),
                strategy.resolveCall(caller, CallSite.unqualified("missing", 3), visible, arena));
    }

    @Test
    void qualifiedCallsAcceptEitherAliasSpelling() {
        var strategy = strategy(ReceiverScope.ALL_MODULES);
        var caller = new FunctionId(GRAPH, "build");
        var visible = Set.of(CHAP18_SEQ);

        for (var hint : List.of("ArraySeq", "ArraySeqS")) {
            var site = new CallSite(CallKind.QUALIFIED_PATH, "map_par", List.of(hint), 7);
            assertEquals(Set.of(CHAP18_SEQ), strategy.resolveCall(caller, site, visible, arena), hint);
        }
        var ufcs = new CallSite(CallKind.DISAMBIGUATED_UFCS, "map_par", List.of("ArraySeqS"), 8);
        assertEquals(Set.of(CHAP18_SEQ), strategy.resolveCall(caller, ufcs, visible, arena));
    }

    @Test
    void fullyQualifiedPathsResolveWithoutImport() {
        var strategy = strategy(ReceiverScope.ALL_MODULES);
        var caller = new FunctionId(GRAPH, "build");
        var qualified = new CallSite(
                CallKind.QUALIFIED_PATH, "new", List.of("crate", "Chap19", "ArraySeq", "ArraySeq"), 5);
        var unqualifiedType = new CallSite(CallKind.QUALIFIED_PATH, "new", List.of("ArraySeq"), 6);

        assertEquals(Set.of(CHAP19_SEQ), strategy.resolveCall(caller, qualified, Set.of(), arena));
        assertEquals(Set.of(), strategy.resolveCall(caller, unqualifiedType, Set.of(), arena));
    }

    @Test
    void selfPathsResolveToTheOwnModule() {
        var site = new CallSite(CallKind.QUALIFIED_PATH, "helper", List.of("Self"), 2);
        assertEquals(
                Set.of(GRAPH),
                strategy(ReceiverScope.ALL_MODULES)
                        .resolveCall(new FunctionId(GRAPH, "build"), site, Set.of(TYPES), arena));
    }

    @Test
    void receiverScopeControlsMethodCallTargets() {
        var caller = new FunctionId(GRAPH, "build");
        var site = CallSite.receiver("map_par", 4);

        assertEquals(
                Set.of(CHAP18_SEQ, CHAP19_SEQ),
                strategy(ReceiverScope.ALL_MODULES).resolveCall(caller, site, Set.of(), arena));
        assertEquals(
                Set.of(CHAP18_SEQ),
                strategy(ReceiverScope.VISIBLE_MODULES).resolveCall(caller, site, Set.of(CHAP18_SEQ), arena));
    }
}
