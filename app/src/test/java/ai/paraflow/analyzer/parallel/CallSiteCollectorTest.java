package ai.paraflow.analyzer.parallel;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ai.paraflow.analyzer.CallKind;
import ai.paraflow.analyzer.CallSite;
import ai.paraflow.testutil.RustSnippets;
import java.util.List;
import org.junit.jupiter.api.Test;

class CallSiteCollectorTest {

    private static final String SOURCE =
            """
            impl Foo {
                fn run(&self) {
                    helper(1);
                    Bar::build();
                    <Baz as Trait>::make();
                    self.items.len();
                    collect::<Vec<u32>>();
                    crate::Chap18::ArraySeq::ArraySeq::new();
                    Self::other();
                }

                fn quiet(&self) {}
            }
            """;

    private List<CallSite> sitesOf(String function) {
        var parsed = RustSnippets.parse(SOURCE);
        return new CallSiteCollector().collect(RustSnippets.function(parsed, function), parsed.content());
    }

    @Test
    void classifiesEveryCallShape() {
        var sites = sitesOf("run");

        assertEquals(
                List.of(
                        new CallSite(CallKind.UNQUALIFIED, "helper", List.of(), 3),
                        new CallSite(CallKind.QUALIFIED_PATH, "build", List.of("Bar"), 4),
                        new CallSite(CallKind.DISAMBIGUATED_UFCS, "make", List.of("Baz"), 5),
                        new CallSite(CallKind.RECEIVER_METHOD, "len", List.of(), 6),
                        new CallSite(CallKind.UNQUALIFIED, "collect", List.of(), 7),
                        new CallSite(
                                CallKind.QUALIFIED_PATH,
                                "new",
                                List.of("crate", "Chap18", "ArraySeq", "ArraySeq"),
                                8),
                        new CallSite(CallKind.QUALIFIED_PATH, "other", List.of("Self"), 9)),
                sites);
    }

    @Test
    void emptyBodyHasNoCalls() {
        assertEquals(List.of(), sitesOf("quiet"));
    }
}
