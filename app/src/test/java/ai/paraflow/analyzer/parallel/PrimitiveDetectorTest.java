package ai.paraflow.analyzer.parallel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.paraflow.testutil.RustSnippets;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PrimitiveDetectorTest {

    private static final String SOURCE =
            """
            use rayon::prelude::*;

            pub fn sum_par(v: &Vec<u64>) -> u64 {
                v.par_iter().sum()
            }

            pub fn both(a: u64, b: u64) -> (u64, u64) {
                rayon::join(|| a + 1, || b + 1)
            }

            pub fn threads() {
                let handle = std::thread::spawn(move || 42);
                handle.join().unwrap();
            }

            pub fn pair(a: u64, b: u64) {
                let _ = ParaPair!(move || a, move || b);
            }

            pub fn aliased_pair(a: u64) {
                let _ = crate::ParaPair!(move || a, move || a);
            }

            pub fn in_closure(a: u64) -> u64 {
                let f = move || {
                    let (x, y) = join(|| a, || a);
                    x + y
                };
                f()
            }

            pub fn sequential(v: &Vec<u64>) -> usize {
                let spawn = v.len();
                v.iter().map(|x| x * 2).count() + spawn
            }

            pub fn spawn_count() -> usize {
                0
            }
            """;

    private final PrimitiveDetector detector = new PrimitiveDetector(PrimitiveVocabulary.DEFAULT);

    private Optional<String> primitiveOf(String function) {
        var parsed = RustSnippets.parse(SOURCE);
        return detector.findPrimitive(RustSnippets.function(parsed, function), parsed.content());
    }

    @Test
    void methodCallsAreMatchedByMethodName() {
        assertEquals(Optional.of("par_iter"), primitiveOf("sum_par"));
    }

    @Test
    void freeCallsAreMatchedByLastSegment() {
        assertEquals(Optional.of("join"), primitiveOf("both"));
        assertEquals(Optional.of("spawn"), primitiveOf("threads"));
    }

    @Test
    void macrosAreMatchedOnAnySegment() {
        assertEquals(Optional.of("ParaPair"), primitiveOf("pair"));
        assertEquals(Optional.of("ParaPair"), primitiveOf("aliased_pair"));
    }

    @Test
    void primitivesInsideClosuresCountForTheEnclosingFunction() {
        assertEquals(Optional.of("join"), primitiveOf("in_closure"));
    }

    @Test
    void namesThatAreNotCalledDoNotCount() {
        assertEquals(Optional.empty(), primitiveOf("sequential"));
        assertEquals(Optional.empty(), primitiveOf("spawn_count"));
    }

    @Test
    void vocabularyIsConfigurable() {
        var custom = new PrimitiveDetector(new PrimitiveVocabulary(Set.of("fork"), Set.of(), Set.of()));
        var parsed = RustSnippets.parse(
                """
                fn a(p: Pool) { p.fork(); }
                fn b(v: Vec<u32>) { v.par_iter(); }
                """);

        assertTrue(custom.isInherentlyParallel(RustSnippets.function(parsed, "a"), parsed.content()));
        assertFalse(custom.isInherentlyParallel(RustSnippets.function(parsed, "b"), parsed.content()));
    }
}
