package ai.paraflow.analyzer.parallel;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ai.paraflow.analyzer.ImportRecord;
import ai.paraflow.testutil.RustSnippets;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class GlobImportResolverTest {

    @Test
    void recordsEveryImportAndMarksGlobs() {
        var parsed = RustSnippets.parse(
                """
                use std::collections::HashMap;
                use crate::Chap18::ArraySeq::ArraySeq::*;
                use crate::Types::Types::*;
                use crate::{Chap05::SetStEph::SetStEph::*, Chap06::Graph::Graph as G};

                pub mod inner {
                    use crate::Chap19::Seq::Seq::*;
                }
                """);

        var imports = new GlobImportResolver().extractImports(parsed.root(), parsed.content(), "src/User.rs");

        assertEquals(
                List.of(
                        new ImportRecord("src/User.rs", "HashMap", false, List.of("std", "collections", "HashMap")),
                        new ImportRecord(
                                "src/User.rs", "ArraySeq", true, List.of("crate", "Chap18", "ArraySeq", "ArraySeq")),
                        new ImportRecord("src/User.rs", "Types", true, List.of("crate", "Types", "Types")),
                        new ImportRecord(
                                "src/User.rs", "SetStEph", true, List.of("crate", "Chap05", "SetStEph", "SetStEph")),
                        new ImportRecord("src/User.rs", "Graph", false, List.of("crate", "Chap06", "Graph", "Graph")),
                        new ImportRecord("src/User.rs", "Seq", true, List.of("crate", "Chap19", "Seq", "Seq"))),
                imports);
    }

    @Test
    void globCandidatesAreTheSegmentsBeforeTheWildcard() {
        var parsed = RustSnippets.parse(
                """
                use crate::Chap18::ArraySeq::ArraySeq::*;
                use crate::Chap18::ArraySeq::ArraySeq::ArraySeqS;
                use super::Helpers::*;
                """);

        var imports = new GlobImportResolver().extractImports(parsed.root(), parsed.content(), "src/User.rs");

        assertEquals(Set.of("ArraySeq", "Helpers"), GlobImportResolver.globCandidates(imports));
    }
}
