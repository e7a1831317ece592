package ai.paraflow.analyzer.parallel;

import static ai.paraflow.analyzer.rust.RustTreeSitterNodeTypes.*;

import ai.paraflow.analyzer.ASTTraversalUtils;
import ai.paraflow.analyzer.ImportRecord;
import ai.paraflow.analyzer.SourceContent;
import ai.paraflow.analyzer.rust.RustPaths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Extracts the imports of a file. Every {@code use} declaration is recorded, at any nesting depth; only glob imports
 * make a module's names visible, since they are the only way an unqualified name can come from another module.
 */
public final class GlobImportResolver {

    public List<ImportRecord> extractImports(TSNode root, SourceContent source, String fileId) {
        var records = new ArrayList<ImportRecord>();
        for (var use : ASTTraversalUtils.findAllNodesByType(root, USE_DECLARATION)) {
            collect(ASTTraversalUtils.field(use, FIELD_ARGUMENT), List.of(), source, fileId, records);
        }
        return records;
    }

    /** Candidate module names: the last path segment in front of each wildcard. */
    public static Set<String> globCandidates(List<ImportRecord> imports) {
        var names = new LinkedHashSet<String>();
        for (var record : imports) {
            if (record.glob()) {
                names.add(record.name());
            }
        }
        return names;
    }

    private void collect(
            @Nullable TSNode clause,
            List<String> prefix,
            SourceContent source,
            String fileId,
            List<ImportRecord> out) {
        if (ASTTraversalUtils.isAbsent(clause)) {
            return;
        }
        switch (clause.getType()) {
            case USE_WILDCARD -> {
                var children = ASTTraversalUtils.namedChildren(clause);
                var path = concat(prefix, children.isEmpty() ? List.of() : RustPaths.segments(children.get(0), source));
                add(path, true, fileId, out);
            }
            case SCOPED_USE_LIST -> {
                var path = concat(prefix, RustPaths.segments(ASTTraversalUtils.field(clause, FIELD_PATH), source));
                collect(ASTTraversalUtils.field(clause, FIELD_LIST), path, source, fileId, out);
            }
            case USE_LIST -> {
                for (var child : ASTTraversalUtils.namedChildren(clause)) {
                    collect(child, prefix, source, fileId, out);
                }
            }
            case USE_AS_CLAUSE -> add(
                    concat(prefix, RustPaths.segments(ASTTraversalUtils.field(clause, FIELD_PATH), source)),
                    false,
                    fileId,
                    out);
            default -> add(concat(prefix, RustPaths.segments(clause, source)), false, fileId, out);
        }
    }

    private static void add(List<String> path, boolean glob, String fileId, List<ImportRecord> out) {
        if (!path.isEmpty()) {
            out.add(new ImportRecord(fileId, path.get(path.size() - 1), glob, path));
        }
    }

    private static List<String> concat(List<String> prefix, List<String> segments) {
        var path = new ArrayList<String>(prefix.size() + segments.size());
        path.addAll(prefix);
        path.addAll(segments);
        return path;
    }
}
