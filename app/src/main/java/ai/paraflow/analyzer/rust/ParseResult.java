package ai.paraflow.analyzer.rust;

import ai.paraflow.analyzer.ProjectFile;
import ai.paraflow.analyzer.SourceContent;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * Outcome of parsing one source file.
 *
 * <ul>
 *   <li>Parsed: the syntax tree and the text it was built from
 *   <li>Failed: the file could not be read or did not parse; it takes no further part in the analysis
 * </ul>
 */
public sealed interface ParseResult permits ParseResult.Parsed, ParseResult.Failed {

    ProjectFile file();

    record Parsed(ProjectFile file, SourceContent content, TSTree tree) implements ParseResult {
        public TSNode root() {
            return tree.getRootNode();
        }
    }

    record Failed(ProjectFile file, String reason, int line) implements ParseResult {
        @Override
        public String toString() {
            return "Failed{file=" + file + ", line=" + line + ", reason=" + reason + "}";
        }
    }
}
