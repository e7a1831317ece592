package ai.paraflow.analyzer.parallel;

import static ai.paraflow.analyzer.rust.RustTreeSitterNodeTypes.FIELD_NAME;
import static ai.paraflow.analyzer.rust.RustTreeSitterNodeTypes.FUNCTION_ITEM;

import ai.paraflow.analyzer.ASTTraversalUtils;
import ai.paraflow.analyzer.rust.ParseResult;
import java.util.ArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Runs primitive detection, call collection and import extraction over one parsed file. */
public final class FileSummarizer {
    private static final Logger log = LogManager.getLogger(FileSummarizer.class);

    private final ModuleKeys moduleKeys;
    private final PrimitiveDetector detector;
    private final CallSiteCollector collector;
    private final GlobImportResolver importResolver;

    public FileSummarizer(ModuleKeys moduleKeys, PrimitiveDetector detector) {
        this.moduleKeys = moduleKeys;
        this.detector = detector;
        this.collector = new CallSiteCollector();
        this.importResolver = new GlobImportResolver();
    }

    public FileSummary summarize(ParseResult.Parsed parsed) {
        var file = parsed.file();
        var content = parsed.content();
        var root = parsed.root();
        var module = moduleKeys.forFile(file);

        var functions = new ArrayList<FunctionSummary>();
        for (var item : ASTTraversalUtils.findAllNodesByType(root, FUNCTION_ITEM)) {
            var name = ASTTraversalUtils.extractNodeText(ASTTraversalUtils.field(item, FIELD_NAME), content);
            if (name.isEmpty()) {
                continue;
            }
            functions.add(new FunctionSummary(
                    name,
                    ASTTraversalUtils.lineOf(item),
                    detector.isInherentlyParallel(item, content),
                    collector.collect(item, content)));
        }
        var imports = importResolver.extractImports(root, content, file.toString());

        log.debug(
                "{}: module {}, {} functions, {} imports ({} glob)",
                file,
                module,
                functions.size(),
                imports.size(),
                GlobImportResolver.globCandidates(imports).size());
        return new FileSummary(file, module, functions, imports);
    }
}
