package ai.paraflow.analyzer.parallel;

import ai.paraflow.analyzer.ImportRecord;
import ai.paraflow.analyzer.ModuleKey;
import ai.paraflow.analyzer.ProjectFile;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/** Arena entry for one module: its file, its functions in source order, its imports and what they make visible. */
public final class ModuleRecord {
    private final ModuleKey key;
    private final ProjectFile file;
    private final List<ImportRecord> imports;
    private final List<FunctionRecord> functions = new ArrayList<>();
    private Set<ModuleKey> visible = Set.of();

    ModuleRecord(ModuleKey key, ProjectFile file, List<ImportRecord> imports) {
        this.key = key;
        this.file = file;
        this.imports = List.copyOf(imports);
    }

    void addFunction(FunctionRecord function) {
        functions.add(function);
    }

    void setVisible(Set<ModuleKey> visible) {
        this.visible = Set.copyOf(visible);
    }

    public ModuleKey key() {
        return key;
    }

    public ProjectFile file() {
        return file;
    }

    public List<ImportRecord> imports() {
        return imports;
    }

    public List<FunctionRecord> functions() {
        return Collections.unmodifiableList(functions);
    }

    public Set<ModuleKey> visible() {
        return visible;
    }
}
