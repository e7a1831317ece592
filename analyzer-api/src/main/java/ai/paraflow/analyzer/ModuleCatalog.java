package ai.paraflow.analyzer;

import java.util.Set;

/** Read-only view of every module taking part in an analysis run and the functions each one defines. */
public interface ModuleCatalog {

    Set<ModuleKey> modules();

    /** All chapter variants of a module base name. */
    Set<ModuleKey> modulesNamed(String name);

    boolean defines(ModuleKey module, String function);

    Set<ModuleKey> modulesDefining(String function);
}
