package ai.paraflow.analyzer.parallel;

import ai.paraflow.analyzer.ModuleKey;
import org.jetbrains.annotations.Nullable;

/**
 * One completed propagation pass.
 *
 * @param module the module an intra-module pass ran in; null for inter-module passes
 * @param pass 1-based pass number, counted per module for intra-module passes and per run for inter-module passes
 * @param added functions newly flagged by this pass
 * @param totalFlagged flagged functions after the pass was merged
 */
public record PassEvent(Phase phase, @Nullable ModuleKey module, int pass, int added, int totalFlagged) {

    public enum Phase {
        INTRA_MODULE,
        INTER_MODULE
    }
}
