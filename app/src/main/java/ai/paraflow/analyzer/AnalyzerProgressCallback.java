package ai.paraflow.analyzer;

/**
 * Callback interface for reporting progress while files are parsed and summarized. Implementations should be
 * thread-safe as they are called from worker threads.
 */
@FunctionalInterface
public interface AnalyzerProgressCallback {
    /**
     * Called once per processed item.
     *
     * @param completed Number of items completed
     * @param total Total number of items to process
     * @param description Description of the current operation (e.g., "Parsing Rust files")
     */
    void onProgress(int completed, int total, String description);

    /** No-op implementation that ignores all progress updates. */
    AnalyzerProgressCallback NOOP = (completed, total, description) -> {};
}
