package ai.paraflow.analyzer.parallel;

/** An analysis run could not complete. Per-file problems never raise this; they become {@link FileFailure}s. */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
