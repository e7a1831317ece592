package ai.paraflow.analyzer.parallel;

import ai.paraflow.analyzer.ProjectFile;

/** A file left out of the analysis, with the reason. Failures are reported, never fatal. */
public record FileFailure(ProjectFile file, int line, String reason) {}
