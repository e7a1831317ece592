package ai.paraflow.analyzer;

import java.util.List;
import java.util.Objects;

/**
 * One imported path of a {@code use} declaration.
 *
 * @param fileId the importing file, relative to the analysis root
 * @param name the imported simple name; for a glob import the last path segment before the wildcard
 * @param glob whether the import ends in a wildcard
 * @param path all path segments, including {@code name} as the last one
 */
public record ImportRecord(String fileId, String name, boolean glob, List<String> path) {

    public ImportRecord {
        Objects.requireNonNull(fileId, "fileId");
        Objects.requireNonNull(name, "name");
        path = List.copyOf(path);
    }
}
