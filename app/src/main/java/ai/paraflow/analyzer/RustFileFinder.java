package ai.paraflow.analyzer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Expands files and directories into the {@code .rs} files to analyze, relative to a base directory. */
public final class RustFileFinder {
    private static final Logger logger = LogManager.getLogger(RustFileFinder.class);

    static final Set<String> SKIPPED_DIRECTORIES = Set.of("target", "attic");

    private final Path baseDir;
    private final @Nullable String nameContains;

    public RustFileFinder(Path baseDir, @Nullable String nameContains) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.nameContains = nameContains;
    }

    /**
     * Finds Rust files below {@code paths}; relative paths are resolved against the base directory. With no paths the
     * base directory's {@code src} directory is searched.
     *
     * @throws IOException if a path does not exist or a directory cannot be listed
     */
    public List<ProjectFile> find(List<Path> paths) throws IOException {
        var roots = paths.isEmpty() ? List.of(baseDir.resolve("src")) : paths.stream().map(baseDir::resolve).toList();
        var found = new TreeSet<ProjectFile>();
        for (var root : roots) {
            if (!Files.exists(root)) {
                throw new IOException("No such file or directory: " + root);
            }
            if (Files.isDirectory(root)) {
                try (Stream<Path> walk = Files.walk(root)) {
                    walk.filter(Files::isRegularFile)
                            .filter(p -> !isInSkippedDirectory(root, p))
                            .filter(this::accepts)
                            .forEach(p -> found.add(ProjectFile.under(baseDir, p)));
                } catch (UncheckedIOException e) {
                    throw e.getCause();
                }
            } else if (accepts(root)) {
                found.add(ProjectFile.under(baseDir, root));
            }
        }
        logger.debug("Found {} Rust files under {}", found.size(), roots);
        return List.copyOf(found);
    }

    private boolean accepts(Path file) {
        var name = file.getFileName().toString();
        return name.endsWith(".rs") && (nameContains == null || name.contains(nameContains));
    }

    private static boolean isInSkippedDirectory(Path root, Path file) {
        var relative = root.relativize(file);
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            var segment = relative.getName(i).toString();
            if (SKIPPED_DIRECTORIES.contains(segment) || segment.startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
