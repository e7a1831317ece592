package ai.paraflow.analyzer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Abstraction for a filename relative to the analysis root. This exists to make it less difficult to ensure that
 * different filename objects can be meaningfully compared, unlike bare Paths which may or may not be absolute.
 */
public final class ProjectFile implements Comparable<ProjectFile> {
    private final Path root;
    private final Path relPath;

    public ProjectFile(Path root, Path relPath) {
        // Relative roots are accepted and normalized so that tests can pass temporary or relative directories.
        var normalizedRoot = root.isAbsolute() ? root.normalize() : root.toAbsolutePath().normalize();
        if (relPath.isAbsolute()) {
            throw new IllegalArgumentException("RelPath must be relative, got " + relPath);
        }
        this.root = normalizedRoot;
        this.relPath = relPath.normalize();
    }

    public ProjectFile(Path root, String relName) {
        this(root, Path.of(relName));
    }

    /** The file relative to {@code root} when it lives below it, otherwise relative to its own directory. */
    public static ProjectFile under(Path root, Path file) {
        var absRoot = root.toAbsolutePath().normalize();
        var absFile = file.toAbsolutePath().normalize();
        if (absFile.startsWith(absRoot) && !absFile.equals(absRoot)) {
            return new ProjectFile(absRoot, absRoot.relativize(absFile));
        }
        return new ProjectFile(Objects.requireNonNull(absFile.getParent()), absFile.getFileName());
    }

    public Path getRoot() {
        return root;
    }

    public Path getRelPath() {
        return relPath;
    }

    public Path absPath() {
        return root.resolve(relPath);
    }

    public String getFileName() {
        return relPath.getFileName().toString();
    }

    /** File name without its extension. */
    public String getStem() {
        var name = getFileName();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /** Name of the directory that contains this file, or null at the file system root. */
    public @Nullable String getDirectoryName() {
        var parent = absPath().getParent();
        if (parent == null || parent.getFileName() == null) {
            return null;
        }
        return parent.getFileName().toString();
    }

    public String read() throws IOException {
        return Files.readString(absPath(), StandardCharsets.UTF_8);
    }

    @Override
    public int compareTo(ProjectFile other) {
        return absPath().compareTo(other.absPath());
    }

    @Override
    public String toString() {
        return relPath.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectFile projectFile)) return false;
        return Objects.equals(root, projectFile.root) && Objects.equals(relPath, projectFile.relPath);
    }

    @Override
    public int hashCode() {
        return relPath.hashCode();
    }
}
