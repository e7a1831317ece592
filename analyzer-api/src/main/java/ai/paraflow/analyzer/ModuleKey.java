package ai.paraflow.analyzer;

import java.util.Objects;

/**
 * Identity of an analyzed module: the chapter qualifier (possibly empty) plus the module's base name. Two modules that
 * share a base name but live in different chapters are distinct keys.
 */
public record ModuleKey(String chapter, String name) implements Comparable<ModuleKey> {

    public ModuleKey {
        Objects.requireNonNull(chapter, "chapter");
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Module name must not be blank");
        }
        if (chapter.contains("/") || name.contains("/")) {
            throw new IllegalArgumentException("Module key parts must not contain '/': " + chapter + ", " + name);
        }
    }

    /** A module without a chapter qualifier. */
    public static ModuleKey of(String name) {
        return new ModuleKey("", name);
    }

    /** Parses the textual form produced by {@link #key()}. */
    public static ModuleKey parse(String key) {
        int slash = key.indexOf('/');
        if (slash < 0) {
            return of(key);
        }
        return new ModuleKey(key.substring(0, slash), key.substring(slash + 1));
    }

    public boolean hasChapter() {
        return !chapter.isEmpty();
    }

    /** {@code chapter/name}, or just {@code name} for modules outside any chapter. */
    public String key() {
        return hasChapter() ? chapter + "/" + name : name;
    }

    @Override
    public int compareTo(ModuleKey other) {
        return key().compareTo(other.key());
    }

    @Override
    public String toString() {
        return key();
    }
}
