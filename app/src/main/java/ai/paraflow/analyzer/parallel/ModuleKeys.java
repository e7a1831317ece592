package ai.paraflow.analyzer.parallel;

import ai.paraflow.analyzer.ModuleKey;
import ai.paraflow.analyzer.ProjectFile;
import java.util.List;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/** Derives module identities from file locations and recognizes chapter segments in paths. */
public final class ModuleKeys {

    private final Pattern chapterPattern;

    public ModuleKeys(String chapterPattern) {
        this.chapterPattern = Pattern.compile(chapterPattern);
    }

    /** {@code src/Chap06/DirGraphMtEph.rs} becomes {@code Chap06/DirGraphMtEph}; other files get no chapter. */
    public ModuleKey forFile(ProjectFile file) {
        var directory = file.getDirectoryName();
        var chapter = directory != null && isChapter(directory) ? directory : "";
        return new ModuleKey(chapter, file.getStem());
    }

    public boolean isChapter(String segment) {
        return chapterPattern.matcher(segment).matches();
    }

    /** The last chapter segment of a path, if any. */
    public @Nullable String chapterIn(List<String> segments) {
        for (int i = segments.size() - 1; i >= 0; i--) {
            if (isChapter(segments.get(i))) {
                return segments.get(i);
            }
        }
        return null;
    }
}
