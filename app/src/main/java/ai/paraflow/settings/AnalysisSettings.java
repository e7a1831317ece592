package ai.paraflow.settings;

import ai.paraflow.analyzer.parallel.PrimitiveVocabulary;
import ai.paraflow.analyzer.parallel.ReceiverScope;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.jetbrains.annotations.Nullable;

/**
 * Tunables of an analysis run. Every property is optional in a settings file; omitted ones keep their defaults.
 *
 * @param primitives names that make a function inherently parallel
 * @param chapterPattern regex a directory name must match to act as a module's chapter
 * @param aliasMarker single character a module's exported type name may carry on top of the module name
 * @param receiverScope modules searched for the target of {@code expr.method()} calls
 * @param threads worker threads for parsing, extraction and propagation passes
 * @param lenientParsing analyze files with syntax errors instead of reporting them as failures
 * @param nameContains only analyze files whose name contains this text
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisSettings(
        PrimitiveVocabulary primitives,
        String chapterPattern,
        String aliasMarker,
        ReceiverScope receiverScope,
        int threads,
        boolean lenientParsing,
        @Nullable String nameContains) {

    public static final String DEFAULT_CHAPTER_PATTERN = "Chap.*";
    public static final String DEFAULT_ALIAS_MARKER = "S";

    public AnalysisSettings {
        if (primitives == null) {
            throw new IllegalArgumentException("primitives must not be null");
        }
        if (chapterPattern == null || chapterPattern.isBlank()) {
            throw new IllegalArgumentException("chapterPattern must not be blank");
        }
        try {
            Pattern.compile(chapterPattern);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException(
                    "Invalid chapterPattern '" + chapterPattern + "': " + e.getDescription(), e);
        }
        if (aliasMarker == null || aliasMarker.length() != 1) {
            throw new IllegalArgumentException("aliasMarker must be a single character, got '" + aliasMarker + "'");
        }
        if (receiverScope == null) {
            throw new IllegalArgumentException("receiverScope must not be null");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got " + threads);
        }
        if (nameContains != null && nameContains.isEmpty()) {
            nameContains = null;
        }
    }

    public static AnalysisSettings defaults() {
        return new AnalysisSettings(
                PrimitiveVocabulary.DEFAULT,
                DEFAULT_CHAPTER_PATTERN,
                DEFAULT_ALIAS_MARKER,
                ReceiverScope.ALL_MODULES,
                Runtime.getRuntime().availableProcessors(),
                false,
                null);
    }

    @JsonCreator
    static AnalysisSettings fromJson(
            @JsonProperty("primitives") @Nullable PrimitiveVocabulary primitives,
            @JsonProperty("chapterPattern") @Nullable String chapterPattern,
            @JsonProperty("aliasMarker") @Nullable String aliasMarker,
            @JsonProperty("receiverScope") @Nullable ReceiverScope receiverScope,
            @JsonProperty("threads") @Nullable Integer threads,
            @JsonProperty("lenientParsing") @Nullable Boolean lenientParsing,
            @JsonProperty("nameContains") @Nullable String nameContains) {
        var d = defaults();
        return new AnalysisSettings(
                primitives != null ? primitives : d.primitives,
                chapterPattern != null ? chapterPattern : d.chapterPattern,
                aliasMarker != null ? aliasMarker : d.aliasMarker,
                receiverScope != null ? receiverScope : d.receiverScope,
                threads != null ? threads : d.threads,
                lenientParsing != null ? lenientParsing : d.lenientParsing,
                nameContains);
    }

    public AnalysisSettings withThreads(int threads) {
        return new AnalysisSettings(
                primitives, chapterPattern, aliasMarker, receiverScope, threads, lenientParsing, nameContains);
    }

    public AnalysisSettings withReceiverScope(ReceiverScope receiverScope) {
        return new AnalysisSettings(
                primitives, chapterPattern, aliasMarker, receiverScope, threads, lenientParsing, nameContains);
    }

    public AnalysisSettings withLenientParsing(boolean lenientParsing) {
        return new AnalysisSettings(
                primitives, chapterPattern, aliasMarker, receiverScope, threads, lenientParsing, nameContains);
    }

    public AnalysisSettings withNameContains(@Nullable String nameContains) {
        return new AnalysisSettings(
                primitives, chapterPattern, aliasMarker, receiverScope, threads, lenientParsing, nameContains);
    }
}
