package ai.paraflow.analyzer.parallel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Names that mark a call as a parallel primitive.
 *
 * @param methods method-call names, matched against {@code expr.name(...)}
 * @param functions free-call names, matched against the last segment of {@code a::b::name(...)}
 * @param macros macro names, matched against every segment of the macro path
 */
public record PrimitiveVocabulary(Set<String> methods, Set<String> functions, Set<String> macros) {

    public static final PrimitiveVocabulary DEFAULT = new PrimitiveVocabulary(
            Set.of("spawn", "join", "par_iter", "into_par_iter", "par_chunks", "par_bridge"),
            Set.of("spawn", "join", "ParaPair"),
            Set.of("ParaPair"));

    public PrimitiveVocabulary {
        methods = Set.copyOf(methods);
        functions = Set.copyOf(functions);
        macros = Set.copyOf(macros);
    }

    /** Json factory; an omitted list keeps its default. */
    @JsonCreator
    public static PrimitiveVocabulary fromJson(
            @JsonProperty("methods") @Nullable Set<String> methods,
            @JsonProperty("functions") @Nullable Set<String> functions,
            @JsonProperty("macros") @Nullable Set<String> macros) {
        return new PrimitiveVocabulary(
                methods != null ? methods : DEFAULT.methods,
                functions != null ? functions : DEFAULT.functions,
                macros != null ? macros : DEFAULT.macros);
    }
}
