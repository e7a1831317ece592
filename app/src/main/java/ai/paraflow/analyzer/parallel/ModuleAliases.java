package ai.paraflow.analyzer.parallel;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Name variants under which a module can be referenced. A module {@code Foo} conventionally exports its main type as
 * {@code FooS}, so a path through either name may point at the same module.
 */
public final class ModuleAliases {

    private final String marker;

    public ModuleAliases(String marker) {
        if (marker.length() != 1) {
            throw new IllegalArgumentException("Alias marker must be a single character, got '" + marker + "'");
        }
        this.marker = marker;
    }

    /** The literal name first, then the name with the marker stripped (when it ends with it) or added. */
    public Set<String> candidates(String name) {
        var candidates = new LinkedHashSet<String>();
        candidates.add(name);
        if (name.endsWith(marker) && name.length() > 1) {
            candidates.add(name.substring(0, name.length() - 1));
        } else {
            candidates.add(name + marker);
        }
        return candidates;
    }
}
