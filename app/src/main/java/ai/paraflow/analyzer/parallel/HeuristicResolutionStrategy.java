package ai.paraflow.analyzer.parallel;

import ai.paraflow.analyzer.CallSite;
import ai.paraflow.analyzer.FunctionId;
import ai.paraflow.analyzer.ImportRecord;
import ai.paraflow.analyzer.ModuleCatalog;
import ai.paraflow.analyzer.ModuleKey;
import ai.paraflow.analyzer.ResolutionStrategy;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;

/**
 * Name-based resolution: modules are matched by file stem (with alias variants), calls by the names modules define.
 * Ambiguous calls resolve to every matching module.
 */
public final class HeuristicResolutionStrategy implements ResolutionStrategy {

    private final ModuleAliases aliases;
    private final ModuleKeys moduleKeys;
    private final ReceiverScope receiverScope;

    public HeuristicResolutionStrategy(ModuleAliases aliases, ModuleKeys moduleKeys, ReceiverScope receiverScope) {
        this.aliases = aliases;
        this.moduleKeys = moduleKeys;
        this.receiverScope = receiverScope;
    }

    @Override
    public Set<ModuleKey> visibleModules(ModuleKey importer, List<ImportRecord> imports, ModuleCatalog catalog) {
        var visible = new TreeSet<ModuleKey>();
        for (var record : imports) {
            if (!record.glob()) {
                continue;
            }
            var path = record.path();
            var pinned = moduleKeys.chapterIn(path.subList(0, Math.max(0, path.size() - 1)));
            for (var candidate : aliases.candidates(record.name())) {
                visible.addAll(pickVariants(catalog.modulesNamed(candidate), pinned, importer.chapter()));
            }
        }
        visible.remove(importer);
        return visible;
    }

    /** A chapter named in the import path wins; otherwise the importer's chapter is preferred over the others. */
    private static Set<ModuleKey> pickVariants(
            Set<ModuleKey> variants, @Nullable String pinned, String importerChapter) {
        if (pinned != null) {
            return variants.stream().filter(m -> m.chapter().equals(pinned)).collect(Collectors.toSet());
        }
        var local = variants.stream()
                .filter(m -> m.chapter().equals(importerChapter))
                .collect(Collectors.toSet());
        return local.isEmpty() ? variants : local;
    }

    @Override
    public Set<ModuleKey> resolveCall(FunctionId caller, CallSite site, Set<ModuleKey> visible, ModuleCatalog catalog) {
        var own = caller.module();
        var name = site.calleeName();
        return switch (site.kind()) {
            case UNQUALIFIED -> {
                if (catalog.defines(own, name)) {
                    yield Set.of(own);
                }
                yield definedIn(visible, name, catalog);
            }
            case QUALIFIED_PATH, DISAMBIGUATED_UFCS -> resolveQualified(own, site, visible, catalog);
            case RECEIVER_METHOD -> switch (receiverScope) {
                case ALL_MODULES -> catalog.modulesDefining(name);
                case VISIBLE_MODULES -> {
                    var scope = new TreeSet<>(visible);
                    scope.add(own);
                    yield definedIn(scope, name, catalog);
                }
            };
        };
    }

    private Set<ModuleKey> resolveQualified(
            ModuleKey own, CallSite site, Set<ModuleKey> visible, ModuleCatalog catalog) {
        var name = site.calleeName();
        var hint = site.typeHint();
        if (hint == null) {
            return Set.of();
        }
        if (hint.equals("Self") || hint.equals("self")) {
            return catalog.defines(own, name) ? Set.of(own) : Set.of();
        }
        var candidates = aliases.candidates(hint);
        if (candidates.contains(own.name()) && catalog.defines(own, name)) {
            return Set.of(own);
        }
        var matched = visible.stream()
                .filter(m -> candidates.contains(m.name()) && catalog.defines(m, name))
                .collect(Collectors.toCollection(TreeSet::new));
        if (!matched.isEmpty()) {
            return matched;
        }
        // crate::Chap18::Foo::Foo::f() names its module without importing it
        var qualifier = site.qualifier();
        var chapter = moduleKeys.chapterIn(qualifier.subList(0, qualifier.size() - 1));
        if (chapter == null) {
            return Set.of();
        }
        var qualified = new TreeSet<ModuleKey>();
        for (var candidate : candidates) {
            for (var module : catalog.modulesNamed(candidate)) {
                if (module.chapter().equals(chapter) && catalog.defines(module, name)) {
                    qualified.add(module);
                }
            }
        }
        return qualified;
    }

    private static Set<ModuleKey> definedIn(Set<ModuleKey> modules, String name, ModuleCatalog catalog) {
        return modules.stream()
                .filter(m -> catalog.defines(m, name))
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
