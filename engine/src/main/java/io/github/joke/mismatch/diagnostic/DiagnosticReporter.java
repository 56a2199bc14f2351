package io.github.joke.mismatch.diagnostic;

import static java.util.Collections.emptySet;
import static java.util.stream.Collectors.toUnmodifiableSet;

import io.github.joke.mismatch.di.EngineScoped;
import io.github.joke.mismatch.engine.EngineConfig;
import io.github.joke.mismatch.ty.AdtItem;
import io.github.joke.mismatch.ty.Ty;
import io.github.joke.mismatch.ty.TyAdt;
import io.github.joke.mismatch.ty.TypeRenderer;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import javax.inject.Inject;

/** Renders types for diagnostic text, qualifying names that would otherwise read the same. */
@EngineScoped
public class DiagnosticReporter {

    private final TypeRenderer renderer;
    private final boolean qualifyConflictingNames;

    @Inject
    DiagnosticReporter(TypeRenderer renderer, EngineConfig config) {
        this.renderer = renderer;
        this.qualifyConflictingNames = config.isQualifyConflictingNames();
    }

    public String expectedFound(Ty expected, Ty actual) {
        Set<AdtItem> qualify = conflictingNames(expected, actual);
        return "expected `" + renderer.render(expected, qualify) + "`, found `" + renderer.render(actual, qualify)
                + "`";
    }

    public String render(Ty ty) {
        return renderer.render(ty, conflictingNames(ty));
    }

    /** Items referenced by {@code tys} whose short name is shared with a different referenced item. */
    public Set<AdtItem> conflictingNames(Ty... tys) {
        if (!qualifyConflictingNames) {
            return emptySet();
        }
        Map<String, Set<AdtItem>> byName = new LinkedHashMap<>();
        for (Ty ty : tys) {
            ty.forEachNode(node -> {
                if (node instanceof TyAdt) {
                    AdtItem item = ((TyAdt) node).getItem();
                    byName.computeIfAbsent(item.getName(), name -> new LinkedHashSet<>())
                            .add(item);
                }
            });
        }
        return byName.values().stream()
                .filter(items -> items.size() > 1)
                .flatMap(Set::stream)
                .collect(toUnmodifiableSet());
    }
}
