package io.github.joke.mismatch.testing;

import static java.util.stream.Collectors.toList;

import io.github.joke.mismatch.resolve.AssociatedType;
import io.github.joke.mismatch.resolve.KnownItems;
import io.github.joke.mismatch.resolve.ProjectionResult;
import io.github.joke.mismatch.resolve.TraitItem;
import io.github.joke.mismatch.resolve.TraitOracle;
import io.github.joke.mismatch.resolve.TraitRef;
import io.github.joke.mismatch.ty.Ty;
import io.github.joke.mismatch.ty.TyReference;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jspecify.annotations.Nullable;

/**
 * Table-driven trait environment. Implementations are matched by exact trait, self type and
 * substitution; user-defined {@code Deref} steps form a directed graph that must stay acyclic.
 */
public final class InMemoryTraitOracle implements TraitOracle {

    private final List<ImplDef> impls;
    private final Graph<Ty, DefaultEdge> derefs;
    private final KnownItems knownItems;

    private InMemoryTraitOracle(List<ImplDef> impls, Graph<Ty, DefaultEdge> derefs, KnownItems knownItems) {
        this.impls = impls;
        this.derefs = derefs;
        this.knownItems = knownItems;
    }

    public static Builder builder(KnownItems knownItems) {
        return new Builder(knownItems);
    }

    @Override
    public boolean canSelect(TraitRef ref) {
        return impls.stream().anyMatch(impl -> impl.matches(ref));
    }

    @Override
    public ProjectionResult selectProjectionStrict(TraitRef ref, AssociatedType associatedType) {
        List<ImplDef> candidates = impls.stream().filter(impl -> impl.matches(ref)).collect(toList());
        if (candidates.isEmpty()) {
            return ProjectionResult.noImpl();
        }
        if (candidates.size() > 1) {
            return ProjectionResult.ambiguous();
        }
        @Nullable Ty bound = candidates.get(0).getAssociatedTypes().get(associatedType.getName());
        return bound == null ? ProjectionResult.noBinding() : ProjectionResult.ok(bound);
    }

    @Override
    public Iterable<Ty> coercionSequence(Ty ty) {
        return () -> new Iterator<Ty>() {
            private @Nullable Ty next = ty;

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public Ty next() {
                Ty current = next;
                if (current == null) {
                    throw new NoSuchElementException();
                }
                next = derefStep(current);
                return current;
            }
        };
    }

    @Override
    public KnownItems knownItems() {
        return knownItems;
    }

    private @Nullable Ty derefStep(Ty ty) {
        if (ty instanceof TyReference) {
            return ((TyReference) ty).getReferenced();
        }
        if (!derefs.containsVertex(ty)) {
            return null;
        }
        Set<DefaultEdge> outgoing = derefs.outgoingEdgesOf(ty);
        return outgoing.isEmpty() ? null : derefs.getEdgeTarget(outgoing.iterator().next());
    }

    public static final class Builder {

        private final KnownItems knownItems;
        private final List<ImplDef> impls = new ArrayList<>();
        private final Graph<Ty, DefaultEdge> derefs = new DefaultDirectedGraph<>(DefaultEdge.class);

        private Builder(KnownItems knownItems) {
            this.knownItems = knownItems;
        }

        public Builder impl(ImplDef impl) {
            impls.add(impl);
            return this;
        }

        public Builder impl(TraitItem trait, Ty selfTy, Ty... substitution) {
            return impl(ImplDef.of(trait, selfTy, substitution));
        }

        /**
         * Declares {@code impl Deref<Target = target> for source}.
         *
         * @throws IllegalArgumentException if {@code source} already dereferences to something else or
         *     the new step would make a dereference chain loop forever
         */
        public Builder deref(Ty source, Ty target) {
            derefs.addVertex(source);
            derefs.addVertex(target);
            if (derefs.outDegreeOf(source) > 0) {
                throw new IllegalArgumentException("`" + source + "` already implements Deref");
            }
            DefaultEdge edge = derefs.addEdge(source, target);
            if (new CycleDetector<>(derefs).detectCyclesContainingVertex(source)) {
                derefs.removeEdge(edge);
                throw new IllegalArgumentException("Deref from `" + source + "` to `" + target + "` forms a cycle");
            }
            return this;
        }

        public InMemoryTraitOracle build() {
            Graph<Ty, DefaultEdge> copy = new DefaultDirectedGraph<>(DefaultEdge.class);
            Graphs.addGraph(copy, derefs);
            return new InMemoryTraitOracle(List.copyOf(impls), new AsUnmodifiableGraph<>(copy), knownItems);
        }
    }
}
