package io.github.joke.mismatch.coercion;

import io.github.joke.mismatch.di.RequestScoped;
import io.github.joke.mismatch.resolve.TraitOracle;
import io.github.joke.mismatch.syntax.SyntaxHandle;
import io.github.joke.mismatch.ty.Mutability;
import io.github.joke.mismatch.ty.Ty;
import io.github.joke.mismatch.ty.TyReference;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import org.jspecify.annotations.Nullable;

/**
 * Finds a way from the actual type to the expected type through dereferences followed by references.
 *
 * <p>The expected type is peeled into the mutabilities of its reference layers and a map from every
 * peeled type to its depth; for {@code &mut &i32} that is {@code [MUTABLE, IMMUTABLE]} and
 * {@code {&mut &i32 -> 0, &i32 -> 1, i32 -> 2}}. The first type of the actual coercion sequence found
 * in the map fixes both the number of dereferences and the references to re-apply.
 */
@RequestScoped
public class CoercionPathFinder {

    private final TraitOracle oracle;
    private final CoercionSequences sequences;

    @Inject
    CoercionPathFinder(TraitOracle oracle, CoercionSequences sequences) {
        this.oracle = oracle;
        this.sequences = sequences;
    }

    public @Nullable DerefRefPath findPath(Ty expected, Ty actual, SyntaxHandle element) {
        List<Mutability> expectedRefSeq = new ArrayList<>();
        Map<Ty, Integer> typeToExpectedDepth = new HashMap<>();
        typeToExpectedDepth.put(expected, 0);
        Ty ty = expected;
        while (ty instanceof TyReference) {
            TyReference reference = (TyReference) ty;
            expectedRefSeq.add(reference.getMutability());
            ty = reference.getReferenced();
            typeToExpectedDepth.putIfAbsent(ty, expectedRefSeq.size());
        }

        List<Ty> actualSeq = sequences.materialize(oracle, actual);
        int derefs = -1;
        int refCount = 0;
        for (int i = 0; i < actualSeq.size(); i++) {
            @Nullable Integer depth = typeToExpectedDepth.get(actualSeq.get(i));
            if (depth != null) {
                derefs = i;
                refCount = depth;
                break;
            }
        }
        if (derefs < 0) {
            return null;
        }

        List<Mutability> refs = expectedRefSeq.subList(0, refCount);
        if (!isSuitableMutability(refs, actualSeq.subList(0, derefs + 1), element)) {
            return null;
        }
        return new DerefRefPath(derefs, refs);
    }

    // `let mut x: &T = ...; f(x)` must not turn into `&mut *x`
    private static boolean isSuitableMutability(List<Mutability> refs, List<Ty> stripped, SyntaxHandle element) {
        if (refs.isEmpty() || !refs.get(refs.size() - 1).isMut()) {
            return true;
        }
        return element.isExpression() && element.isMutablePlace() && allReferencesMutable(stripped);
    }

    public static boolean allReferencesMutable(List<Ty> types) {
        return types.stream()
                .allMatch(t -> !(t instanceof TyReference) || ((TyReference) t).getMutability().isMut());
    }
}
