package io.github.joke.mismatch.resolve;

import io.github.joke.mismatch.ty.Ty;
import org.jspecify.annotations.Nullable;

/**
 * Read-only view of trait resolution for one crate graph. Implementations must be safe for concurrent
 * reads; the engine never caches their answers.
 */
public interface TraitOracle {

    boolean canSelect(TraitRef ref);

    /**
     * Like {@link #canSelect(TraitRef)} but also tries every type the self type dereferences to. Walks
     * the whole coercion sequence, so it only terminates for finite sequences.
     */
    default boolean canSelectWithDeref(TraitRef ref) {
        for (Ty ty : coercionSequence(ref.getSelfTy())) {
            if (canSelect(ref.withSelfTy(ty))) {
                return true;
            }
        }
        return false;
    }

    ProjectionResult selectProjectionStrict(TraitRef ref, AssociatedType associatedType);

    /**
     * Returns the first successful projection along the self type's coercion sequence, or the result
     * for the self type itself when none succeeds. Walks the whole coercion sequence, like
     * {@link #canSelectWithDeref(TraitRef)}.
     */
    default ProjectionResult selectProjectionStrictWithDeref(TraitRef ref, AssociatedType associatedType) {
        @Nullable ProjectionResult first = null;
        for (Ty ty : coercionSequence(ref.getSelfTy())) {
            ProjectionResult result = selectProjectionStrict(ref.withSelfTy(ty), associatedType);
            if (result.isOk()) {
                return result;
            }
            if (first == null) {
                first = result;
            }
        }
        return first != null ? first : selectProjectionStrict(ref, associatedType);
    }

    /**
     * Types reachable from {@code ty} by removing one reference layer or applying one user-defined
     * {@code Deref} step at a time. The first element is {@code ty}; the sequence may be lazy.
     */
    Iterable<Ty> coercionSequence(Ty ty);

    KnownItems knownItems();
}
