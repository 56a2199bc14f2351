package io.github.joke.mismatch.conversion;

import io.github.joke.mismatch.coercion.CoercionPathFinder;
import io.github.joke.mismatch.coercion.CoercionSequences;
import io.github.joke.mismatch.resolve.AssociatedType;
import io.github.joke.mismatch.resolve.BoundElement;
import io.github.joke.mismatch.resolve.KnownItems;
import io.github.joke.mismatch.resolve.TraitItem;
import io.github.joke.mismatch.resolve.TraitOracle;
import io.github.joke.mismatch.resolve.TraitRef;
import io.github.joke.mismatch.syntax.SyntaxHandle;
import io.github.joke.mismatch.ty.Ty;
import io.github.joke.mismatch.ty.TyInfer;
import io.github.joke.mismatch.ty.TyNumeric;
import io.github.joke.mismatch.ty.TyStr;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Everything a {@link ConversionProbe} may ask about one mismatch. */
public final class ConversionContext {

    private final Ty expected;
    private final Ty actual;
    private final SyntaxHandle syntax;
    private final TraitOracle oracle;
    private final CoercionSequences sequences;
    private @Nullable List<Ty> actualSequence;

    public ConversionContext(
            Ty expected, Ty actual, SyntaxHandle syntax, TraitOracle oracle, CoercionSequences sequences) {
        this.expected = expected;
        this.actual = actual;
        this.syntax = syntax;
        this.oracle = oracle;
        this.sequences = sequences;
    }

    public Ty getExpected() {
        return expected;
    }

    public Ty getActual() {
        return actual;
    }

    public SyntaxHandle getSyntax() {
        return syntax;
    }

    public TraitOracle getOracle() {
        return oracle;
    }

    public KnownItems getKnownItems() {
        return oracle.knownItems();
    }

    /** Materialized coercion sequence of the actual type, computed on first use. */
    public List<Ty> getActualSequence() {
        List<Ty> sequence = actualSequence;
        if (sequence == null) {
            sequence = sequences.materialize(oracle, actual);
            actualSequence = sequence;
        }
        return sequence;
    }

    public boolean isActualNumeric() {
        return isNumeric(actual);
    }

    public static boolean isNumeric(Ty ty) {
        return ty instanceof TyNumeric || ty instanceof TyInfer.IntVar || ty instanceof TyInfer.FloatVar;
    }

    public boolean actualReferencesAllMutable() {
        return CoercionPathFinder.allReferencesMutable(getActualSequence());
    }

    /**
     * Whether {@code trait} is implemented for some type of the actual coercion sequence. Only the
     * materialized, depth-bounded sequence is searched.
     */
    public boolean implementsWithDeref(@Nullable TraitItem trait, Ty... substitution) {
        if (trait == null) {
            return false;
        }
        BoundElement bound = trait.withSubst(substitution);
        for (Ty ty : getActualSequence()) {
            if (oracle.canSelect(new TraitRef(ty, bound))) {
                return true;
            }
        }
        return false;
    }

    /** First associated type {@code name} of {@code trait} projected along the actual coercion sequence. */
    public @Nullable Ty projectWithDeref(@Nullable TraitItem trait, String name) {
        if (trait == null) {
            return null;
        }
        @Nullable AssociatedType associatedType = trait.findAssociatedType(name);
        if (associatedType == null) {
            return null;
        }
        BoundElement bound = trait.bound();
        for (Ty ty : getActualSequence()) {
            @Nullable Ty projected = oracle.selectProjectionStrict(new TraitRef(ty, bound), associatedType).ok();
            if (projected != null) {
                return projected;
            }
        }
        return null;
    }

    /** Error type of {@code TryFrom<actual> for target}, or null if that conversion does not exist. */
    public @Nullable Ty tryFromErrTy(Ty target) {
        return project(getKnownItems().getTryFromTrait(), "Error", target, actual);
    }

    /**
     * Error type of {@code FromStr for target}, or null if the actual type does not dereference to
     * {@code str} or {@code target} cannot be parsed.
     */
    public @Nullable Ty fromStrErrTy(Ty target) {
        List<Ty> sequence = getActualSequence();
        if (!(sequence.get(sequence.size() - 1) instanceof TyStr)) {
            return null;
        }
        return project(getKnownItems().getFromStrTrait(), "Err", target);
    }

    private @Nullable Ty project(@Nullable TraitItem trait, String name, Ty selfTy, Ty... substitution) {
        if (trait == null) {
            return null;
        }
        @Nullable AssociatedType associatedType = trait.findAssociatedType(name);
        if (associatedType == null) {
            return null;
        }
        return oracle.selectProjectionStrict(new TraitRef(selfTy, trait.withSubst(substitution)), associatedType)
                .ok();
    }
}
