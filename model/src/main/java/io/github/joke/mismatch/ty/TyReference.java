package io.github.joke.mismatch.ty;

import static java.util.Collections.singletonList;

import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** {@code &T} or {@code &mut T}. */
public final class TyReference extends Ty {

    private final Ty referenced;
    private final Mutability mutability;

    public TyReference(Ty referenced, Mutability mutability) {
        this.referenced = Objects.requireNonNull(referenced, "referenced");
        this.mutability = Objects.requireNonNull(mutability, "mutability");
    }

    public static TyReference ref(Ty referenced) {
        return new TyReference(referenced, Mutability.IMMUTABLE);
    }

    public static TyReference refMut(Ty referenced) {
        return new TyReference(referenced, Mutability.MUTABLE);
    }

    public Ty getReferenced() {
        return referenced;
    }

    public Mutability getMutability() {
        return mutability;
    }

    @Override
    public List<Ty> children() {
        return singletonList(referenced);
    }

    @Override
    public Ty superFoldWith(TypeFolder folder) {
        Ty folded = referenced.foldWith(folder);
        return folded == referenced ? this : new TyReference(folded, mutability);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TyReference)) {
            return false;
        }
        TyReference that = (TyReference) o;
        return mutability == that.mutability && referenced.equals(that.referenced);
    }

    @Override
    public int hashCode() {
        return Objects.hash(referenced, mutability);
    }
}
