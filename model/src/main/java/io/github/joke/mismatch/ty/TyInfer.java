package io.github.joke.mismatch.ty;

import org.jspecify.annotations.Nullable;

/**
 * Placeholder for a type that is still being inferred. Two placeholders are the same type only if
 * they have the same kind and id.
 */
public abstract class TyInfer extends Ty {

    private final int id;

    TyInfer(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    @Override
    public Ty superFoldWith(TypeFolder folder) {
        return this;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        return o != null && o.getClass() == getClass() && ((TyInfer) o).id == id;
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + id;
    }

    /** An integer literal of not yet known width, rendered {@code {integer}}. */
    public static final class IntVar extends TyInfer {
        public IntVar(int id) {
            super(id);
        }
    }

    /** A float literal of not yet known width, rendered {@code {float}}. */
    public static final class FloatVar extends TyInfer {
        public FloatVar(int id) {
            super(id);
        }
    }

    public static final class TyVar extends TyInfer {
        public TyVar(int id) {
            super(id);
        }
    }
}
