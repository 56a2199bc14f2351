package io.github.joke.mismatch.ty;

import static java.util.Collections.emptyList;

import java.util.List;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * Immutable, structurally compared type tree. Subclasses live in this package only; the set of cases
 * is closed.
 */
public abstract class Ty {

    Ty() {}

    /** Direct subtrees, outermost first. */
    public List<Ty> children() {
        return emptyList();
    }

    /** Rebuilds this node from its children folded through {@code folder}. */
    public abstract Ty superFoldWith(TypeFolder folder);

    public final Ty foldWith(TypeFolder folder) {
        return folder.foldTy(this);
    }

    public final void forEachNode(Consumer<Ty> action) {
        action.accept(this);
        for (Ty child : children()) {
            child.forEachNode(action);
        }
    }

    public boolean isEquivalentTo(@Nullable Ty other) {
        return equals(other);
    }

    public final boolean hasTyInfer() {
        return containsTyOfClass(TyInfer.class);
    }

    public final boolean containsTyOfClass(Class<?>... classes) {
        for (Class<?> cls : classes) {
            if (cls.isInstance(this)) {
                return true;
            }
        }
        for (Ty child : children()) {
            if (child.containsTyOfClass(classes)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public abstract boolean equals(@Nullable Object o);

    @Override
    public abstract int hashCode();

    @Override
    public String toString() {
        return DefaultTypeRenderer.INSTANCE.render(this);
    }
}
