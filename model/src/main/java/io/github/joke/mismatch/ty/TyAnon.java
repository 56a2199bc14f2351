package io.github.joke.mismatch.ty;

import static java.util.Collections.unmodifiableList;

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** An opaque {@code impl Trait} type. Only its bound names are known. */
public final class TyAnon extends Ty {

    private final List<String> bounds;

    public TyAnon(List<String> bounds) {
        this.bounds = unmodifiableList(new ArrayList<>(bounds));
    }

    public List<String> getBounds() {
        return bounds;
    }

    @Override
    public Ty superFoldWith(TypeFolder folder) {
        return this;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        return o instanceof TyAnon && ((TyAnon) o).bounds.equals(bounds);
    }

    @Override
    public int hashCode() {
        return bounds.hashCode();
    }
}
