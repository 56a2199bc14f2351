package io.github.joke.mismatch.ty;

import org.jspecify.annotations.Nullable;

public final class TyBool extends Ty {

    public static final TyBool INSTANCE = new TyBool();

    private TyBool() {}

    @Override
    public Ty superFoldWith(TypeFolder folder) {
        return this;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        return o instanceof TyBool;
    }

    @Override
    public int hashCode() {
        return TyBool.class.hashCode();
    }
}
