package io.github.joke.mismatch.ty;

import org.jspecify.annotations.Nullable;

/** The unsized string slice {@code str}. */
public final class TyStr extends Ty {

    public static final TyStr INSTANCE = new TyStr();

    private TyStr() {}

    @Override
    public Ty superFoldWith(TypeFolder folder) {
        return this;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        return o instanceof TyStr;
    }

    @Override
    public int hashCode() {
        return TyStr.class.hashCode();
    }
}
