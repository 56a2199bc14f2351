package io.github.joke.mismatch.ty;

import org.jspecify.annotations.Nullable;

public final class TyChar extends Ty {

    public static final TyChar INSTANCE = new TyChar();

    private TyChar() {}

    @Override
    public Ty superFoldWith(TypeFolder folder) {
        return this;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        return o instanceof TyChar;
    }

    @Override
    public int hashCode() {
        return TyChar.class.hashCode();
    }
}
