package io.github.joke.mismatch.ty;

import org.jspecify.annotations.Nullable;

/** A type the inference engine could not determine. Never offered as a replacement type. */
public final class TyUnknown extends Ty {

    public static final TyUnknown INSTANCE = new TyUnknown();

    private TyUnknown() {}

    @Override
    public Ty superFoldWith(TypeFolder folder) {
        return this;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        return o instanceof TyUnknown;
    }

    @Override
    public int hashCode() {
        return TyUnknown.class.hashCode();
    }
}
