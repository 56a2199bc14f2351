package io.github.joke.mismatch.ty;

public enum Mutability {
    IMMUTABLE,
    MUTABLE;

    public boolean isMut() {
        return this == MUTABLE;
    }
}
