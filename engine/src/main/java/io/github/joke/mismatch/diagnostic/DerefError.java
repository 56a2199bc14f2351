package io.github.joke.mismatch.diagnostic;

import io.github.joke.mismatch.syntax.SyntaxHandle;
import io.github.joke.mismatch.ty.Ty;

public final class DerefError extends Diagnostic {

    private final Ty ty;

    public DerefError(SyntaxHandle element, Ty ty) {
        super(element);
        this.ty = ty;
    }

    public Ty getTy() {
        return ty;
    }
}
