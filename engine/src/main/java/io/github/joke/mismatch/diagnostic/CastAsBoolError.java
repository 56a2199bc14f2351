package io.github.joke.mismatch.diagnostic;

import io.github.joke.mismatch.syntax.SyntaxHandle;

public final class CastAsBoolError extends Diagnostic {

    public CastAsBoolError(SyntaxHandle castExpr) {
        super(castExpr);
    }
}
