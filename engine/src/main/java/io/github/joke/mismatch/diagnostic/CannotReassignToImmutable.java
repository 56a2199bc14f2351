package io.github.joke.mismatch.diagnostic;

import io.github.joke.mismatch.syntax.SyntaxHandle;

public final class CannotReassignToImmutable extends Diagnostic {

    public CannotReassignToImmutable(SyntaxHandle element) {
        super(element);
    }
}
