package io.github.joke.mismatch.diagnostic;

import io.github.joke.mismatch.syntax.SyntaxHandle;

/** A bare {@code return;} in a function that returns something other than {@code ()}. */
public final class ReturnMustHaveValue extends Diagnostic {

    public ReturnMustHaveValue(SyntaxHandle element) {
        super(element);
    }
}
