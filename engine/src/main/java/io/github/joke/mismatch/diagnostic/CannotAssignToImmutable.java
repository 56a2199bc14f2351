package io.github.joke.mismatch.diagnostic;

import io.github.joke.mismatch.syntax.SyntaxHandle;

public final class CannotAssignToImmutable extends Diagnostic {

    private final String what;

    /** @param what description of the assigned place, e.g. {@code immutable borrowed content} */
    public CannotAssignToImmutable(SyntaxHandle element, String what) {
        super(element);
        this.what = what;
    }

    public String getWhat() {
        return what;
    }
}
