package io.github.joke.mismatch.diagnostic;

import io.github.joke.mismatch.syntax.SyntaxHandle;
import java.util.Objects;

/** A problem found at one syntax element. Turned into a {@link PreparedAnnotation} by {@link DiagnosticPreparer}. */
public abstract class Diagnostic {

    private final SyntaxHandle element;

    protected Diagnostic(SyntaxHandle element) {
        this.element = Objects.requireNonNull(element, "element");
    }

    public SyntaxHandle getElement() {
        return element;
    }
}
