package io.github.joke.mismatch.syntax;

import org.jspecify.annotations.Nullable;

/**
 * Non-owning handle to the syntax element a type mismatch was reported on. The engine only asks
 * questions through it and never keeps it past a single diagnosis.
 */
public interface SyntaxHandle {

    /** Source text of the element. */
    String text();

    boolean isExpression();

    /** Whether the element is an expression denoting a mutable place, e.g. a {@code let mut} binding. */
    boolean isMutablePlace();

    /**
     * Name of the binding when the element initializes a {@code let} with an explicit type annotation
     * and a plain identifier pattern, otherwise null.
     */
    @Nullable
    String typedLetBinding();

    /** Name of the function whose return value the element is, otherwise null. */
    @Nullable
    String returningFunction();
}
