package io.github.joke.mismatch.diagnostic;

import io.github.joke.mismatch.syntax.SyntaxHandle;
import io.github.joke.mismatch.ty.Ty;
import io.github.joke.mismatch.ty.TypeFolder;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The expected and actual type of an expression do not unify. If either type still contains
 * inference variables when the mismatch is recorded, the explanation is rendered right away so that
 * it keeps showing {@code {integer}} after the variables are resolved.
 */
public final class TypeMismatch extends Diagnostic {

    private final Ty expected;
    private final Ty actual;
    private final @Nullable String capturedDescription;

    private TypeMismatch(SyntaxHandle element, Ty expected, Ty actual, @Nullable String capturedDescription) {
        super(element);
        this.expected = Objects.requireNonNull(expected, "expected");
        this.actual = Objects.requireNonNull(actual, "actual");
        this.capturedDescription = capturedDescription;
    }

    public static TypeMismatch capture(SyntaxHandle element, Ty expected, Ty actual, DiagnosticReporter reporter) {
        @Nullable String description = expected.hasTyInfer() || actual.hasTyInfer()
                ? reporter.expectedFound(expected, actual)
                : null;
        return new TypeMismatch(element, expected, actual, description);
    }

    public Ty getExpected() {
        return expected;
    }

    public Ty getActual() {
        return actual;
    }

    /** Explanation rendered when the mismatch was recorded, or null if it had no inference variables. */
    public @Nullable String getCapturedDescription() {
        return capturedDescription;
    }

    /** Folds both types; the captured explanation is kept as is. */
    public TypeMismatch foldWith(TypeFolder folder) {
        return new TypeMismatch(getElement(), expected.foldWith(folder), actual.foldWith(folder), capturedDescription);
    }
}
