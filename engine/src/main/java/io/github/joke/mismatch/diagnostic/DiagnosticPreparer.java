package io.github.joke.mismatch.diagnostic;

import io.github.joke.mismatch.di.RequestScoped;
import io.github.joke.mismatch.fix.FixSynthesizer;
import javax.inject.Inject;
import org.jspecify.annotations.Nullable;

/** Turns every known {@link Diagnostic} into its {@link PreparedAnnotation}. */
@RequestScoped
public class DiagnosticPreparer {

    private final FixSynthesizer fixSynthesizer;
    private final DiagnosticReporter reporter;

    @Inject
    DiagnosticPreparer(FixSynthesizer fixSynthesizer, DiagnosticReporter reporter) {
        this.fixSynthesizer = fixSynthesizer;
        this.reporter = reporter;
    }

    public PreparedAnnotation prepare(Diagnostic diagnostic) {
        if (diagnostic instanceof TypeMismatch) {
            return prepareTypeMismatch((TypeMismatch) diagnostic);
        }
        if (diagnostic instanceof DerefError) {
            DerefError error = (DerefError) diagnostic;
            return PreparedAnnotation.error(
                    ErrorCode.E0614, "type `" + reporter.render(error.getTy()) + "` cannot be dereferenced");
        }
        if (diagnostic instanceof CastAsBoolError) {
            return PreparedAnnotation.error(ErrorCode.E0054, "It is not allowed to cast to a bool.");
        }
        if (diagnostic instanceof IncorrectArgumentCount) {
            IncorrectArgumentCount error = (IncorrectArgumentCount) diagnostic;
            return PreparedAnnotation.error(error.getFunctionType().getErrorCode(), argumentCountText(error));
        }
        if (diagnostic instanceof ReturnMustHaveValue) {
            return PreparedAnnotation.error(ErrorCode.E0069, "`return;` in a function whose return type is not `()`");
        }
        if (diagnostic instanceof CannotAssignToImmutable) {
            return PreparedAnnotation.error(
                    ErrorCode.E0594, "Cannot assign to " + ((CannotAssignToImmutable) diagnostic).getWhat());
        }
        if (diagnostic instanceof CannotReassignToImmutable) {
            return PreparedAnnotation.error(ErrorCode.E0384, "Cannot assign twice to immutable variable");
        }
        if (diagnostic instanceof TraitParamCountMismatch) {
            TraitParamCountMismatch error = (TraitParamCountMismatch) diagnostic;
            return PreparedAnnotation.error(
                    ErrorCode.E0050,
                    "Method `" + error.getFunctionName() + "` has " + error.getParamsCount() + " "
                            + pluralize("parameter", error.getParamsCount()) + " but the declaration in trait `"
                            + error.getTraitName() + "` has " + error.getSuperParamsCount());
        }
        throw new IllegalArgumentException("Unknown diagnostic: " + diagnostic.getClass().getName());
    }

    private PreparedAnnotation prepareTypeMismatch(TypeMismatch mismatch) {
        @Nullable String captured = mismatch.getCapturedDescription();
        String description = captured != null
                ? captured
                : reporter.expectedFound(mismatch.getExpected(), mismatch.getActual());
        return new PreparedAnnotation(
                Severity.ERROR,
                ErrorCode.E0308,
                "mismatched types",
                description,
                fixSynthesizer.candidates(mismatch.getExpected(), mismatch.getActual(), mismatch.getElement()));
    }

    private static String argumentCountText(IncorrectArgumentCount error) {
        int expected = error.getExpectedCount();
        int actual = error.getActualCount();
        return "This function takes" + (error.getFunctionType().isVariadic() ? " at least" : "")
                + " " + expected + " " + pluralize("parameter", expected)
                + " but " + actual + " " + pluralize("parameter", actual)
                + " " + (actual == 1 ? "was" : "were") + " supplied";
    }

    private static String pluralize(String word, int count) {
        return count == 1 ? word : word + "s";
    }
}
