package io.github.joke.mismatch.fix;

import static java.util.Collections.unmodifiableList;

import io.github.joke.mismatch.coercion.CoercionPathFinder;
import io.github.joke.mismatch.coercion.DerefRefPath;
import io.github.joke.mismatch.conversion.ConversionTraitQuery;
import io.github.joke.mismatch.di.RequestScoped;
import io.github.joke.mismatch.diagnostic.DiagnosticReporter;
import io.github.joke.mismatch.engine.EngineConfig;
import io.github.joke.mismatch.syntax.SyntaxHandle;
import io.github.joke.mismatch.ty.Ty;
import io.github.joke.mismatch.ty.TyAnon;
import io.github.joke.mismatch.ty.TyInfer;
import io.github.joke.mismatch.ty.TyUnknown;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

/**
 * Assembles every candidate fix for one mismatch: trait conversions, then the deref/ref bridge, then
 * changing the return type and the let binding's declared type.
 */
@Slf4j
@RequestScoped
public class FixSynthesizer {

    private final ConversionTraitQuery conversionQuery;
    private final CoercionPathFinder pathFinder;
    private final DiagnosticReporter reporter;
    private final boolean signatureFixes;

    @Inject
    FixSynthesizer(
            ConversionTraitQuery conversionQuery,
            CoercionPathFinder pathFinder,
            DiagnosticReporter reporter,
            EngineConfig config) {
        this.conversionQuery = conversionQuery;
        this.pathFinder = pathFinder;
        this.reporter = reporter;
        this.signatureFixes = config.isSignatureFixes();
    }

    public DiagnosisResult synthesize(Ty expected, Ty actual, SyntaxHandle syntax) {
        String explanation = reporter.expectedFound(expected, actual);
        return new DiagnosisResult(explanation, candidates(expected, actual, syntax));
    }

    public List<CandidateFix> candidates(Ty expected, Ty actual, SyntaxHandle syntax) {
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(actual, "actual");
        Objects.requireNonNull(syntax, "syntax");

        List<CandidateFix> fixes = new ArrayList<>();
        if (syntax.isExpression()) {
            fixes.addAll(conversionQuery.candidates(expected, actual, syntax));
            if (!ConversionTraitQuery.isNumericMismatch(expected, actual)) {
                @Nullable DerefRefPath path = pathFinder.findPath(expected, actual, syntax);
                if (path != null) {
                    fixes.add(CandidateFix.derefRefBridge(expected, path));
                }
            }
        }

        if (signatureFixes) {
            @Nullable String function = syntax.returningFunction();
            if (function != null && !actual.containsTyOfClass(TyUnknown.class, TyAnon.class, TyInfer.class)) {
                fixes.add(CandidateFix.changeReturnType(function, actual));
            }
            @Nullable String binding = syntax.typedLetBinding();
            if (binding != null && !actual.containsTyOfClass(TyUnknown.class, TyAnon.class)) {
                fixes.add(CandidateFix.changeLetDeclType(binding, actual));
            }
        }
        log.debug("{} candidate(s) for `{}` where `{}` was expected", fixes.size(), syntax.text(), expected);
        return unmodifiableList(fixes);
    }
}
