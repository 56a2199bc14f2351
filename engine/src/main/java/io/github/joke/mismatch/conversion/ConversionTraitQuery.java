package io.github.joke.mismatch.conversion;

import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;
import static java.util.Collections.unmodifiableList;

import io.github.joke.mismatch.coercion.CoercionSequences;
import io.github.joke.mismatch.di.RequestScoped;
import io.github.joke.mismatch.fix.CandidateFix;
import io.github.joke.mismatch.resolve.TraitOracle;
import io.github.joke.mismatch.syntax.SyntaxHandle;
import io.github.joke.mismatch.ty.Ty;
import io.github.joke.mismatch.ty.TyNumeric;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;

/**
 * Collects the trait-based conversions from the actual to the expected type. A numeric-to-numeric
 * mismatch is always answered with a cast alone; everything else is asked of the registered
 * {@link ConversionProbe}s in order.
 */
@Slf4j
@RequestScoped
public class ConversionTraitQuery {

    private final TraitOracle oracle;
    private final List<ConversionProbe> probes;
    private final CoercionSequences sequences;

    @Inject
    ConversionTraitQuery(TraitOracle oracle, List<ConversionProbe> probes, CoercionSequences sequences) {
        this.oracle = oracle;
        this.probes = probes;
        this.sequences = sequences;
    }

    public List<CandidateFix> candidates(Ty expected, Ty actual, SyntaxHandle syntax) {
        if (!syntax.isExpression()) {
            return emptyList();
        }
        if (isNumericMismatch(expected, actual)) {
            log.debug("Numeric mismatch `{}` -> `{}`, offering a cast only", actual, expected);
            return singletonList(CandidateFix.asCast(expected));
        }

        ConversionContext context = new ConversionContext(expected, actual, syntax, oracle, sequences);
        List<CandidateFix> candidates = new ArrayList<>();
        for (ConversionProbe probe : probes) {
            if (probe.canHandle(context)) {
                List<CandidateFix> provided = probe.provide(context);
                if (!provided.isEmpty()) {
                    log.debug("{} offers {}", probe.getClass().getSimpleName(), provided);
                }
                candidates.addAll(provided);
            }
        }
        return unmodifiableList(candidates);
    }

    /** Both sides are numbers; such a mismatch is answered with a cast and nothing else. */
    public static boolean isNumericMismatch(Ty expected, Ty actual) {
        return expected instanceof TyNumeric && ConversionContext.isNumeric(actual);
    }
}
