package io.github.joke.mismatch.coercion;

import static java.util.Collections.unmodifiableList;

import io.github.joke.mismatch.di.EngineScoped;
import io.github.joke.mismatch.engine.EngineConfig;
import io.github.joke.mismatch.resolve.TraitOracle;
import io.github.joke.mismatch.ty.Ty;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;

/**
 * Materializes the oracle's lazy coercion sequences. A sequence longer than the configured depth is
 * cut off so that a looping user-defined {@code Deref} cannot hang a diagnosis.
 */
@Slf4j
@EngineScoped
public class CoercionSequences {

    private final int maxDepth;

    @Inject
    public CoercionSequences(EngineConfig config) {
        this.maxDepth = config.getCoercionMaxDepth();
    }

    /**
     * @throws IllegalStateException if the oracle returns a sequence that does not start with {@code ty}
     */
    public List<Ty> materialize(TraitOracle oracle, Ty ty) {
        List<Ty> sequence = new ArrayList<>();
        Iterator<Ty> it = oracle.coercionSequence(ty).iterator();
        while (it.hasNext()) {
            if (sequence.size() == maxDepth) {
                log.warn("Coercion sequence of `{}` exceeds {} steps, truncating", ty, maxDepth);
                break;
            }
            sequence.add(it.next());
        }
        if (sequence.isEmpty() || !sequence.get(0).equals(ty)) {
            throw new IllegalStateException(
                    "Coercion sequence of `" + ty + "` must start with the type itself, got " + sequence);
        }
        return unmodifiableList(sequence);
    }
}
