package io.github.joke.mismatch.fix;

import java.util.List;
import lombok.Value;

/** Explanation of a mismatch together with every candidate fix, in priority order. */
@Value
public class DiagnosisResult {
    String explanation;
    List<CandidateFix> candidates;

    public boolean hasCandidate(FixKind kind) {
        return candidates.stream().anyMatch(fix -> fix.getKind() == kind);
    }
}
