package io.github.joke.mismatch.resolve;

import io.github.joke.mismatch.ty.Ty;
import lombok.Value;

/** The obligation {@code selfTy: trait}. */
@Value
public class TraitRef {
    Ty selfTy;
    BoundElement trait;

    public TraitRef withSelfTy(Ty ty) {
        return new TraitRef(ty, trait);
    }
}
