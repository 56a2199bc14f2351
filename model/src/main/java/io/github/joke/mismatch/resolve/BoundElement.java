package io.github.joke.mismatch.resolve;

import io.github.joke.mismatch.ty.Ty;
import java.util.List;
import lombok.Value;

/** A trait applied to its type parameters, e.g. {@code From<&str>}. */
@Value
public class BoundElement {
    TraitItem trait;
    List<Ty> substitution;
}
