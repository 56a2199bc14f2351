package io.github.joke.mismatch.ty;

import static java.util.Collections.emptySet;

import java.util.Set;

/** Turns a type into display text. Items in {@code qualify} are printed with their full path. */
public interface TypeRenderer {

    String render(Ty ty, Set<AdtItem> qualify);

    default String render(Ty ty) {
        return render(ty, emptySet());
    }
}
