package io.github.joke.mismatch.coercion;

import io.github.joke.mismatch.ty.Mutability;
import io.github.joke.mismatch.ty.Ty;
import io.github.joke.mismatch.ty.TyReference;
import java.util.List;
import lombok.Value;

/**
 * Dereference {@code derefs} times along the coercion sequence, then take references with the
 * mutabilities in {@code refs}. {@code refs} is ordered outermost first, so it is applied from the
 * last element to the first.
 */
@Value
public class DerefRefPath {
    int derefs;
    List<Mutability> refs;

    public DerefRefPath(int derefs, List<Mutability> refs) {
        this.derefs = derefs;
        this.refs = List.copyOf(refs);
    }

    /** Wraps {@code matched} in this path's references, innermost first. */
    Ty wrap(Ty matched) {
        Ty ty = matched;
        for (int i = refs.size() - 1; i >= 0; i--) {
            ty = new TyReference(ty, refs.get(i));
        }
        return ty;
    }

    /** Prefix that turns an expression of the actual type into one of the expected type, e.g. {@code &mut *}. */
    public String prefix() {
        StringBuilder sb = new StringBuilder();
        for (Mutability ref : refs) {
            sb.append(ref.isMut() ? "&mut " : "&");
        }
        for (int i = 0; i < derefs; i++) {
            sb.append('*');
        }
        return sb.toString();
    }
}
