package io.github.joke.mismatch.testing;

import static java.util.Collections.unmodifiableMap;

import io.github.joke.mismatch.resolve.TraitItem;
import io.github.joke.mismatch.resolve.TraitRef;
import io.github.joke.mismatch.ty.Ty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Value;

/** One {@code impl Trait<substitution> for selfTy} with its associated type bindings. */
@Value
public class ImplDef {
    TraitItem trait;
    Ty selfTy;
    List<Ty> substitution;
    Map<String, Ty> associatedTypes;

    public static ImplDef of(TraitItem trait, Ty selfTy, Ty... substitution) {
        return new ImplDef(trait, selfTy, List.of(substitution), Map.of());
    }

    public ImplDef bind(String associatedType, Ty ty) {
        Map<String, Ty> bindings = new LinkedHashMap<>(associatedTypes);
        bindings.put(associatedType, ty);
        return new ImplDef(trait, selfTy, substitution, unmodifiableMap(bindings));
    }

    boolean matches(TraitRef ref) {
        return trait.equals(ref.getTrait().getTrait())
                && selfTy.isEquivalentTo(ref.getSelfTy())
                && substitution.equals(ref.getTrait().getSubstitution());
    }
}
