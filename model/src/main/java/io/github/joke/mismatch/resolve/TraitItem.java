package io.github.joke.mismatch.resolve;

import io.github.joke.mismatch.ty.Ty;
import java.util.List;
import lombok.Value;
import org.jspecify.annotations.Nullable;

/** Identity of a trait together with the names of the associated types it declares. */
@Value
public class TraitItem {
    String path;
    String name;
    List<String> associatedTypeNames;

    public static TraitItem of(String path, String... associatedTypeNames) {
        int idx = path.lastIndexOf("::");
        String name = idx < 0 ? path : path.substring(idx + 2);
        return new TraitItem(path, name, List.of(associatedTypeNames));
    }

    public @Nullable AssociatedType findAssociatedType(String name) {
        return associatedTypeNames.contains(name) ? new AssociatedType(this, name) : null;
    }

    public BoundElement withSubst(Ty... substitution) {
        return new BoundElement(this, List.of(substitution));
    }

    public BoundElement bound() {
        return new BoundElement(this, List.of());
    }
}
