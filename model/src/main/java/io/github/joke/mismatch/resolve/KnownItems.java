package io.github.joke.mismatch.resolve;

import io.github.joke.mismatch.ty.AdtItem;
import io.github.joke.mismatch.ty.Ty;
import io.github.joke.mismatch.ty.TyAdt;
import lombok.Builder;
import lombok.Value;
import org.jspecify.annotations.Nullable;

/**
 * Well-known standard library items as seen from one crate graph. Any entry may be missing, e.g. in a
 * {@code no_std} crate without {@code alloc}.
 */
@Value
@Builder
public class KnownItems {

    private static final KnownItems EMPTY = KnownItems.builder().build();

    @Nullable TraitItem fromTrait;
    @Nullable TraitItem tryFromTrait;
    @Nullable TraitItem fromStrTrait;
    @Nullable TraitItem toOwnedTrait;
    @Nullable TraitItem toStringTrait;
    @Nullable TraitItem borrowTrait;
    @Nullable TraitItem borrowMutTrait;
    @Nullable TraitItem asRefTrait;
    @Nullable TraitItem asMutTrait;
    @Nullable AdtItem resultItem;
    @Nullable AdtItem stringItem;

    public static KnownItems empty() {
        return EMPTY;
    }

    /** {@code String} as a type, or null if the item is not available. */
    public @Nullable Ty stringTy() {
        return stringItem == null ? null : TyAdt.of(stringItem);
    }
}
