package io.github.joke.mismatch.ty;

import static java.util.Arrays.asList;
import static java.util.Collections.unmodifiableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** A struct, enum or union applied to its type arguments, e.g. {@code Result<u8, ParseIntError>}. */
public final class TyAdt extends Ty {

    private final AdtItem item;
    private final List<Ty> typeArguments;

    public TyAdt(AdtItem item, List<Ty> typeArguments) {
        this.item = Objects.requireNonNull(item, "item");
        this.typeArguments = unmodifiableList(new ArrayList<>(typeArguments));
    }

    public static TyAdt of(AdtItem item, Ty... typeArguments) {
        return new TyAdt(item, asList(typeArguments));
    }

    public AdtItem getItem() {
        return item;
    }

    public List<Ty> getTypeArguments() {
        return typeArguments;
    }

    @Override
    public List<Ty> children() {
        return typeArguments;
    }

    @Override
    public Ty superFoldWith(TypeFolder folder) {
        List<Ty> folded = new ArrayList<>(typeArguments.size());
        boolean changed = false;
        for (Ty arg : typeArguments) {
            Ty f = arg.foldWith(folder);
            changed |= f != arg;
            folded.add(f);
        }
        return changed ? new TyAdt(item, folded) : this;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TyAdt)) {
            return false;
        }
        TyAdt that = (TyAdt) o;
        return item.equals(that.item) && typeArguments.equals(that.typeArguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(item, typeArguments);
    }
}
