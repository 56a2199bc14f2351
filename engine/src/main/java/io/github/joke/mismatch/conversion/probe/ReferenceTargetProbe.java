package io.github.joke.mismatch.conversion.probe;

import static java.util.Collections.unmodifiableList;

import com.google.auto.service.AutoService;
import io.github.joke.mismatch.conversion.ConversionContext;
import io.github.joke.mismatch.conversion.ConversionProbe;
import io.github.joke.mismatch.fix.CandidateFix;
import io.github.joke.mismatch.fix.ConversionTrait;
import io.github.joke.mismatch.resolve.KnownItems;
import io.github.joke.mismatch.ty.Ty;
import io.github.joke.mismatch.ty.TyReference;
import java.util.ArrayList;
import java.util.List;

/**
 * Reference targets: {@code Borrow}/{@code AsRef} for {@code &T}, {@code BorrowMut}/{@code AsMut} for
 * {@code &mut T}. A mutable borrow is only offered when the expression can actually be borrowed
 * mutably.
 */
@AutoService(ConversionProbe.class)
public final class ReferenceTargetProbe implements ConversionProbe {

    @Override
    public int order() {
        return 500;
    }

    @Override
    public boolean canHandle(ConversionContext context) {
        return context.getExpected() instanceof TyReference;
    }

    @Override
    public List<CandidateFix> provide(ConversionContext context) {
        TyReference expected = (TyReference) context.getExpected();
        Ty referenced = expected.getReferenced();
        KnownItems items = context.getKnownItems();
        List<CandidateFix> fixes = new ArrayList<>();

        if (!expected.getMutability().isMut()) {
            if (context.implementsWithDeref(items.getBorrowTrait(), referenced)) {
                fixes.add(CandidateFix.convertVia(ConversionTrait.BORROW, expected));
            }
            if (context.implementsWithDeref(items.getAsRefTrait(), referenced)) {
                fixes.add(CandidateFix.convertVia(ConversionTrait.AS_REF, expected));
            }
            return unmodifiableList(fixes);
        }

        Ty actual = context.getActual();
        if (actual instanceof TyReference && !((TyReference) actual).getMutability().isMut()) {
            fixes.add(CandidateFix.changeRefToMutable());
        }
        if (context.getSyntax().isMutablePlace() && context.actualReferencesAllMutable()) {
            if (context.implementsWithDeref(items.getBorrowMutTrait(), referenced)) {
                fixes.add(CandidateFix.convertVia(ConversionTrait.BORROW_MUT, expected));
            }
            if (context.implementsWithDeref(items.getAsMutTrait(), referenced)) {
                fixes.add(CandidateFix.convertVia(ConversionTrait.AS_MUT, expected));
            }
        }
        return unmodifiableList(fixes);
    }
}
