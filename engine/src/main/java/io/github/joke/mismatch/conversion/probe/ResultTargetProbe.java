package io.github.joke.mismatch.conversion.probe;

import static java.util.Collections.unmodifiableList;

import com.google.auto.service.AutoService;
import io.github.joke.mismatch.conversion.ConversionContext;
import io.github.joke.mismatch.conversion.ConversionProbe;
import io.github.joke.mismatch.fix.CandidateFix;
import io.github.joke.mismatch.fix.ConversionTrait;
import io.github.joke.mismatch.ty.AdtItem;
import io.github.joke.mismatch.ty.Ty;
import io.github.joke.mismatch.ty.TyAdt;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * {@code Result<T, E>} targets: a fallible conversion into {@code T} whose error type is exactly
 * {@code E} can be used as is.
 */
@AutoService(ConversionProbe.class)
public final class ResultTargetProbe implements ConversionProbe {

    @Override
    public int order() {
        return 600;
    }

    @Override
    public boolean canHandle(ConversionContext context) {
        @Nullable AdtItem result = context.getKnownItems().getResultItem();
        if (result == null || !(context.getExpected() instanceof TyAdt)) {
            return false;
        }
        TyAdt expected = (TyAdt) context.getExpected();
        return expected.getItem().equals(result) && expected.getTypeArguments().size() == 2;
    }

    @Override
    public List<CandidateFix> provide(ConversionContext context) {
        List<Ty> arguments = ((TyAdt) context.getExpected()).getTypeArguments();
        Ty okTy = arguments.get(0);
        Ty errTy = arguments.get(1);
        List<CandidateFix> fixes = new ArrayList<>();
        if (errTy.isEquivalentTo(context.tryFromErrTy(okTy))) {
            fixes.add(CandidateFix.convertAndUnpackVia(ConversionTrait.TRY_FROM, okTy, errTy));
        }
        if (errTy.isEquivalentTo(context.fromStrErrTy(okTy))) {
            fixes.add(CandidateFix.convertAndUnpackVia(ConversionTrait.FROM_STR, okTy, errTy));
        }
        return unmodifiableList(fixes);
    }
}
