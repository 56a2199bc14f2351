package io.github.joke.mismatch.conversion.probe;

import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;

import com.google.auto.service.AutoService;
import io.github.joke.mismatch.conversion.ConversionContext;
import io.github.joke.mismatch.conversion.ConversionProbe;
import io.github.joke.mismatch.fix.CandidateFix;
import io.github.joke.mismatch.fix.ConversionTrait;
import io.github.joke.mismatch.resolve.KnownItems;
import io.github.joke.mismatch.resolve.TraitItem;
import io.github.joke.mismatch.resolve.TraitRef;
import io.github.joke.mismatch.ty.Ty;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** {@code From<actual> for expected}, falling back to {@code TryFrom} only when {@code From} is missing. */
@AutoService(ConversionProbe.class)
public final class FromProbe implements ConversionProbe {

    @Override
    public int order() {
        return 100;
    }

    @Override
    public boolean canHandle(ConversionContext context) {
        KnownItems items = context.getKnownItems();
        return items.getFromTrait() != null || items.getTryFromTrait() != null;
    }

    @Override
    public List<CandidateFix> provide(ConversionContext context) {
        Ty expected = context.getExpected();
        @Nullable TraitItem from = context.getKnownItems().getFromTrait();
        if (from != null
                && context.getOracle().canSelect(new TraitRef(expected, from.withSubst(context.getActual())))) {
            return singletonList(CandidateFix.convertVia(ConversionTrait.FROM, expected));
        }
        @Nullable Ty errTy = context.tryFromErrTy(expected);
        if (errTy != null) {
            return singletonList(CandidateFix.convertVia(ConversionTrait.TRY_FROM, expected, errTy));
        }
        return emptyList();
    }
}
