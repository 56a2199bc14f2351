package io.github.joke.mismatch.conversion.probe;

import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;

import com.google.auto.service.AutoService;
import io.github.joke.mismatch.conversion.ConversionContext;
import io.github.joke.mismatch.conversion.ConversionProbe;
import io.github.joke.mismatch.fix.CandidateFix;
import io.github.joke.mismatch.fix.ConversionTrait;
import io.github.joke.mismatch.ty.Ty;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Parsing through {@code FromStr}; independent of whether {@code From} applies. */
@AutoService(ConversionProbe.class)
public final class FromStrProbe implements ConversionProbe {

    @Override
    public int order() {
        return 200;
    }

    @Override
    public boolean canHandle(ConversionContext context) {
        return context.getKnownItems().getFromStrTrait() != null;
    }

    @Override
    public List<CandidateFix> provide(ConversionContext context) {
        @Nullable Ty errTy = context.fromStrErrTy(context.getExpected());
        if (errTy == null) {
            return emptyList();
        }
        return singletonList(CandidateFix.convertVia(ConversionTrait.FROM_STR, context.getExpected(), errTy));
    }
}
