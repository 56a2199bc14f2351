package io.github.joke.mismatch.conversion.probe;

import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;

import com.google.auto.service.AutoService;
import io.github.joke.mismatch.conversion.ConversionContext;
import io.github.joke.mismatch.conversion.ConversionProbe;
import io.github.joke.mismatch.fix.CandidateFix;
import io.github.joke.mismatch.fix.ConversionTrait;
import java.util.List;

/** {@code String} targets; numbers are offered {@code to_string()} even without a resolved impl. */
@AutoService(ConversionProbe.class)
public final class ToStringProbe implements ConversionProbe {

    @Override
    public int order() {
        return 400;
    }

    @Override
    public boolean canHandle(ConversionContext context) {
        return context.getExpected().isEquivalentTo(context.getKnownItems().stringTy());
    }

    @Override
    public List<CandidateFix> provide(ConversionContext context) {
        if (context.implementsWithDeref(context.getKnownItems().getToStringTrait()) || context.isActualNumeric()) {
            return singletonList(CandidateFix.convertVia(ConversionTrait.TO_STRING, context.getExpected()));
        }
        return emptyList();
    }
}
