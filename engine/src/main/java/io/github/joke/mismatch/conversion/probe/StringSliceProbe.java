package io.github.joke.mismatch.conversion.probe;

import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;

import com.google.auto.service.AutoService;
import io.github.joke.mismatch.conversion.ConversionContext;
import io.github.joke.mismatch.conversion.ConversionProbe;
import io.github.joke.mismatch.fix.CandidateFix;
import io.github.joke.mismatch.ty.Ty;
import io.github.joke.mismatch.ty.TyReference;
import io.github.joke.mismatch.ty.TyStr;
import java.util.List;

/** {@code String} to {@code &str} or {@code &mut str} via {@code as_str}/{@code as_mut_str}. */
@AutoService(ConversionProbe.class)
public final class StringSliceProbe implements ConversionProbe {

    private static final Ty STR_REF = TyReference.ref(TyStr.INSTANCE);
    private static final Ty STR_REF_MUT = TyReference.refMut(TyStr.INSTANCE);

    @Override
    public int order() {
        return 700;
    }

    @Override
    public boolean canHandle(ConversionContext context) {
        return context.getActual().isEquivalentTo(context.getKnownItems().stringTy());
    }

    @Override
    public List<CandidateFix> provide(ConversionContext context) {
        Ty expected = context.getExpected();
        if (expected.isEquivalentTo(STR_REF)) {
            return singletonList(CandidateFix.toImmutableStr());
        }
        if (expected.isEquivalentTo(STR_REF_MUT)) {
            return singletonList(CandidateFix.toMutableStr());
        }
        return emptyList();
    }
}
