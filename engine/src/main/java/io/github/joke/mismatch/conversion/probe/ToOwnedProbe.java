package io.github.joke.mismatch.conversion.probe;

import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;

import com.google.auto.service.AutoService;
import io.github.joke.mismatch.conversion.ConversionContext;
import io.github.joke.mismatch.conversion.ConversionProbe;
import io.github.joke.mismatch.fix.CandidateFix;
import io.github.joke.mismatch.fix.ConversionTrait;
import io.github.joke.mismatch.resolve.TraitItem;
import io.github.joke.mismatch.ty.Ty;
import java.util.List;
import org.jspecify.annotations.Nullable;

@AutoService(ConversionProbe.class)
public final class ToOwnedProbe implements ConversionProbe {

    @Override
    public int order() {
        return 300;
    }

    @Override
    public boolean canHandle(ConversionContext context) {
        @Nullable TraitItem toOwned = context.getKnownItems().getToOwnedTrait();
        return toOwned != null && toOwned.findAssociatedType("Owned") != null;
    }

    @Override
    public List<CandidateFix> provide(ConversionContext context) {
        @Nullable Ty ownedTy = context.projectWithDeref(context.getKnownItems().getToOwnedTrait(), "Owned");
        if (ownedTy == null || !ownedTy.isEquivalentTo(context.getExpected())) {
            return emptyList();
        }
        return singletonList(CandidateFix.convertVia(ConversionTrait.TO_OWNED, context.getExpected()));
    }
}
