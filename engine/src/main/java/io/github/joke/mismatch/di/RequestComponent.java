package io.github.joke.mismatch.di;

import dagger.BindsInstance;
import dagger.Subcomponent;
import io.github.joke.mismatch.diagnostic.DiagnosticPreparer;
import io.github.joke.mismatch.fix.FixSynthesizer;
import io.github.joke.mismatch.resolve.TraitOracle;

/** One diagnosis against one trait environment. */
@RequestScoped
@Subcomponent
public interface RequestComponent {

    FixSynthesizer fixSynthesizer();

    DiagnosticPreparer preparer();

    @Subcomponent.Factory
    interface Factory {
        RequestComponent create(@BindsInstance TraitOracle oracle);
    }
}
