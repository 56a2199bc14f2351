package io.github.joke.mismatch.di;

import dagger.Component;
import io.github.joke.mismatch.diagnostic.DiagnosticReporter;

@EngineScoped
@Component(modules = EngineModule.class)
public interface EngineComponent {

    RequestComponent.Factory requestComponentFactory();

    DiagnosticReporter reporter();

    @Component.Factory
    interface Factory {
        EngineComponent create(EngineModule engineModule);
    }
}
