package io.github.joke.mismatch.di;

import static java.util.Comparator.comparingInt;
import static java.util.stream.Collectors.toUnmodifiableList;

import dagger.Module;
import dagger.Provides;
import io.github.joke.mismatch.conversion.ConversionProbe;
import io.github.joke.mismatch.engine.EngineConfig;
import io.github.joke.mismatch.ty.DefaultTypeRenderer;
import io.github.joke.mismatch.ty.TypeRenderer;
import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.StreamSupport;

@Module(subcomponents = RequestComponent.class)
public final class EngineModule {

    private final EngineConfig config;

    public EngineModule(EngineConfig config) {
        this.config = config;
    }

    @Provides
    @EngineScoped
    EngineConfig engineConfig() {
        return config;
    }

    @Provides
    @EngineScoped
    TypeRenderer typeRenderer() {
        return DefaultTypeRenderer.INSTANCE;
    }

    @Provides
    @EngineScoped
    List<ConversionProbe> conversionProbes() {
        return StreamSupport.stream(
                        ServiceLoader.load(ConversionProbe.class, EngineModule.class.getClassLoader())
                                .spliterator(),
                        false)
                .sorted(comparingInt(ConversionProbe::order))
                .collect(toUnmodifiableList());
    }
}
