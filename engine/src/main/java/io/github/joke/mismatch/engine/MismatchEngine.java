package io.github.joke.mismatch.engine;

import io.github.joke.mismatch.di.DaggerEngineComponent;
import io.github.joke.mismatch.di.EngineComponent;
import io.github.joke.mismatch.di.EngineModule;
import io.github.joke.mismatch.di.RequestComponent;
import io.github.joke.mismatch.diagnostic.Diagnostic;
import io.github.joke.mismatch.diagnostic.PreparedAnnotation;
import io.github.joke.mismatch.diagnostic.TypeMismatch;
import io.github.joke.mismatch.fix.DiagnosisResult;
import io.github.joke.mismatch.resolve.TraitOracle;
import io.github.joke.mismatch.syntax.SyntaxHandle;
import io.github.joke.mismatch.ty.Ty;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point. An engine is immutable and may be shared between threads; every call runs in its own
 * request scope bound to the given oracle.
 */
@Slf4j
public final class MismatchEngine {

    private final EngineComponent component;

    private MismatchEngine(EngineComponent component) {
        this.component = component;
    }

    /** Engine configured from {@code mismatch.properties} and {@code mismatch.*} system properties. */
    public static MismatchEngine create() {
        return create(EngineConfig.load());
    }

    public static MismatchEngine create(EngineConfig config) {
        log.debug("Creating mismatch engine with {}", config);
        return new MismatchEngine(DaggerEngineComponent.factory().create(new EngineModule(config)));
    }

    public DiagnosisResult diagnose(Ty expected, Ty actual, SyntaxHandle element, TraitOracle oracle) {
        return request(oracle).fixSynthesizer().synthesize(expected, actual, element);
    }

    /** Records a mismatch, capturing its explanation now if either type is still being inferred. */
    public TypeMismatch typeMismatch(SyntaxHandle element, Ty expected, Ty actual) {
        return TypeMismatch.capture(element, expected, actual, component.reporter());
    }

    public PreparedAnnotation prepare(Diagnostic diagnostic, TraitOracle oracle) {
        return request(oracle).preparer().prepare(diagnostic);
    }

    private RequestComponent request(TraitOracle oracle) {
        return component.requestComponentFactory().create(oracle);
    }
}
