package io.github.joke.mismatch.conversion;

import io.github.joke.mismatch.fix.CandidateFix;
import java.util.List;

/**
 * SPI for one trait-based way of turning the actual type into the expected one. Implementations are
 * discovered with {@link java.util.ServiceLoader} and asked in ascending {@link #order()}.
 */
public interface ConversionProbe {

    /** Position among the probes; candidates are reported in this order. */
    int order();

    boolean canHandle(ConversionContext context);

    /** Called only when {@link #canHandle(ConversionContext)} returned true. May return an empty list. */
    List<CandidateFix> provide(ConversionContext context);
}
