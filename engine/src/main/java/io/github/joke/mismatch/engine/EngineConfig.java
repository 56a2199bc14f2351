package io.github.joke.mismatch.engine;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import lombok.Builder;
import lombok.Value;
import org.jspecify.annotations.Nullable;

/**
 * Engine settings. {@link #load()} reads {@code mismatch.properties} from the classpath and lets
 * {@code mismatch.}-prefixed system properties override individual keys.
 */
@Value
@Builder
public class EngineConfig {

    public static final String RESOURCE = "mismatch.properties";
    public static final String SYSTEM_PREFIX = "mismatch.";

    public static final String COERCION_MAX_DEPTH = "coercion.max-depth";
    public static final String QUALIFY_CONFLICTING_NAMES = "names.qualify-conflicting";
    public static final String SIGNATURE_FIXES = "fixes.signature";

    /** Longest coercion sequence the engine walks before giving up on the rest. */
    @Builder.Default
    int coercionMaxDepth = 64;

    /** Render ADTs whose short names collide with their full path in explanations. */
    @Builder.Default
    boolean qualifyConflictingNames = true;

    /** Offer changing a let binding's declared type or a function's return type. */
    @Builder.Default
    boolean signatureFixes = true;

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static EngineConfig load() {
        Properties properties = new Properties();
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        Properties system = System.getProperties();
        for (String name : system.stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX)) {
                properties.setProperty(name.substring(SYSTEM_PREFIX.length()), system.getProperty(name));
            }
        }
        return fromProperties(properties);
    }

    /** @throws IllegalArgumentException naming the key of the first malformed value */
    public static EngineConfig fromProperties(Properties properties) {
        EngineConfigBuilder builder = builder();
        @Nullable String depth = properties.getProperty(COERCION_MAX_DEPTH);
        if (depth != null) {
            builder.coercionMaxDepth(parsePositiveInt(COERCION_MAX_DEPTH, depth));
        }
        @Nullable String qualify = properties.getProperty(QUALIFY_CONFLICTING_NAMES);
        if (qualify != null) {
            builder.qualifyConflictingNames(parseBoolean(QUALIFY_CONFLICTING_NAMES, qualify));
        }
        @Nullable String signature = properties.getProperty(SIGNATURE_FIXES);
        if (signature != null) {
            builder.signatureFixes(parseBoolean(SIGNATURE_FIXES, signature));
        }
        return builder.build();
    }

    private static int parsePositiveInt(String key, String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
        if (parsed < 1) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value + " (must be >= 1)");
        }
        return parsed;
    }

    private static boolean parseBoolean(String key, String value) {
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
    }
}
