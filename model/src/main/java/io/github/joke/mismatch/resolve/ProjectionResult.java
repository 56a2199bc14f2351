package io.github.joke.mismatch.resolve;

import io.github.joke.mismatch.ty.Ty;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of projecting an associated type out of a trait implementation. Only {@link Status#OK}
 * carries a value; every other status means "no usable projection".
 */
public final class ProjectionResult {

    private static final ProjectionResult NO_IMPL = new ProjectionResult(Status.NO_IMPL, null);
    private static final ProjectionResult AMBIGUOUS = new ProjectionResult(Status.AMBIGUOUS, null);
    private static final ProjectionResult NO_BINDING = new ProjectionResult(Status.NO_BINDING, null);

    private final Status status;
    private final @Nullable Ty value;

    private ProjectionResult(Status status, @Nullable Ty value) {
        this.status = status;
        this.value = value;
    }

    public static ProjectionResult ok(Ty value) {
        return new ProjectionResult(Status.OK, Objects.requireNonNull(value, "value"));
    }

    public static ProjectionResult noImpl() {
        return NO_IMPL;
    }

    public static ProjectionResult ambiguous() {
        return AMBIGUOUS;
    }

    public static ProjectionResult noBinding() {
        return NO_BINDING;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    /** The projected type, or null unless the status is {@link Status#OK}. */
    public @Nullable Ty ok() {
        return value;
    }

    @Override
    public String toString() {
        return value == null ? status.name() : status + "(" + value + ")";
    }

    public enum Status {
        OK,
        /** The trait is not implemented for the self type. */
        NO_IMPL,
        /** More than one implementation applies. */
        AMBIGUOUS,
        /** An implementation applies but does not bind the associated type. */
        NO_BINDING
    }
}
