package io.github.joke.mismatch.fix;

public enum FixKind {
    /** {@code expr as T} between numeric types. */
    AS_CAST,
    /** Convert through a trait; carries the error type when the conversion is fallible. */
    CONVERT_VIA,
    /** The expected type is {@code Result<T, E>} and a fallible conversion into {@code T} fails with {@code E}. */
    CONVERT_AND_UNPACK_VIA,
    CHANGE_REF_TO_MUTABLE,
    TO_IMMUTABLE_STR,
    TO_MUTABLE_STR,
    DEREF_REF_BRIDGE,
    CHANGE_RETURN_TYPE,
    CHANGE_LET_DECL_TYPE
}
