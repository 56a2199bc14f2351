package io.github.joke.mismatch.diagnostic;

/** Stable compiler error codes of the diagnostics this engine prepares. */
public enum ErrorCode {
    E0050,
    E0054,
    E0057,
    E0060,
    E0061,
    E0069,
    E0308,
    E0384,
    E0594,
    E0614;

    private static final String ERROR_INDEX = "https://doc.rust-lang.org/error-index.html#";

    public String code() {
        return name();
    }

    public String infoUrl() {
        return ERROR_INDEX + code();
    }
}
