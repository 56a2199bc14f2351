package io.github.joke.mismatch.diagnostic;

public enum Severity {
    INFO,
    WARN,
    ERROR,
    UNKNOWN_SYMBOL
}
