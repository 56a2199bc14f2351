package io.github.joke.mismatch.diagnostic;

import io.github.joke.mismatch.syntax.SyntaxHandle;

/** A call supplies a different number of arguments than the callee declares. */
public final class IncorrectArgumentCount extends Diagnostic {

    private final int expectedCount;
    private final int actualCount;
    private final FunctionType functionType;

    public IncorrectArgumentCount(
            SyntaxHandle element, int expectedCount, int actualCount, FunctionType functionType) {
        super(element);
        this.expectedCount = expectedCount;
        this.actualCount = actualCount;
        this.functionType = functionType;
    }

    public int getExpectedCount() {
        return expectedCount;
    }

    public int getActualCount() {
        return actualCount;
    }

    public FunctionType getFunctionType() {
        return functionType;
    }

    public enum FunctionType {
        VARIADIC_FUNCTION(true, ErrorCode.E0060),
        FUNCTION(false, ErrorCode.E0061),
        CLOSURE(false, ErrorCode.E0057);

        private final boolean variadic;
        private final ErrorCode errorCode;

        FunctionType(boolean variadic, ErrorCode errorCode) {
            this.variadic = variadic;
            this.errorCode = errorCode;
        }

        /** A variadic callee accepts more than {@code expectedCount} arguments. */
        public boolean isVariadic() {
            return variadic;
        }

        public ErrorCode getErrorCode() {
            return errorCode;
        }
    }
}
