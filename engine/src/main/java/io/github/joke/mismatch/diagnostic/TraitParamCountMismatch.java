package io.github.joke.mismatch.diagnostic;

import io.github.joke.mismatch.syntax.SyntaxHandle;

/** An impl method declares a different number of parameters than the trait method it implements. */
public final class TraitParamCountMismatch extends Diagnostic {

    private final String functionName;
    private final String traitName;
    private final int paramsCount;
    private final int superParamsCount;

    public TraitParamCountMismatch(
            SyntaxHandle element, String functionName, String traitName, int paramsCount, int superParamsCount) {
        super(element);
        this.functionName = functionName;
        this.traitName = traitName;
        this.paramsCount = paramsCount;
        this.superParamsCount = superParamsCount;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getTraitName() {
        return traitName;
    }

    public int getParamsCount() {
        return paramsCount;
    }

    public int getSuperParamsCount() {
        return superParamsCount;
    }
}
