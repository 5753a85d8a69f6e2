package org.fedcomp.irAnalyzer.compiler.errors;

import org.fedcomp.irAnalyzer.ir.expression.FedExpression;

/** Some name is bound more than once in a tree. */
public final class NonUniqueNameError extends AnalysisViolation {
    public NonUniqueNameError(String message, FedExpression tree) {
        super(message, tree);
    }

    @Override
    public String getErrorKind() {
        return "Non-unique name";
    }
}
