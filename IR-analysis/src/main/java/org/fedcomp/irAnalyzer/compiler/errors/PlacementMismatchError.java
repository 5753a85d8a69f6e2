package org.fedcomp.irAnalyzer.compiler.errors;

import org.fedcomp.irAnalyzer.ir.expression.FedExpression;
import org.fedcomp.irAnalyzer.ir.type.Placement;

/** A federated value is placed somewhere other than the single allowed placement. */
public final class PlacementMismatchError extends AnalysisViolation {
    public final Placement expected;
    public final Placement found;

    public PlacementMismatchError(FedExpression node, Placement expected, Placement found) {
        super("Expression contains a placement other than " + expected +
                "; placement " + found + " on expression " + node +
                " inside the structure", node);
        this.expected = expected;
        this.found = found;
    }

    @Override
    public String getErrorKind() {
        return "Placement mismatch";
    }
}
