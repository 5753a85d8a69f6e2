package org.fedcomp.irAnalyzer.compiler.visitors.inner;

import org.fedcomp.irAnalyzer.compiler.errors.PlacementMismatchError;
import org.fedcomp.irAnalyzer.ir.expression.FedExpression;
import org.fedcomp.irAnalyzer.ir.type.FedTypeFederated;
import org.fedcomp.irAnalyzer.ir.type.Placement;

/** Checks that every expression with a federated type is placed at
 * a single placement.  Throws {@link PlacementMismatchError} at the first
 * expression in postorder that is placed elsewhere. */
public class CheckSinglePlacement extends InnerVisitor {
    final Placement placement;

    public CheckSinglePlacement(Placement placement) {
        this.placement = placement;
    }

    @Override
    public void postorder(FedExpression expression) {
        FedTypeFederated type = expression.getType().as(FedTypeFederated.class);
        if (type != null && type.placement != this.placement)
            throw new PlacementMismatchError(expression, this.placement, type.placement);
    }
}
