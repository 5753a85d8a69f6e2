package org.fedcomp.irAnalyzer.compiler.visitors.inner;

import org.fedcomp.irAnalyzer.ir.IFedNode;
import org.fedcomp.irAnalyzer.ir.expression.FedExpression;

import java.util.function.Predicate;

/** Counts the expressions that satisfy a predicate.
 * Parameters and block locals are bindings, not expressions, and are never counted. */
public class CountNodes extends InnerVisitor {
    final Predicate<FedExpression> predicate;
    int count;

    public CountNodes(Predicate<FedExpression> predicate) {
        this.predicate = predicate;
        this.count = 0;
    }

    public CountNodes() {
        this(e -> true);
    }

    @Override
    public void startVisit(IFedNode node) {
        super.startVisit(node);
        this.count = 0;
    }

    @Override
    public void postorder(FedExpression expression) {
        if (this.predicate.test(expression))
            this.count++;
    }

    public int getCount() {
        return this.count;
    }
}
