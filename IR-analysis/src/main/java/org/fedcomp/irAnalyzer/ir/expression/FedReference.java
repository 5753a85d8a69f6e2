package org.fedcomp.irAnalyzer.ir.expression;

import org.fedcomp.irAnalyzer.compiler.visitors.VisitDecision;
import org.fedcomp.irAnalyzer.compiler.visitors.inner.InnerVisitor;
import org.fedcomp.irAnalyzer.ir.IFedNode;
import org.fedcomp.irAnalyzer.ir.type.FedType;
import org.fedcomp.util.IIndentStream;

/** A reference to a name bound by an enclosing lambda or block.
 * A reference with no enclosing binding is free. */
public final class FedReference extends FedExpression {
    public final String name;

    public FedReference(String name, FedType type) {
        super(type);
        this.name = name;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IFedNode other) {
        FedReference o = other.as(FedReference.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) && this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }
}
