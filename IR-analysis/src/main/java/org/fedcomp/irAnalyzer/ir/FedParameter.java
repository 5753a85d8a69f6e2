package org.fedcomp.irAnalyzer.ir;

import org.fedcomp.irAnalyzer.compiler.visitors.VisitDecision;
import org.fedcomp.irAnalyzer.compiler.visitors.inner.InnerVisitor;
import org.fedcomp.irAnalyzer.ir.expression.FedReference;
import org.fedcomp.irAnalyzer.ir.type.FedType;
import org.fedcomp.util.IIndentStream;

/** The parameter of a {@link org.fedcomp.irAnalyzer.ir.expression.FedLambda}. */
public final class FedParameter extends FedNode implements IFedDeclaration {
    public final String name;
    public final FedType type;

    public FedParameter(String name, FedType type) {
        this.name = name;
        this.type = type;
    }

    @Override
    public String getName() {
        return this.name;
    }

    public FedType getType() {
        return this.type;
    }

    /** A fresh reference to this parameter. */
    public FedReference asReference() {
        return new FedReference(this.name, this.type);
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
        FedParameter o = other.as(FedParameter.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) && this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }
}
