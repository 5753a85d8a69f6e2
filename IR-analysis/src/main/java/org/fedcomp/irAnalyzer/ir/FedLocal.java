package org.fedcomp.irAnalyzer.ir;

import org.fedcomp.irAnalyzer.compiler.visitors.VisitDecision;
import org.fedcomp.irAnalyzer.compiler.visitors.inner.InnerVisitor;
import org.fedcomp.irAnalyzer.ir.expression.FedExpression;
import org.fedcomp.irAnalyzer.ir.expression.FedReference;
import org.fedcomp.util.IIndentStream;

/** A local binding 'name = value' of a {@link org.fedcomp.irAnalyzer.ir.expression.FedBlock}.
 * The name is visible in the subsequent locals and in the result of the block. */
public final class FedLocal extends FedNode implements IFedDeclaration {
    public final String name;
    public final FedExpression value;

    public FedLocal(String name, FedExpression value) {
        this.name = name;
        this.value = value;
    }

    @Override
    public String getName() {
        return this.name;
    }

    public FedReference asReference() {
        return new FedReference(this.name, this.value.getType());
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.value.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IFedNode other) {
        FedLocal o = other.as(FedLocal.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) && this.value == o.value;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name)
                .append("=")
                .append(this.value);
    }
}
