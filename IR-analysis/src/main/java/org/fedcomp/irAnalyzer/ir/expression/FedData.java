package org.fedcomp.irAnalyzer.ir.expression;

import org.fedcomp.irAnalyzer.compiler.visitors.VisitDecision;
import org.fedcomp.irAnalyzer.compiler.visitors.inner.InnerVisitor;
import org.fedcomp.irAnalyzer.ir.IFedNode;
import org.fedcomp.irAnalyzer.ir.type.FedType;
import org.fedcomp.util.IIndentStream;

/** An opaque external value, identified by a uri. */
public final class FedData extends FedExpression {
    public final String uri;

    public FedData(String uri, FedType type) {
        super(type);
        this.uri = uri;
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
        FedData o = other.as(FedData.class);
        if (o == null)
            return false;
        return this.uri.equals(o.uri) && this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.uri);
    }
}
