package org.fedcomp.irAnalyzer.ir.expression;

import org.fedcomp.irAnalyzer.compiler.visitors.VisitDecision;
import org.fedcomp.irAnalyzer.compiler.visitors.inner.InnerVisitor;
import org.fedcomp.irAnalyzer.ir.IFedNode;
import org.fedcomp.irAnalyzer.ir.type.FedType;
import org.fedcomp.util.IIndentStream;

import javax.annotation.Nullable;

/** A primitive operator, identified by a uri.
 * The uri need not be one of the well-known {@link Intrinsics}. */
public final class FedIntrinsic extends FedExpression {
    public final String uri;

    public FedIntrinsic(String uri, FedType type) {
        super(type);
        this.uri = uri;
    }

    public FedIntrinsic(Intrinsics intrinsic, FedType type) {
        this(intrinsic.uri, type);
    }

    /** The well-known intrinsic with this uri, if any. */
    @Nullable
    public Intrinsics getIntrinsic() {
        return Intrinsics.fromUri(this.uri);
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
        FedIntrinsic o = other.as(FedIntrinsic.class);
        if (o == null)
            return false;
        return this.uri.equals(o.uri) && this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.uri);
    }
}
