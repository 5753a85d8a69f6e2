package org.fedcomp.irAnalyzer.ir.expression;

import org.fedcomp.irAnalyzer.compiler.errors.InternalCompilerError;
import org.fedcomp.irAnalyzer.compiler.visitors.VisitDecision;
import org.fedcomp.irAnalyzer.compiler.visitors.inner.InnerVisitor;
import org.fedcomp.irAnalyzer.ir.IFedNode;
import org.fedcomp.irAnalyzer.ir.type.FedType;
import org.fedcomp.irAnalyzer.ir.type.FedTypeTuple;
import org.fedcomp.util.IIndentStream;
import org.fedcomp.util.Utilities;

/** Projection of one element of a tuple-typed expression. */
public final class FedSelection extends FedExpression {
    public final FedExpression source;
    public final int index;

    public FedSelection(FedType type, FedExpression source, int index) {
        super(type);
        this.source = source;
        this.index = index;
    }

    public FedSelection(FedExpression source, int index) {
        this(elementType(source, index), source, index);
    }

    static FedType elementType(FedExpression source, int index) {
        FedTypeTuple tuple = source.getType().as(FedTypeTuple.class);
        if (tuple == null)
            throw new InternalCompilerError("Selecting from an expression which is not a tuple", source);
        if (index < 0 || index >= tuple.size())
            throw new InternalCompilerError("Index " + index + " out of bounds for " + tuple, source);
        return tuple.getElement(index);
    }

    /** Select the element with the specified name. */
    public static FedSelection byName(FedExpression source, String name) {
        FedTypeTuple tuple = source.getType().as(FedTypeTuple.class);
        if (tuple != null) {
            int index = tuple.names.indexOf(name);
            if (index >= 0)
                return new FedSelection(source, index);
        }
        throw new InternalCompilerError("No element named " + Utilities.singleQuote(name) +
                " in " + source.getType(), source);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.source.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IFedNode other) {
        FedSelection o = other.as(FedSelection.class);
        if (o == null)
            return false;
        return this.source == o.source && this.index == o.index && this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.source)
                .append("[")
                .append(this.index)
                .append("]");
    }
}
