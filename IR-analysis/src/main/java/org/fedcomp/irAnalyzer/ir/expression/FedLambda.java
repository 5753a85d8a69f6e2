package org.fedcomp.irAnalyzer.ir.expression;

import org.fedcomp.irAnalyzer.compiler.visitors.VisitDecision;
import org.fedcomp.irAnalyzer.compiler.visitors.inner.InnerVisitor;
import org.fedcomp.irAnalyzer.ir.FedParameter;
import org.fedcomp.irAnalyzer.ir.IFedNode;
import org.fedcomp.irAnalyzer.ir.type.FedType;
import org.fedcomp.irAnalyzer.ir.type.FedTypeFunction;
import org.fedcomp.util.IIndentStream;

/** An expression of the form (parameter -> body).
 * The parameter is visible in the body only. */
public final class FedLambda extends FedExpression {
    public final FedParameter parameter;
    public final FedExpression body;

    public FedLambda(FedParameter parameter, FedExpression body) {
        super(new FedTypeFunction(parameter.getType(), body.getType()));
        this.parameter = parameter;
        this.body = body;
    }

    public FedLambda(String parameterName, FedType parameterType, FedExpression body) {
        this(new FedParameter(parameterName, parameterType), body);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.parameter.accept(visitor);
        this.body.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IFedNode other) {
        FedLambda o = other.as(FedLambda.class);
        if (o == null)
            return false;
        return this.parameter == o.parameter && this.body == o.body;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.parameter)
                .append(" -> ")
                .append(this.body)
                .append(")");
    }
}
