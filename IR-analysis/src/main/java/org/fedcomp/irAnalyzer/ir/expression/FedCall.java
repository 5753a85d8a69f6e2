package org.fedcomp.irAnalyzer.ir.expression;

import org.fedcomp.irAnalyzer.compiler.errors.InternalCompilerError;
import org.fedcomp.irAnalyzer.compiler.visitors.VisitDecision;
import org.fedcomp.irAnalyzer.compiler.visitors.inner.InnerVisitor;
import org.fedcomp.irAnalyzer.ir.IFedNode;
import org.fedcomp.irAnalyzer.ir.type.FedType;
import org.fedcomp.irAnalyzer.ir.type.FedTypeFunction;
import org.fedcomp.util.IIndentStream;

import javax.annotation.Nullable;

/** Application of a function to an optional argument. */
public final class FedCall extends FedExpression {
    public final FedExpression function;
    @Nullable
    public final FedExpression argument;

    public FedCall(FedType type, FedExpression function, @Nullable FedExpression argument) {
        super(type);
        this.function = function;
        this.argument = argument;
    }

    /** A call whose type is the result type of the function. */
    public FedCall(FedExpression function, @Nullable FedExpression argument) {
        this(resultType(function), function, argument);
    }

    static FedType resultType(FedExpression function) {
        FedTypeFunction type = function.getType().as(FedTypeFunction.class);
        if (type == null)
            throw new InternalCompilerError("Calling an expression which is not a function", function);
        return type.result;
    }

    /** True if this calls the intrinsic with the specified uri directly. */
    public boolean calls(String uri) {
        FedIntrinsic intrinsic = this.function.as(FedIntrinsic.class);
        return intrinsic != null && intrinsic.uri.equals(uri);
    }

    public boolean calls(Intrinsics intrinsic) {
        return this.calls(intrinsic.uri);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.function.accept(visitor);
        if (this.argument != null)
            this.argument.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IFedNode other) {
        FedCall o = other.as(FedCall.class);
        if (o == null)
            return false;
        return this.function == o.function &&
                this.argument == o.argument &&
                this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.function).append("(");
        if (this.argument != null)
            builder.append(this.argument);
        return builder.append(")");
    }
}
