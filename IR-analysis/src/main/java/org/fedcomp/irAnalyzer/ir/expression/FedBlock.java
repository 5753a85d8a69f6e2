package org.fedcomp.irAnalyzer.ir.expression;

import org.fedcomp.irAnalyzer.compiler.visitors.VisitDecision;
import org.fedcomp.irAnalyzer.compiler.visitors.inner.InnerVisitor;
import org.fedcomp.irAnalyzer.ir.FedLocal;
import org.fedcomp.irAnalyzer.ir.IFedNode;
import org.fedcomp.util.IIndentStream;
import org.fedcomp.util.Linq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A sequential let: (let x=v, y=w in result).
 * Each local is visible in the locals that follow it and in the result. */
public final class FedBlock extends FedExpression {
    public final List<FedLocal> locals;
    public final FedExpression result;

    public FedBlock(List<FedLocal> locals, FedExpression result) {
        super(result.getType());
        this.locals = Collections.unmodifiableList(new ArrayList<>(locals));
        this.result = result;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (FedLocal local: this.locals)
            local.accept(visitor);
        this.result.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IFedNode other) {
        FedBlock o = other.as(FedBlock.class);
        if (o == null)
            return false;
        return Linq.same(this.locals, o.locals) && this.result == o.result;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(let ")
                .join(",", this.locals)
                .append(" in ")
                .append(this.result)
                .append(")");
    }
}
