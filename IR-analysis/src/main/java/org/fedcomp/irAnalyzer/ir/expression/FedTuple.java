package org.fedcomp.irAnalyzer.ir.expression;

import org.fedcomp.irAnalyzer.compiler.visitors.VisitDecision;
import org.fedcomp.irAnalyzer.compiler.visitors.inner.InnerVisitor;
import org.fedcomp.irAnalyzer.ir.IFedNode;
import org.fedcomp.irAnalyzer.ir.type.FedTypeTuple;
import org.fedcomp.util.IIndentStream;
import org.fedcomp.util.Linq;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** A tuple of expressions; elements may be named. */
public final class FedTuple extends FedExpression {
    public final List<FedExpression> elements;

    public FedTuple(List<FedExpression> elements, List<String> names) {
        super(new FedTypeTuple(Linq.map(elements, FedExpression::getType), names));
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public FedTuple(FedExpression... elements) {
        this(Arrays.asList(elements), Arrays.asList(new String[elements.length]));
    }

    public FedTypeTuple getTupleType() {
        return this.getType().to(FedTypeTuple.class);
    }

    public int size() {
        return this.elements.size();
    }

    @Nullable
    public String getName(int index) {
        return this.getTupleType().getName(index);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (FedExpression element: this.elements)
            element.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IFedNode other) {
        FedTuple o = other.as(FedTuple.class);
        if (o == null)
            return false;
        return Linq.same(this.elements, o.elements) &&
                this.getTupleType().names.equals(o.getTupleType().names);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("<");
        for (int i = 0; i < this.size(); i++) {
            if (i > 0)
                builder.append(",");
            String name = this.getName(i);
            if (name != null)
                builder.append(name).append("=");
            builder.append(this.elements.get(i));
        }
        return builder.append(">");
    }
}
