package org.fedcomp.irAnalyzer.ir.type;

import org.fedcomp.util.IIndentStream;

/** A sequence of values of the same type. */
public final class FedTypeSequence extends FedType {
    public final FedType element;

    public FedTypeSequence(FedType element) {
        this.element = element;
    }

    @Override
    public boolean sameType(FedType other) {
        FedTypeSequence o = other.as(FedTypeSequence.class);
        return o != null && this.element.sameType(o.element);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.element).append("*");
    }
}
