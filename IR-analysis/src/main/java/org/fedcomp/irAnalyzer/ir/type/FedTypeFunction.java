package org.fedcomp.irAnalyzer.ir.type;

import org.fedcomp.util.IIndentStream;

import javax.annotation.Nullable;

/** The type of a function; functions without a parameter have a null parameter type. */
public final class FedTypeFunction extends FedType {
    @Nullable
    public final FedType parameter;
    public final FedType result;

    public FedTypeFunction(@Nullable FedType parameter, FedType result) {
        this.parameter = parameter;
        this.result = result;
    }

    @Override
    public boolean sameType(FedType other) {
        FedTypeFunction o = other.as(FedTypeFunction.class);
        if (o == null)
            return false;
        if (this.parameter == null)
            return o.parameter == null && this.result.sameType(o.result);
        return o.parameter != null &&
                this.parameter.sameType(o.parameter) &&
                this.result.sameType(o.result);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("(");
        if (this.parameter != null)
            builder.append(this.parameter).append(" ");
        return builder.append("-> ")
                .append(this.result)
                .append(")");
    }
}
