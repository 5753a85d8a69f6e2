package org.fedcomp.irAnalyzer.ir.type;

import org.fedcomp.util.IIndentStream;

/** The type of a placement literal. */
public final class FedTypePlacement extends FedType {
    public static final FedTypePlacement INSTANCE = new FedTypePlacement();

    private FedTypePlacement() {}

    @Override
    public boolean sameType(FedType other) {
        return other.is(FedTypePlacement.class);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("placement");
    }
}
