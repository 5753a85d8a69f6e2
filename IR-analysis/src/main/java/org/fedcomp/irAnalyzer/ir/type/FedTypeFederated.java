package org.fedcomp.irAnalyzer.ir.type;

import org.fedcomp.util.IIndentStream;

/** A value distributed over the members of a placement.
 * 'allEqual' means that all members hold the same value. */
public final class FedTypeFederated extends FedType {
    public final FedType member;
    public final Placement placement;
    public final boolean allEqual;

    public FedTypeFederated(FedType member, Placement placement, boolean allEqual) {
        this.member = member;
        this.placement = placement;
        this.allEqual = allEqual;
    }

    public FedTypeFederated(FedType member, Placement placement) {
        this(member, placement, placement.defaultAllEqual);
    }

    @Override
    public boolean isFederated() {
        return true;
    }

    @Override
    public boolean sameType(FedType other) {
        FedTypeFederated o = other.as(FedTypeFederated.class);
        if (o == null)
            return false;
        return this.placement == o.placement &&
                this.allEqual == o.allEqual &&
                this.member.sameType(o.member);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.allEqual)
            builder.append(this.member);
        else
            builder.append("{").append(this.member).append("}");
        return builder.append("@").append(this.placement.toString());
    }
}
