package org.fedcomp.irAnalyzer.ir.type;

import org.fedcomp.util.IIndentStream;

import java.util.Arrays;

/** A tensor with an element type and a shape.  Dimensions of unknown
 * size are represented by -1; an empty shape is a scalar. */
public final class FedTypeTensor extends FedType {
    public final String dtype;
    private final int[] shape;

    public static final FedTypeTensor INT32 = new FedTypeTensor("int32");
    public static final FedTypeTensor FLOAT32 = new FedTypeTensor("float32");
    public static final FedTypeTensor BOOL = new FedTypeTensor("bool");

    public FedTypeTensor(String dtype, int... shape) {
        this.dtype = dtype;
        this.shape = shape.clone();
    }

    public int[] getShape() {
        return this.shape.clone();
    }

    @Override
    public boolean sameType(FedType other) {
        FedTypeTensor o = other.as(FedTypeTensor.class);
        if (o == null)
            return false;
        return this.dtype.equals(o.dtype) && Arrays.equals(this.shape, o.shape);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.dtype);
        if (this.shape.length > 0) {
            builder.append("[");
            for (int i = 0; i < this.shape.length; i++) {
                if (i > 0)
                    builder.append(",");
                if (this.shape[i] < 0)
                    builder.append("?");
                else
                    builder.append(this.shape[i]);
            }
            builder.append("]");
        }
        return builder;
    }
}
