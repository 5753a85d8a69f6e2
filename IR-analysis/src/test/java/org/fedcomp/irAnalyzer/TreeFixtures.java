package org.fedcomp.irAnalyzer;

import org.fedcomp.irAnalyzer.ir.FedLocal;
import org.fedcomp.irAnalyzer.ir.expression.FedBlock;
import org.fedcomp.irAnalyzer.ir.expression.FedCall;
import org.fedcomp.irAnalyzer.ir.expression.FedData;
import org.fedcomp.irAnalyzer.ir.expression.FedExpression;
import org.fedcomp.irAnalyzer.ir.expression.FedIntrinsic;
import org.fedcomp.irAnalyzer.ir.expression.FedLambda;
import org.fedcomp.irAnalyzer.ir.expression.FedReference;
import org.fedcomp.irAnalyzer.ir.expression.FedTuple;
import org.fedcomp.irAnalyzer.ir.expression.Intrinsics;
import org.fedcomp.irAnalyzer.ir.type.FedType;
import org.fedcomp.irAnalyzer.ir.type.FedTypeFederated;
import org.fedcomp.irAnalyzer.ir.type.FedTypeFunction;
import org.fedcomp.irAnalyzer.ir.type.FedTypeTensor;
import org.fedcomp.irAnalyzer.ir.type.FedTypeTuple;
import org.fedcomp.irAnalyzer.ir.type.Placement;

import java.util.Arrays;

/** Small trees shared by the tests. */
public class TreeFixtures {
    public static final FedType INT = FedTypeTensor.INT32;
    public static final FedType INT_AT_SERVER = new FedTypeFederated(INT, Placement.SERVER);
    public static final FedType INT_AT_CLIENTS = new FedTypeFederated(INT, Placement.CLIENTS);

    private TreeFixtures() {}

    /** An intrinsic used as the target of dependence queries. */
    public static FedIntrinsic dummyIntrinsic(FedType type) {
        return new FedIntrinsic("dummy_intrinsic", type);
    }

    public static FedIntrinsic dummyIntrinsic() {
        return dummyIntrinsic(INT);
    }

    public static boolean isDummyIntrinsic(FedExpression expression) {
        FedIntrinsic intrinsic = expression.as(FedIntrinsic.class);
        return intrinsic != null && intrinsic.uri.equals("dummy_intrinsic");
    }

    /**
     * (let y=&lt;a=a,(x -&gt; x)(b)&gt;,z=y[0] in &lt;z,generic_zero,y[1]&gt;)
     * Contains every kind of expression; 14 expressions in total.
     */
    public static FedExpression nestedTree() {
        FedData a = new FedData("a", INT);
        FedData b = new FedData("b", INT);
        FedLambda identity = new FedLambda("x", INT, new FedReference("x", INT));
        FedTuple pair = new FedTuple(Arrays.asList(a, identity.call(b)), Arrays.asList("a", null));
        FedLocal y = new FedLocal("y", pair);
        FedLocal z = new FedLocal("z", y.asReference().select(0));
        FedTuple result = new FedTuple(
                z.asReference(),
                new FedIntrinsic(Intrinsics.GENERIC_ZERO, INT),
                y.asReference().select(1));
        return new FedBlock(Arrays.asList(y, z), result);
    }

    /** federated_broadcast(value) */
    public static FedCall federatedBroadcast(FedExpression value) {
        FedType allEqualAtClients = new FedTypeFederated(INT, Placement.CLIENTS, true);
        FedIntrinsic broadcast = new FedIntrinsic(Intrinsics.FEDERATED_BROADCAST,
                new FedTypeFunction(value.getType(), allEqualAtClients));
        return broadcast.call(value);
    }

    public static FedCall calledFederatedBroadcast() {
        return federatedBroadcast(new FedData("data", INT_AT_SERVER));
    }

    /** federated_aggregate(&lt;value,zero,accumulate,merge,report&gt;) */
    public static FedCall federatedAggregate(FedExpression value) {
        FedTypeTuple accumulator = new FedTypeTuple(INT, INT);
        FedTuple argument = new FedTuple(
                value,
                new FedData("zero", INT),
                new FedLambda("accumulate_parameter", accumulator, new FedData("accumulated", INT)),
                new FedLambda("merge_parameter", accumulator, new FedData("merged", INT)),
                new FedLambda("report_parameter", INT, new FedData("reported", INT)));
        FedIntrinsic aggregate = new FedIntrinsic(Intrinsics.FEDERATED_AGGREGATE,
                new FedTypeFunction(argument.getType(), INT_AT_SERVER));
        return aggregate.call(argument);
    }

    public static FedCall calledFederatedAggregate() {
        return federatedAggregate(new FedData("data", INT_AT_CLIENTS));
    }
}
