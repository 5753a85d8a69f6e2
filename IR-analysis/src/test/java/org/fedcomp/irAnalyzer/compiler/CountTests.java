package org.fedcomp.irAnalyzer.compiler;

import org.fedcomp.irAnalyzer.TreeFixtures;
import org.fedcomp.irAnalyzer.compiler.errors.InvalidArgumentError;
import org.fedcomp.irAnalyzer.ir.expression.FedData;
import org.fedcomp.irAnalyzer.ir.expression.FedExpression;
import org.fedcomp.irAnalyzer.ir.expression.FedIntrinsic;
import org.fedcomp.irAnalyzer.ir.expression.FedLambda;
import org.fedcomp.irAnalyzer.ir.expression.FedReference;
import org.fedcomp.irAnalyzer.ir.expression.FedSelection;
import org.junit.Assert;
import org.junit.Test;

public class CountTests {
    @Test
    public void testCountNested() {
        FedExpression tree = TreeFixtures.nestedTree();
        Assert.assertEquals(14, TreeAnalysis.count(tree));
        Assert.assertEquals(TreeAnalysis.count(tree), TreeAnalysis.count(tree, e -> true));
        Assert.assertEquals(0, TreeAnalysis.count(tree, e -> false));
    }

    @Test
    public void testCountLeaf() {
        Assert.assertEquals(1, TreeAnalysis.count(new FedData("d", TreeFixtures.INT)));
    }

    @Test
    public void testCountDoesNotIncludeBindings() {
        // The parameter of a lambda is not an expression
        FedLambda lambda = new FedLambda("x", TreeFixtures.INT, new FedData("d", TreeFixtures.INT));
        Assert.assertEquals(2, TreeAnalysis.count(lambda));
    }

    @Test
    public void testCountTypes() {
        FedExpression tree = TreeFixtures.nestedTree();
        Assert.assertEquals(4, TreeAnalysis.countTypes(tree, FedReference.class));
        Assert.assertEquals(2, TreeAnalysis.countTypes(tree, FedSelection.class));
        Assert.assertEquals(3, TreeAnalysis.countTypes(tree, FedData.class, FedIntrinsic.class));
        Assert.assertEquals(14, TreeAnalysis.countTypes(tree, FedExpression.class));
        Assert.assertEquals(0, TreeAnalysis.countTypes(tree));
    }

    @Test
    public void testCountAggregate() {
        // intrinsic, value, zero, 3 lambdas with their bodies, argument tuple, call
        Assert.assertEquals(11, TreeAnalysis.count(TreeFixtures.calledFederatedAggregate()));
    }

    @Test
    public void testNullArguments() {
        Assert.assertThrows(InvalidArgumentError.class, () -> TreeAnalysis.count(null));
        Assert.assertThrows(InvalidArgumentError.class,
                () -> TreeAnalysis.count(TreeFixtures.nestedTree(), null));
        Assert.assertThrows(InvalidArgumentError.class,
                () -> TreeAnalysis.countTypes(TreeFixtures.nestedTree(), FedData.class, null));
    }
}
