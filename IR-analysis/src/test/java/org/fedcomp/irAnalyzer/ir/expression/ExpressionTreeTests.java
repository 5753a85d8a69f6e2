package org.fedcomp.irAnalyzer.ir.expression;

import org.fedcomp.irAnalyzer.TreeFixtures;
import org.junit.Assert;
import org.junit.Test;

import static org.fedcomp.irAnalyzer.TreeFixtures.INT;

public class ExpressionTreeTests {
    @Test
    public void testLambda() {
        FedLambda lambda = new FedLambda("x", INT, new FedReference("x", INT));
        String tree = ExpressionTree.asTree(lambda);
        String[] lines = tree.split("\n");
        Assert.assertEquals(3, lines.length);
        Assert.assertTrue(lines[0].endsWith("FedLambda : (int32 -> int32)"));
        Assert.assertTrue(lines[1].startsWith("  "));
        Assert.assertTrue(lines[1].endsWith("FedParameter x"));
        Assert.assertTrue(lines[2].endsWith("FedReference x : int32"));
        Assert.assertTrue(lines[0].startsWith(Long.toString(lambda.getId())));
    }

    @Test
    public void testNested() {
        String tree = ExpressionTree.asTree(TreeFixtures.nestedTree());
        Assert.assertTrue(tree.contains("FedBlock : <int32,int32,int32>"));
        Assert.assertTrue(tree.contains("FedLocal y"));
        Assert.assertTrue(tree.contains("FedSelection 1 : int32"));
        Assert.assertTrue(tree.contains("FedIntrinsic generic_zero : int32"));
        Assert.assertTrue(tree.contains("FedData b : int32"));
    }
}
