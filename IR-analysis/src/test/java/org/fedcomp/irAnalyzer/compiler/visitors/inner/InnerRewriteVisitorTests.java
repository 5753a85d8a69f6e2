package org.fedcomp.irAnalyzer.compiler.visitors.inner;

import org.fedcomp.irAnalyzer.TreeFixtures;
import org.fedcomp.irAnalyzer.compiler.visitors.VisitDecision;
import org.fedcomp.irAnalyzer.ir.IFedNode;
import org.fedcomp.irAnalyzer.ir.expression.FedData;
import org.fedcomp.irAnalyzer.ir.expression.FedExpression;
import org.fedcomp.irAnalyzer.ir.expression.FedIntrinsic;
import org.fedcomp.irAnalyzer.ir.expression.FedLambda;
import org.fedcomp.irAnalyzer.ir.expression.FedTuple;
import org.fedcomp.irAnalyzer.ir.expression.Intrinsics;
import org.junit.Assert;
import org.junit.Test;

import static org.fedcomp.irAnalyzer.TreeFixtures.INT;

public class InnerRewriteVisitorTests {
    /** Replaces the dummy intrinsic with generic_zero. */
    static class ReplaceDummy extends InnerRewriteVisitor {
        @Override
        public VisitDecision preorder(FedIntrinsic node) {
            if (TreeFixtures.isDummyIntrinsic(node))
                this.map(node, new FedIntrinsic(Intrinsics.GENERIC_ZERO, node.getType()));
            else
                this.map(node, node);
            return VisitDecision.STOP;
        }
    }

    static class Identity extends InnerRewriteVisitor {}

    @Test
    public void testIdentityPreservesTree() {
        FedExpression tree = TreeFixtures.nestedTree();
        IFedNode result = new Identity().apply(tree);
        Assert.assertSame(tree, result);
    }

    @Test
    public void testSubstitution() {
        FedData data = new FedData("a", INT);
        FedLambda lambda = new FedLambda("x", INT, new FedData("b", INT));
        FedTuple tuple = new FedTuple(data, TreeFixtures.dummyIntrinsic(), lambda);
        FedTuple result = new ReplaceDummy().apply(tuple).to(FedTuple.class);
        Assert.assertNotSame(tuple, result);
        Assert.assertEquals("<a,generic_zero,(x -> b)>", result.toString());
        // Unchanged subtrees are shared
        Assert.assertSame(data, result.elements.get(0));
        Assert.assertSame(lambda, result.elements.get(2));
        // The original is unchanged
        Assert.assertEquals("<a,dummy_intrinsic,(x -> b)>", tuple.toString());
    }

    @Test
    public void testRewrittenTreeHasNoMatch() {
        FedExpression tree = new FedLambda("x", INT, new FedTuple(
                TreeFixtures.dummyIntrinsic(), new FedData("a", INT)).select(0));
        IFedNode result = new ReplaceDummy().apply(tree);
        Assert.assertEquals("(x -> <dummy_intrinsic,a>[0])", tree.toString());
        Assert.assertEquals("(x -> <generic_zero,a>[0])", result.toString());
    }
}
