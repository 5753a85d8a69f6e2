package org.fedcomp.irAnalyzer.compiler.visitors.inner;

import org.fedcomp.irAnalyzer.TreeFixtures;
import org.fedcomp.irAnalyzer.compiler.visitors.VisitDecision;
import org.fedcomp.irAnalyzer.ir.FedLocal;
import org.fedcomp.irAnalyzer.ir.FedParameter;
import org.fedcomp.irAnalyzer.ir.IFedNode;
import org.fedcomp.irAnalyzer.ir.expression.FedBlock;
import org.fedcomp.irAnalyzer.ir.expression.FedData;
import org.fedcomp.irAnalyzer.ir.expression.FedExpression;
import org.fedcomp.irAnalyzer.ir.expression.FedLambda;
import org.fedcomp.irAnalyzer.ir.expression.FedReference;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.fedcomp.irAnalyzer.TreeFixtures.INT;

public class InnerVisitorTests {
    /** Records the nodes in the order in which postorder is invoked. */
    static class Recorder extends InnerVisitor {
        final List<String> visited = new ArrayList<>();

        @Override
        public void postorder(IFedNode node) {
            this.visited.add(node.toString());
        }
    }

    @Test
    public void testCallOrder() {
        FedExpression call = new FedLambda("x", INT, new FedReference("x", INT))
                .call(new FedData("a", INT));
        Recorder recorder = new Recorder();
        recorder.apply(call);
        Assert.assertEquals(Arrays.asList("x", "x", "(x -> x)", "a", "(x -> x)(a)"), recorder.visited);
    }

    @Test
    public void testBlockOrder() {
        FedBlock block = new FedBlock(Arrays.asList(
                new FedLocal("x", new FedData("a", INT)),
                new FedLocal("y", new FedData("b", INT))), new FedReference("y", INT));
        Recorder recorder = new Recorder();
        recorder.apply(block);
        Assert.assertEquals(Arrays.asList("a", "x=a", "b", "y=b", "y", "(let x=a,y=b in y)"),
                recorder.visited);
    }

    @Test
    public void testStopSkipsChildren() {
        List<String> visited = new ArrayList<>();
        InnerVisitor visitor = new InnerVisitor() {
            @Override
            public VisitDecision preorder(FedLambda node) {
                return VisitDecision.STOP;
            }

            @Override
            public void postorder(FedExpression node) {
                visited.add(node.toString());
            }
        };
        visitor.apply(TreeFixtures.nestedTree());
        Assert.assertFalse(visited.contains("x"));
        Assert.assertFalse(visited.contains("(x -> x)"));
        Assert.assertTrue(visited.contains("b"));
        Assert.assertEquals(12, visited.size());
    }

    @Test
    public void testParent() {
        FedParameter parameter = new FedParameter("x", INT);
        FedLambda lambda = new FedLambda(parameter, parameter.asReference());
        List<IFedNode> parents = new ArrayList<>();
        InnerVisitor visitor = new InnerVisitor() {
            @Override
            public VisitDecision preorder(IFedNode node) {
                parents.add(this.getParent());
                return VisitDecision.CONTINUE;
            }
        };
        visitor.apply(lambda);
        Assert.assertEquals(3, parents.size());
        Assert.assertNull(parents.get(0));
        Assert.assertSame(lambda, parents.get(1));
        Assert.assertSame(lambda, parents.get(2));
    }
}
