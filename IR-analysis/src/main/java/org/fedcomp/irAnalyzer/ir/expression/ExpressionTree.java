package org.fedcomp.irAnalyzer.ir.expression;

import org.fedcomp.irAnalyzer.compiler.visitors.VisitDecision;
import org.fedcomp.irAnalyzer.compiler.visitors.inner.InnerVisitor;
import org.fedcomp.irAnalyzer.ir.IFedDeclaration;
import org.fedcomp.irAnalyzer.ir.IFedNode;
import org.fedcomp.util.IIndentStream;
import org.fedcomp.util.IndentStreamBuilder;

import javax.annotation.CheckReturnValue;

/** Dumps an IR tree with one node per line, indented by depth.
 * Each line shows the node id, its class, its identifying field, and its type. */
public class ExpressionTree {
    private ExpressionTree() {}

    static class TreePrinter extends InnerVisitor {
        final IIndentStream stream;

        TreePrinter(IIndentStream stream) {
            this.stream = stream;
        }

        @Override
        public VisitDecision preorder(IFedNode node) {
            this.stream.append(node.getId())
                    .append(" ")
                    .append(node.getClass().getSimpleName());
            if (node.is(IFedDeclaration.class))
                this.stream.append(" ").append(node.to(IFedDeclaration.class).getName());
            else if (node.is(FedReference.class) || node.is(FedData.class) || node.is(FedIntrinsic.class))
                this.stream.append(" ").append(node);
            else if (node.is(FedSelection.class))
                this.stream.append(" ").append(node.to(FedSelection.class).index);
            if (node.is(FedExpression.class))
                this.stream.append(" : ").append(node.to(FedExpression.class).getType());
            this.stream.increase();
            return VisitDecision.CONTINUE;
        }

        @Override
        public void postorder(IFedNode node) {
            this.stream.decrease();
        }
    }

    @CheckReturnValue
    public static String asTree(IFedNode node) {
        IndentStreamBuilder stream = new IndentStreamBuilder();
        stream.setIndentAmount(2);
        new TreePrinter(stream).apply(node);
        return stream.toString();
    }
}
