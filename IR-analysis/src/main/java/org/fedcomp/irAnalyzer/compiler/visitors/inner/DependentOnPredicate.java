package org.fedcomp.irAnalyzer.compiler.visitors.inner;

import org.fedcomp.irAnalyzer.compiler.errors.InternalCompilerError;
import org.fedcomp.irAnalyzer.compiler.visitors.VisitDecision;
import org.fedcomp.irAnalyzer.ir.FedLocal;
import org.fedcomp.irAnalyzer.ir.FedParameter;
import org.fedcomp.irAnalyzer.ir.IFedNode;
import org.fedcomp.irAnalyzer.ir.expression.ExpressionTree;
import org.fedcomp.irAnalyzer.ir.expression.FedBlock;
import org.fedcomp.irAnalyzer.ir.expression.FedCall;
import org.fedcomp.irAnalyzer.ir.expression.FedData;
import org.fedcomp.irAnalyzer.ir.expression.FedExpression;
import org.fedcomp.irAnalyzer.ir.expression.FedIntrinsic;
import org.fedcomp.irAnalyzer.ir.expression.FedLambda;
import org.fedcomp.irAnalyzer.ir.expression.FedReference;
import org.fedcomp.irAnalyzer.ir.expression.FedSelection;
import org.fedcomp.irAnalyzer.ir.expression.FedTuple;
import org.fedcomp.util.Logger;
import org.fedcomp.util.Utilities;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Finds the expressions whose value depends on some expression
 * that satisfies a predicate.
 *
 * <p>An expression is dependent if it satisfies the predicate, or if
 * its value is computed from a dependent expression:
 * <ul>
 *     <li>a reference is dependent if the value bound to its name
 *     by the nearest enclosing binding is dependent; free references are not</li>
 *     <li>a lambda is dependent if its body is; the parameter itself
 *     is never dependent, whatever the lambda is applied to</li>
 *     <li>a block is dependent if the value of any local or its result is</li>
 *     <li>calls, tuples and selections are dependent if any child is</li>
 *     <li>data and intrinsics only if they satisfy the predicate</li>
 * </ul>
 * The dependence of each bound name is tracked in a stack of scopes,
 * so inner bindings shadow outer bindings of the same name.
 *
 * <p>Statuses are computed per position: each postorder method pops the
 * statuses of its children and pushes its own.  An expression object that
 * occurs at several positions is in the result if it is dependent at
 * any of them, so such trees can produce fewer results than positions.
 * The result contains expressions, compared by identity, in postorder. */
public class DependentOnPredicate extends InnerVisitor {
    final Predicate<FedExpression> predicate;
    /** For each bound name, whether the bound value is dependent. */
    final Scopes<String, Boolean> scopes;
    /** Statuses of the children of the nodes being visited, last child on top. */
    final List<Boolean> statuses;
    final Set<FedExpression> dependent;

    public DependentOnPredicate(Predicate<FedExpression> predicate) {
        this.predicate = predicate;
        this.scopes = new Scopes<>();
        this.statuses = new ArrayList<>();
        this.dependent = new LinkedHashSet<>();
    }

    @Override
    public void startVisit(IFedNode node) {
        super.startVisit(node);
        this.scopes.clear();
        this.statuses.clear();
        this.dependent.clear();
        Logger.INSTANCE.belowLevel(this, 2)
                .appendSupplier(() -> ExpressionTree.asTree(node))
                .newline();
    }

    @Override
    public void endVisit() {
        super.endVisit();
        this.scopes.mustBeEmpty();
        if (this.statuses.size() > 1)
            throw new InternalCompilerError("Unconsumed statuses at end of visit: " + this.statuses);
        this.statuses.clear();
        Logger.INSTANCE.belowLevel(this, 1)
                .append(this.toString())
                .append(" found ")
                .append(this.dependent.size())
                .append(" dependent expressions")
                .newline();
    }

    /** Status of the last child visited. */
    boolean popStatus() {
        if (this.statuses.isEmpty())
            throw new InternalCompilerError("No status for child expression");
        return Utilities.removeLast(this.statuses);
    }

    /** Pop the statuses of the last 'count' children; true if any is dependent. */
    boolean popAny(int count) {
        boolean result = false;
        for (int i = 0; i < count; i++)
            result |= this.popStatus();
        return result;
    }

    /** Set the status of an expression whose children statuses have been popped. */
    void setStatus(FedExpression expression, boolean childDependent) {
        boolean status = childDependent || this.predicate.test(expression);
        Logger.INSTANCE.belowLevel(this, 3)
                .append(expression.getId())
                .append(" ")
                .append(expression.getClass().getSimpleName())
                .append(status ? " dependent " : " independent ")
                .appendSupplier(expression::toString)
                .newline();
        if (status)
            this.dependent.add(expression);
        this.statuses.add(status);
    }

    @Override
    public VisitDecision preorder(FedLambda lambda) {
        this.scopes.newContext();
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(FedParameter parameter) {
        this.scopes.substitute(parameter.name, false);
    }

    @Override
    public void postorder(FedLambda lambda) {
        this.scopes.popContext();
        this.setStatus(lambda, this.popStatus());
    }

    @Override
    public VisitDecision preorder(FedBlock block) {
        this.scopes.newContext();
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(FedLocal local) {
        // The value has been visited before the name is bound,
        // so it only sees the preceding locals.
        boolean status = this.popStatus();
        this.scopes.substitute(local.name, status);
        // Kept for the enclosing block
        this.statuses.add(status);
    }

    @Override
    public void postorder(FedBlock block) {
        this.scopes.popContext();
        boolean result = this.popStatus();
        boolean localDependent = this.popAny(block.locals.size());
        this.setStatus(block, localDependent || result);
    }

    @Override
    public void postorder(FedReference reference) {
        Boolean bound = this.scopes.get(reference.name);
        this.setStatus(reference, bound != null && bound);
    }

    @Override
    public void postorder(FedCall call) {
        boolean argument = call.argument != null && this.popStatus();
        boolean function = this.popStatus();
        this.setStatus(call, function || argument);
    }

    @Override
    public void postorder(FedSelection selection) {
        this.setStatus(selection, this.popStatus());
    }

    @Override
    public void postorder(FedTuple tuple) {
        this.setStatus(tuple, this.popAny(tuple.size()));
    }

    @Override
    public void postorder(FedData data) {
        this.setStatus(data, false);
    }

    @Override
    public void postorder(FedIntrinsic intrinsic) {
        this.setStatus(intrinsic, false);
    }

    /** The dependent expressions found by the last visit. */
    public Set<FedExpression> getDependent() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(this.dependent));
    }
}
