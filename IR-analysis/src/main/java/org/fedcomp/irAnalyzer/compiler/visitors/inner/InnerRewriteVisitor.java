/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.fedcomp.irAnalyzer.compiler.visitors.inner;

import org.fedcomp.irAnalyzer.compiler.visitors.VisitDecision;
import org.fedcomp.irAnalyzer.ir.FedLocal;
import org.fedcomp.irAnalyzer.ir.FedParameter;
import org.fedcomp.irAnalyzer.ir.IFedNode;
import org.fedcomp.irAnalyzer.ir.expression.FedBlock;
import org.fedcomp.irAnalyzer.ir.expression.FedCall;
import org.fedcomp.irAnalyzer.ir.expression.FedExpression;
import org.fedcomp.irAnalyzer.ir.expression.FedLambda;
import org.fedcomp.irAnalyzer.ir.expression.FedSelection;
import org.fedcomp.irAnalyzer.ir.expression.FedTuple;
import org.fedcomp.util.Linq;
import org.fedcomp.util.Logger;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Base class for visitors which substitute nodes.
 * This class recurses over the structure of expressions and, if any child
 * has changed, builds a new version of the parent; otherwise the original
 * node is kept, so unchanged subtrees preserve their identity.
 * Classes that extend this should override the preorder methods, call
 * {@link #map} with the replacement, and return {@link VisitDecision#STOP}. */
public abstract class InnerRewriteVisitor extends InnerVisitor {
    /** Result produced by the last preorder invocation. */
    @Nullable
    protected IFedNode lastResult;

    IFedNode getResult() {
        return Objects.requireNonNull(this.lastResult);
    }

    @Override
    public IFedNode apply(IFedNode node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
        return this.getResult();
    }

    /** Replace the 'old' IR node with the 'newOp' IR node if
     * any of its fields differs. */
    protected void map(IFedNode old, IFedNode newOp) {
        if (old == newOp || old.sameFields(newOp)) {
            this.lastResult = old;
            return;
        }

        Logger.INSTANCE.belowLevel(this, 1)
                .appendSupplier(this::toString)
                .append(":")
                .appendSupplier(old::toString)
                .append(" -> ")
                .appendSupplier(newOp::toString)
                .newline();
        this.lastResult = newOp;
    }

    @Override
    public VisitDecision preorder(IFedNode node) {
        this.map(node, node);
        return VisitDecision.STOP;
    }

    protected FedExpression getResultExpression() {
        return this.getResult().to(FedExpression.class);
    }

    protected FedExpression transform(FedExpression expression) {
        expression.accept(this);
        return this.getResultExpression();
    }

    @Nullable
    protected FedExpression transformN(@Nullable FedExpression expression) {
        if (expression == null)
            return null;
        return this.transform(expression);
    }

    protected FedLocal transform(FedLocal local) {
        local.accept(this);
        return this.getResult().to(FedLocal.class);
    }

    protected FedParameter transform(FedParameter parameter) {
        parameter.accept(this);
        return this.getResult().to(FedParameter.class);
    }

    @Override
    public VisitDecision preorder(FedLambda expression) {
        this.push(expression);
        FedParameter parameter = this.transform(expression.parameter);
        FedExpression body = this.transform(expression.body);
        this.pop(expression);
        FedExpression result = new FedLambda(parameter, body);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(FedLocal local) {
        this.push(local);
        FedExpression value = this.transform(local.value);
        this.pop(local);
        FedLocal result = new FedLocal(local.name, value);
        this.map(local, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(FedBlock expression) {
        this.push(expression);
        List<FedLocal> locals = Linq.map(expression.locals, this::transform);
        FedExpression last = this.transform(expression.result);
        this.pop(expression);
        FedExpression result = new FedBlock(locals, last);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(FedCall expression) {
        this.push(expression);
        FedExpression function = this.transform(expression.function);
        FedExpression argument = this.transformN(expression.argument);
        this.pop(expression);
        FedExpression result = new FedCall(expression.getType(), function, argument);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(FedSelection expression) {
        this.push(expression);
        FedExpression source = this.transform(expression.source);
        this.pop(expression);
        FedExpression result = new FedSelection(expression.getType(), source, expression.index);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(FedTuple expression) {
        this.push(expression);
        List<FedExpression> elements = Linq.map(expression.elements, this::transform);
        this.pop(expression);
        FedExpression result = new FedTuple(elements, expression.getTupleType().names);
        this.map(expression, result);
        return VisitDecision.STOP;
    }
}
