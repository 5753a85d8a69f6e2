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

import org.fedcomp.irAnalyzer.compiler.errors.InternalCompilerError;
import org.fedcomp.irAnalyzer.compiler.visitors.VisitDecision;
import org.fedcomp.irAnalyzer.ir.FedLocal;
import org.fedcomp.irAnalyzer.ir.FedParameter;
import org.fedcomp.irAnalyzer.ir.IFedNode;
import org.fedcomp.irAnalyzer.ir.expression.FedBlock;
import org.fedcomp.irAnalyzer.ir.expression.FedCall;
import org.fedcomp.irAnalyzer.ir.expression.FedData;
import org.fedcomp.irAnalyzer.ir.expression.FedExpression;
import org.fedcomp.irAnalyzer.ir.expression.FedIntrinsic;
import org.fedcomp.irAnalyzer.ir.expression.FedLambda;
import org.fedcomp.irAnalyzer.ir.expression.FedReference;
import org.fedcomp.irAnalyzer.ir.expression.FedSelection;
import org.fedcomp.irAnalyzer.ir.expression.FedTuple;
import org.fedcomp.util.IHasId;
import org.fedcomp.util.IWritesLogs;
import org.fedcomp.util.Logger;
import org.fedcomp.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** Depth-first traversal of an IR tree.
 * Children are visited left to right, in the order given by the
 * {@code accept} method of each node: lambda parameter before body,
 * block locals in declaration order before the result, call function
 * before argument.  For each node the preorder method is invoked first;
 * if it returns {@link VisitDecision#CONTINUE} the children are visited
 * and then the postorder method is invoked.
 * Each overload delegates to the overload for the base class, so a visitor
 * can override the methods for a single variant or for all expressions. */
@SuppressWarnings({"SameReturnValue", "EmptyMethod"})
public abstract class InnerVisitor implements IRTransform, IWritesLogs, IHasId {
    final long id;
    static final AtomicLong crtId = new AtomicLong();
    protected final List<IFedNode> context;

    protected InnerVisitor() {
        this.id = crtId.getAndIncrement();
        this.context = new ArrayList<>();
    }

    @Override
    public long getId() {
        return this.id;
    }

    public void push(IFedNode node) {
        this.context.add(node);
    }

    public void pop(IFedNode node) {
        IFedNode last = Utilities.removeLast(this.context);
        if (node != last)
            throw new InternalCompilerError("Corrupted visitor context: popping " + node
                    + " instead of " + last, node);
    }

    /** The node whose children are being visited, if any. */
    @Nullable
    public IFedNode getParent() {
        if (this.context.isEmpty())
            return null;
        return Utilities.last(this.context);
    }

    /** Override to initialize before visiting any node. */
    public void startVisit(IFedNode node) {
        this.context.clear();
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .append(" at ")
                .appendSupplier(node::toString)
                .newline();
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {
        if (!this.context.isEmpty())
            throw new InternalCompilerError("Visitor context not empty at end of visit: " + this.context);
    }

    /************************* PREORDER *****************************/

    public VisitDecision preorder(IFedNode ignored) {
        return VisitDecision.CONTINUE;
    }

    public VisitDecision preorder(FedParameter node) {
        return this.preorder((IFedNode) node);
    }

    public VisitDecision preorder(FedLocal node) {
        return this.preorder((IFedNode) node);
    }

    public VisitDecision preorder(FedExpression node) {
        return this.preorder((IFedNode) node);
    }

    public VisitDecision preorder(FedReference node) {
        return this.preorder((FedExpression) node);
    }

    public VisitDecision preorder(FedLambda node) {
        return this.preorder((FedExpression) node);
    }

    public VisitDecision preorder(FedBlock node) {
        return this.preorder((FedExpression) node);
    }

    public VisitDecision preorder(FedCall node) {
        return this.preorder((FedExpression) node);
    }

    public VisitDecision preorder(FedSelection node) {
        return this.preorder((FedExpression) node);
    }

    public VisitDecision preorder(FedTuple node) {
        return this.preorder((FedExpression) node);
    }

    public VisitDecision preorder(FedData node) {
        return this.preorder((FedExpression) node);
    }

    public VisitDecision preorder(FedIntrinsic node) {
        return this.preorder((FedExpression) node);
    }

    /************************* POSTORDER *****************************/

    public void postorder(IFedNode ignored) {}

    public void postorder(FedParameter node) {
        this.postorder((IFedNode) node);
    }

    public void postorder(FedLocal node) {
        this.postorder((IFedNode) node);
    }

    public void postorder(FedExpression node) {
        this.postorder((IFedNode) node);
    }

    public void postorder(FedReference node) {
        this.postorder((FedExpression) node);
    }

    public void postorder(FedLambda node) {
        this.postorder((FedExpression) node);
    }

    public void postorder(FedBlock node) {
        this.postorder((FedExpression) node);
    }

    public void postorder(FedCall node) {
        this.postorder((FedExpression) node);
    }

    public void postorder(FedSelection node) {
        this.postorder((FedExpression) node);
    }

    public void postorder(FedTuple node) {
        this.postorder((FedExpression) node);
    }

    public void postorder(FedData node) {
        this.postorder((FedExpression) node);
    }

    public void postorder(FedIntrinsic node) {
        this.postorder((FedExpression) node);
    }

    @Override
    public String toString() {
        return this.id + " " + this.getClass().getSimpleName();
    }

    @Override
    public IFedNode apply(IFedNode node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
        return node;
    }
}
