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

package org.fedcomp.irAnalyzer.ir.expression;

import org.fedcomp.irAnalyzer.ir.FedNode;
import org.fedcomp.irAnalyzer.ir.type.FedType;

import javax.annotation.Nullable;

/** Base class for all expressions.  Every expression carries a type. */
public abstract class FedExpression extends FedNode {
    public final FedType type;

    protected FedExpression(FedType type) {
        this.type = type;
    }

    public FedType getType() {
        return this.type;
    }

    /** Call this expression, which must have a function type. */
    public FedCall call(@Nullable FedExpression argument) {
        return new FedCall(this, argument);
    }

    /** Call this expression with no argument. */
    public FedCall call() {
        return new FedCall(this, null);
    }

    /** Select a field of this expression, which must have a tuple type. */
    public FedSelection select(int index) {
        return new FedSelection(this, index);
    }
}
