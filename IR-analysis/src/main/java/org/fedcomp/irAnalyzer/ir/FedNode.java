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

package org.fedcomp.irAnalyzer.ir;

import org.fedcomp.util.IndentStreamBuilder;

import java.util.concurrent.atomic.AtomicLong;

/** Base class for all IR nodes. */
public abstract class FedNode implements IFedNode {
    static final AtomicLong crtId = new AtomicLong();
    public final long id;

    protected FedNode() {
        this.id = crtId.getAndIncrement();
    }

    @Override
    public long getId() {
        return this.id;
    }

    /** Compact, single-line representation of the node. */
    @Override
    public String toString() {
        IndentStreamBuilder builder = IndentStreamBuilder.singleLine();
        this.toString(builder);
        return builder.toString();
    }
}
