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
import org.fedcomp.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * A set of nested scopes.
 * Each scope is a namespace which can define new bindings, which
 * shadow bindings of the same key in the outer scopes. */
public class Scopes<K, V> {
    protected final List<Substitution<K, V>> stack;

    public Scopes() {
        this.stack = new ArrayList<>();
    }

    public void newContext() {
        this.stack.add(new Substitution<>());
    }

    public void popContext() {
        if (this.stack.isEmpty())
            throw new InternalCompilerError("Popping an empty context");
        Utilities.removeLast(this.stack);
    }

    /** Bind 'key' in the innermost scope. */
    public void substitute(K key, V value) {
        if (this.stack.isEmpty())
            throw new InternalCompilerError("Empty context");
        Utilities.last(this.stack).substitute(key, value);
    }

    public void mustBeEmpty() {
        if (!this.stack.isEmpty())
            throw new InternalCompilerError("Non-empty context " + this);
    }

    /**
     * The value bound to this key in the innermost scope that binds it.
     * null if there isn't any. */
    @Nullable
    public V get(K key) {
        for (int i = this.stack.size() - 1; i >= 0; i--) {
            Substitution<K, V> subst = this.stack.get(i);
            if (subst.containsKey(key))
                return subst.get(key);
        }
        return null;
    }

    public int depth() {
        return this.stack.size();
    }

    void clear() {
        this.stack.clear();
    }

    @Override
    public String toString() {
        return this.stack.toString();
    }
}
