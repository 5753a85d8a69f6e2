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

package org.fedcomp.util;

import javax.annotation.Nullable;
import java.util.List;

public class Utilities {
    private Utilities() {}

    /** Like assert, but always enabled. */
    public static void enforce(boolean expression) {
        if (!expression)
            throw new IllegalStateException("Assertion failed");
    }

    public static void enforce(boolean expression, String message) {
        if (!expression)
            throw new IllegalStateException(message);
    }

    public static String singleQuote(@Nullable String other) {
        return "'" + other + "'";
    }

    public static <T> T removeLast(List<T> data) {
        enforce(!data.isEmpty(), "Removing from an empty list");
        return data.remove(data.size() - 1);
    }

    public static <T> T last(List<T> data) {
        enforce(!data.isEmpty(), "Empty list");
        return data.get(data.size() - 1);
    }
}
