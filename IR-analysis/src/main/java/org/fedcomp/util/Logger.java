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

import org.fedcomp.irAnalyzer.compiler.errors.InvalidArgumentError;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Logging class which can output nicely indented strings.
 * Logging is enabled per class, by setting a level; a message
 * is written only if its level is at most the level of the class
 * that emits it.
 *
 * <p>Levels may be read while they are being changed, but all analyses
 * share one output stream: configure levels and the stream before
 * starting analyses on several threads, or their messages interleave. */
public class Logger {
    private final Map<Class<?>, Integer> loggingLevel = new ConcurrentHashMap<>();
    private final IndentStream debugStream;
    private final IIndentStream noStream;

    /** There is only one instance of the logger for the whole program. */
    public static final Logger INSTANCE = new Logger();

    private Logger() {
        this.debugStream = new IndentStream(System.err);
        this.noStream = new NullIndentStream();
    }

    /** Get the logging stream for messages below this logging level.
     * @param clazz   Class which does the logging.
     * @param level   Level of message that is being logged.
     * @return        A stream where the message can be appended. */
    public IIndentStream belowLevel(Class<?> clazz, int level) {
        int debugLevel = this.getLoggingLevel(clazz);
        if (debugLevel >= level)
            return this.debugStream;
        return this.noStream;
    }

    public IIndentStream belowLevel(IWritesLogs module, int level) {
        return this.belowLevel(module.getClass(), level);
    }

    /** Debug level is controlled per class and can be changed dynamically.
     * @return Previous logging level for this class. */
    public int setLoggingLevel(Class<?> clazz, int level) {
        Integer previous = this.loggingLevel.put(clazz, level);
        return previous == null ? 0 : previous;
    }

    static final String root = "org.fedcomp.irAnalyzer.compiler";

    /* Packages containing classes that can be instrumented with logging,
     * relative to root. */
    static final String[] packages = new String[] {
            "",
            "visitors.inner",
    };

    Class<?> locateClass(String className) {
        for (String pack: packages) {
            String path = pack.isEmpty() ? root : root + "." + pack;
            try {
                return Class.forName(path + "." + className);
            } catch (ClassNotFoundException e) {
                // try the next package
            }
        }
        throw new InvalidArgumentError("Class " + Utilities.singleQuote(className) +
                " not found for setting up logging");
    }

    /** Set the logging level of a class given by its simple name.
     * @param className   Class; must be an analyzer or a visitor.
     * @param level       Debugging level.
     * @return Previous logging level for this class. */
    @SuppressWarnings("UnusedReturnValue")
    public int setLoggingLevel(String className, int level) {
        Class<?> clazz = this.locateClass(className);
        return this.setLoggingLevel(clazz, level);
    }

    public int getLoggingLevel(Class<?> clazz) {
        if (this.loggingLevel.isEmpty())
            return 0;
        for (var e: this.loggingLevel.entrySet()) {
            if (e.getKey().isAssignableFrom(clazz))
                return e.getValue();
        }
        return 0;
    }

    /** Forget all logging levels. */
    public void reset() {
        this.loggingLevel.clear();
    }

    /** Where logging should be redirected.
     * @return The previous destination. */
    public Appendable setDebugStream(Appendable writer) {
        return this.debugStream.setOutputStream(writer);
    }
}
