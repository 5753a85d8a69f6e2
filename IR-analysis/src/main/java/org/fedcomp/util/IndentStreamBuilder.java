package org.fedcomp.util;

/** An {@link IndentStream} which accumulates its output in memory. */
public class IndentStreamBuilder extends IndentStream {
    public IndentStreamBuilder() {
        super(new StringBuilder());
    }

    /** A builder which keeps everything on one line. */
    public static IndentStreamBuilder singleLine() {
        IndentStreamBuilder result = new IndentStreamBuilder();
        result.setIndentAmount(0);
        return result;
    }
}
