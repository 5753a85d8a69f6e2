package org.fedcomp.irAnalyzer.compiler.visitors;

/** Returned by preorder visitor methods. */
public enum VisitDecision {
    /** Do not visit the children of the node, nor call its postorder method. */
    STOP,
    /** Visit the children, then call the postorder method. */
    CONTINUE;

    public boolean stop() {
        return this == STOP;
    }
}
