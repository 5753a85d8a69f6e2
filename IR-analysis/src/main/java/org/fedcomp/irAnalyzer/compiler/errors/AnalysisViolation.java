package org.fedcomp.irAnalyzer.compiler.errors;

import org.fedcomp.irAnalyzer.ir.IFedNode;

import javax.annotation.Nullable;

/** A tree does not satisfy the precondition checked by an analysis.
 * The walk that discovers the violation stops at the first offending node. */
public abstract class AnalysisViolation extends BaseCompilerException {
    protected AnalysisViolation(String message, @Nullable IFedNode node) {
        super(message, node);
    }
}
