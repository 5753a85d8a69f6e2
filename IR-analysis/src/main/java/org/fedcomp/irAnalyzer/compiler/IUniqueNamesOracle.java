package org.fedcomp.irAnalyzer.compiler;

import org.fedcomp.irAnalyzer.ir.expression.FedExpression;

/** Decides whether every name bound in a tree (lambda parameters and
 * block locals) is bound exactly once in the whole tree. */
@FunctionalInterface
public interface IUniqueNamesOracle {
    boolean hasUniqueNames(FedExpression tree);
}
