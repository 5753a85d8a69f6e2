package org.fedcomp.irAnalyzer.compiler.visitors.inner;

import org.fedcomp.irAnalyzer.ir.IFedNode;
import org.fedcomp.util.ICastable;

import java.util.function.Function;

/** A pass over a tree of IR nodes. */
public interface IRTransform extends Function<IFedNode, IFedNode>, ICastable {}
