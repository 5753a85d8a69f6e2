package org.fedcomp.irAnalyzer.ir;

/** A construct which binds a name. */
public interface IFedDeclaration extends IFedNode {
    String getName();
}
