package org.fedcomp.irAnalyzer.compiler;

import org.fedcomp.irAnalyzer.ir.expression.FedCall;

import java.util.Set;

/** Result of {@link TreeAnalysis#isBroadcastDependentOnAggregate}.
 * @param dependent  True if some broadcast depends on an aggregate.
 * @param broadcasts The broadcast calls that depend on an aggregate; empty if 'dependent' is false. */
public record BroadcastDependence(boolean dependent, Set<FedCall> broadcasts) {}
