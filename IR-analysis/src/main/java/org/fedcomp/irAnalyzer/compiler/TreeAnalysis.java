package org.fedcomp.irAnalyzer.compiler;

import org.fedcomp.irAnalyzer.compiler.errors.InvalidArgumentError;
import org.fedcomp.irAnalyzer.compiler.errors.NonUniqueNameError;
import org.fedcomp.irAnalyzer.compiler.errors.PlacementMismatchError;
import org.fedcomp.irAnalyzer.compiler.errors.UnsupportedIntrinsicError;
import org.fedcomp.irAnalyzer.compiler.visitors.inner.CheckIntrinsicsWhitelisted;
import org.fedcomp.irAnalyzer.compiler.visitors.inner.CheckSinglePlacement;
import org.fedcomp.irAnalyzer.compiler.visitors.inner.CountNodes;
import org.fedcomp.irAnalyzer.compiler.visitors.inner.DependentOnPredicate;
import org.fedcomp.irAnalyzer.compiler.visitors.inner.UniqueNames;
import org.fedcomp.irAnalyzer.ir.expression.FedCall;
import org.fedcomp.irAnalyzer.ir.expression.FedExpression;
import org.fedcomp.irAnalyzer.ir.expression.Intrinsics;
import org.fedcomp.irAnalyzer.ir.type.Placement;
import org.fedcomp.util.IWritesLogs;
import org.fedcomp.util.Logger;
import org.fedcomp.util.Utilities;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Static analyses over IR trees.
 * None of these modify the tree; each call allocates its own visitor,
 * so analyses of the same tree can run concurrently.
 * Arguments are validated before any node is visited. */
public final class TreeAnalysis implements IWritesLogs {
    private TreeAnalysis() {}

    static <T> T checkArgument(@Nullable T value, String name) {
        if (value == null)
            throw new InvalidArgumentError("Argument " + Utilities.singleQuote(name) + " must not be null");
        return value;
    }

    /** Number of expressions in the tree. */
    public static int count(FedExpression tree) {
        return count(tree, e -> true);
    }

    /** Number of expressions in the tree that satisfy 'predicate'. */
    public static int count(FedExpression tree, Predicate<FedExpression> predicate) {
        checkArgument(tree, "tree");
        checkArgument(predicate, "predicate");
        CountNodes counter = new CountNodes(predicate);
        counter.apply(tree);
        return counter.getCount();
    }

    /** Number of expressions in the tree that are instances of one of 'classes'. */
    @SafeVarargs
    public static int countTypes(FedExpression tree, Class<? extends FedExpression>... classes) {
        checkArgument(classes, "classes");
        for (Class<? extends FedExpression> clazz: classes)
            checkArgument(clazz, "classes");
        return count(tree, e -> Arrays.stream(classes).anyMatch(c -> c.isInstance(e)));
    }

    /** Checks that every federated value in the tree is placed at 'placement'.
     * @throws PlacementMismatchError for the first expression placed elsewhere. */
    public static void checkHasSinglePlacement(FedExpression tree, Placement placement) {
        checkArgument(tree, "tree");
        checkArgument(placement, "placement");
        new CheckSinglePlacement(placement).apply(tree);
    }

    /** Checks that all intrinsics in the tree can be reduced to aggregate or broadcast.
     * @throws UnsupportedIntrinsicError for the first intrinsic which cannot. */
    public static void checkIntrinsicsWhitelistedForReduction(FedExpression tree) {
        checkArgument(tree, "tree");
        new CheckIntrinsicsWhitelisted().apply(tree);
    }

    /** Checks that no name is bound twice in the tree.
     * Relocating subtrees across scopes is only safe under this condition.
     * @throws NonUniqueNameError if some name is bound more than once. */
    public static void checkHasUniqueNames(FedExpression tree) {
        checkArgument(tree, "tree");
        UniqueNames oracle = new UniqueNames();
        if (!oracle.hasUniqueNames(tree))
            throw new NonUniqueNameError("Name " + Utilities.singleQuote(oracle.getDuplicate()) +
                    " is bound more than once; names must be made unique before moving " +
                    "expressions under constructs which may bind their free references", tree);
    }

    /** Same as {@link #checkHasUniqueNames(FedExpression)}, but the decision is
     * delegated to the supplied oracle. */
    public static void checkHasUniqueNames(FedExpression tree, IUniqueNamesOracle oracle) {
        checkArgument(tree, "tree");
        checkArgument(oracle, "oracle");
        if (!oracle.hasUniqueNames(tree))
            throw new NonUniqueNameError("Tree does not have unique names; names must be made " +
                    "unique before moving expressions under constructs which may bind " +
                    "their free references", tree);
    }

    /** The expressions of the tree whose value depends on an expression that
     * satisfies 'predicate', including those expressions themselves.
     * See {@link DependentOnPredicate} for the propagation rules.
     *
     * <p>Dependence is decided separately at each position of the tree.  The
     * result holds node objects, so an object which occurs at several positions
     * (shared subtrees) is returned once, if it is dependent at any of them;
     * the result then has fewer elements than {@link #count} reports for an
     * always-true predicate. */
    public static Set<FedExpression> extractNodesDependentOnPredicate(
            FedExpression tree, Predicate<FedExpression> predicate) {
        checkArgument(tree, "tree");
        checkArgument(predicate, "predicate");
        DependentOnPredicate visitor = new DependentOnPredicate(predicate);
        visitor.apply(tree);
        return visitor.getDependent();
    }

    static boolean isCallOf(FedExpression expression, Intrinsics intrinsic) {
        FedCall call = expression.as(FedCall.class);
        return call != null && call.calls(intrinsic);
    }

    /** Checks whether some federated broadcast depends on a federated aggregate.
     * Such a computation cannot be executed as a single broadcast-aggregate round. */
    public static BroadcastDependence isBroadcastDependentOnAggregate(FedExpression tree) {
        checkArgument(tree, "tree");
        Set<FedExpression> dependent = extractNodesDependentOnPredicate(
                tree, e -> isCallOf(e, Intrinsics.FEDERATED_AGGREGATE));
        Set<FedCall> broadcasts = new LinkedHashSet<>();
        for (FedExpression expression: dependent) {
            if (isCallOf(expression, Intrinsics.FEDERATED_BROADCAST))
                broadcasts.add(expression.to(FedCall.class));
        }
        Logger.INSTANCE.belowLevel(TreeAnalysis.class, 1)
                .append("Broadcasts dependent on aggregate: ")
                .append(broadcasts.size())
                .newline();
        if (broadcasts.isEmpty())
            return new BroadcastDependence(false, Collections.emptySet());
        return new BroadcastDependence(true, Collections.unmodifiableSet(broadcasts));
    }
}
