package org.fedcomp.irAnalyzer.compiler.visitors.inner;

import org.fedcomp.irAnalyzer.compiler.IUniqueNamesOracle;
import org.fedcomp.irAnalyzer.ir.FedLocal;
import org.fedcomp.irAnalyzer.ir.FedParameter;
import org.fedcomp.irAnalyzer.ir.IFedDeclaration;
import org.fedcomp.irAnalyzer.ir.IFedNode;
import org.fedcomp.irAnalyzer.ir.expression.FedExpression;

import javax.annotation.Nullable;
import java.util.HashSet;
import java.util.Set;

/** Checks that no name is bound twice anywhere in a tree,
 * even in disjoint scopes. */
public class UniqueNames extends InnerVisitor implements IUniqueNamesOracle {
    final Set<String> bound;
    /** First name found bound a second time; null if all names are unique. */
    @Nullable
    String duplicate;

    public UniqueNames() {
        this.bound = new HashSet<>();
        this.duplicate = null;
    }

    @Override
    public void startVisit(IFedNode node) {
        super.startVisit(node);
        this.bound.clear();
        this.duplicate = null;
    }

    void declare(IFedDeclaration declaration) {
        if (!this.bound.add(declaration.getName()) && this.duplicate == null)
            this.duplicate = declaration.getName();
    }

    @Override
    public void postorder(FedParameter parameter) {
        this.declare(parameter);
    }

    @Override
    public void postorder(FedLocal local) {
        this.declare(local);
    }

    @Nullable
    public String getDuplicate() {
        return this.duplicate;
    }

    @Override
    public boolean hasUniqueNames(FedExpression tree) {
        this.apply(tree);
        return this.duplicate == null;
    }
}
