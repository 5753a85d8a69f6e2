package org.fedcomp.irAnalyzer.ir.type;

import org.fedcomp.util.IIndentStream;
import org.fedcomp.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** A tuple type; each element may carry a name. */
public final class FedTypeTuple extends FedType {
    public final List<FedType> elements;
    /** One entry per element; null for unnamed elements. */
    public final List<String> names;

    public FedTypeTuple(List<FedType> elements, List<String> names) {
        Utilities.enforce(elements.size() == names.size(),
                "Tuple type with " + elements.size() + " elements and " + names.size() + " names");
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
    }

    public FedTypeTuple(FedType... elements) {
        this(Arrays.asList(elements), Arrays.asList(new String[elements.length]));
    }

    public int size() {
        return this.elements.size();
    }

    public FedType getElement(int index) {
        return this.elements.get(index);
    }

    @Nullable
    public String getName(int index) {
        return this.names.get(index);
    }

    @Override
    public boolean sameType(FedType other) {
        FedTypeTuple o = other.as(FedTypeTuple.class);
        if (o == null || o.size() != this.size())
            return false;
        for (int i = 0; i < this.size(); i++) {
            if (!Objects.equals(this.names.get(i), o.names.get(i)))
                return false;
            if (!this.elements.get(i).sameType(o.elements.get(i)))
                return false;
        }
        return true;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("<");
        for (int i = 0; i < this.size(); i++) {
            if (i > 0)
                builder.append(",");
            String name = this.names.get(i);
            if (name != null)
                builder.append(name).append("=");
            builder.append(this.elements.get(i));
        }
        return builder.append(">");
    }
}
