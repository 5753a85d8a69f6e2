package org.fedcomp.irAnalyzer.ir.type;

import javax.annotation.Nullable;
import java.util.Locale;

/** Where the members of a federated value reside. */
public enum Placement {
    /** One member per participating client. */
    CLIENTS("clients", false),
    /** A single member at the coordinating server. */
    SERVER("server", true);

    public final String uri;
    /** Whether federated values with this placement are all-equal unless stated otherwise. */
    public final boolean defaultAllEqual;

    Placement(String uri, boolean defaultAllEqual) {
        this.uri = uri;
        this.defaultAllEqual = defaultAllEqual;
    }

    @Nullable
    public static Placement fromUri(String uri) {
        for (Placement placement: Placement.values())
            if (placement.uri.equals(uri))
                return placement;
        return null;
    }

    @Override
    public String toString() {
        return this.uri.toUpperCase(Locale.ROOT);
    }
}
