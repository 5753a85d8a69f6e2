package org.fedcomp.irAnalyzer.compiler.visitors.inner;

import org.fedcomp.irAnalyzer.compiler.errors.UnsupportedIntrinsicError;
import org.fedcomp.irAnalyzer.ir.expression.FedIntrinsic;
import org.fedcomp.irAnalyzer.ir.expression.Intrinsics;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/** Checks that every intrinsic can be reduced to federated aggregate
 * or broadcast, or to local processing, by the reduction pass that
 * lowers a computation into a broadcast-aggregate round. */
public class CheckIntrinsicsWhitelisted extends InnerVisitor {
    /** Intrinsics handled by the reduction; update together with that pass. */
    public static final Set<Intrinsics> WHITELIST = Collections.unmodifiableSet(EnumSet.of(
            Intrinsics.FEDERATED_AGGREGATE,
            Intrinsics.FEDERATED_APPLY,
            Intrinsics.FEDERATED_BROADCAST,
            Intrinsics.FEDERATED_MAP,
            Intrinsics.FEDERATED_MAP_ALL_EQUAL,
            Intrinsics.FEDERATED_VALUE_AT_CLIENTS,
            Intrinsics.FEDERATED_VALUE_AT_SERVER,
            Intrinsics.FEDERATED_ZIP_AT_SERVER,
            Intrinsics.FEDERATED_ZIP_AT_CLIENTS));

    public static boolean isWhitelisted(String uri) {
        Intrinsics intrinsic = Intrinsics.fromUri(uri);
        return intrinsic != null && WHITELIST.contains(intrinsic);
    }

    @Override
    public void postorder(FedIntrinsic intrinsic) {
        if (!isWhitelisted(intrinsic.uri))
            throw new UnsupportedIntrinsicError(intrinsic);
    }
}
