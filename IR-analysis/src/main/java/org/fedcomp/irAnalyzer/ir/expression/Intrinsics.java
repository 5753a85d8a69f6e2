package org.fedcomp.irAnalyzer.ir.expression;

import javax.annotation.Nullable;

/** Well-known intrinsic operators. */
public enum Intrinsics {
    FEDERATED_AGGREGATE("federated_aggregate"),
    FEDERATED_APPLY("federated_apply"),
    FEDERATED_BROADCAST("federated_broadcast"),
    FEDERATED_COLLECT("federated_collect"),
    FEDERATED_MAP("federated_map"),
    FEDERATED_MAP_ALL_EQUAL("federated_map_all_equal"),
    FEDERATED_MEAN("federated_mean"),
    FEDERATED_REDUCE("federated_reduce"),
    FEDERATED_SUM("federated_sum"),
    FEDERATED_VALUE_AT_CLIENTS("federated_value_at_clients"),
    FEDERATED_VALUE_AT_SERVER("federated_value_at_server"),
    FEDERATED_WEIGHTED_MEAN("federated_weighted_mean"),
    FEDERATED_ZIP_AT_CLIENTS("federated_zip_at_clients"),
    FEDERATED_ZIP_AT_SERVER("federated_zip_at_server"),
    GENERIC_PLUS("generic_plus"),
    GENERIC_ZERO("generic_zero"),
    SEQUENCE_MAP("sequence_map"),
    SEQUENCE_REDUCE("sequence_reduce"),
    SEQUENCE_SUM("sequence_sum");

    public final String uri;

    Intrinsics(String uri) {
        this.uri = uri;
    }

    @Nullable
    public static Intrinsics fromUri(String uri) {
        for (Intrinsics intrinsic: Intrinsics.values())
            if (intrinsic.uri.equals(uri))
                return intrinsic;
        return null;
    }

    @Override
    public String toString() {
        return this.uri;
    }
}
