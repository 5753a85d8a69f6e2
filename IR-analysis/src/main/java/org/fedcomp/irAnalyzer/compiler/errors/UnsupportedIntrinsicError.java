package org.fedcomp.irAnalyzer.compiler.errors;

import org.fedcomp.irAnalyzer.ir.expression.FedIntrinsic;

/** An intrinsic that the aggregate/broadcast reduction cannot handle. */
public final class UnsupportedIntrinsicError extends AnalysisViolation {
    public final String uri;

    public UnsupportedIntrinsicError(FedIntrinsic intrinsic) {
        super("Encountered an intrinsic not currently reducible to aggregate or broadcast: " +
                intrinsic, intrinsic);
        this.uri = intrinsic.uri;
    }

    @Override
    public String getErrorKind() {
        return "Unsupported intrinsic";
    }
}
