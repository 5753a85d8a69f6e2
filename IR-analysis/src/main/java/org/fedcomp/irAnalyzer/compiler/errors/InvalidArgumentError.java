package org.fedcomp.irAnalyzer.compiler.errors;

/** An analysis was invoked with an argument of the wrong kind,
 * for example a missing tree or predicate.  Thrown before any node is visited. */
public final class InvalidArgumentError extends BaseCompilerException {
    public InvalidArgumentError(String message) {
        super(message, null);
    }

    public InvalidArgumentError(String message, Throwable cause) {
        super(message, null, cause);
    }

    @Override
    public String getErrorKind() {
        return "Invalid argument";
    }
}
