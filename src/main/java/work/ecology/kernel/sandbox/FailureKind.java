package work.ecology.kernel.sandbox;

/**
 * Why a sandboxed execution failed.
 */
public enum FailureKind {
    /** Empty code, no {@code run} entry point, or a syntax error. */
    VALIDATION,
    /** Attempted access to a prohibited module or global. */
    SANDBOX_VIOLATION,
    /** An exception raised by the artifact code. */
    RUNTIME,
    /** The wall-clock budget was exhausted. */
    TIMEOUT,
    /** Argument count did not match the {@code run} signature. */
    ARGUMENT,
    /** The restricted environment could not be built. */
    UNAVAILABLE
}
