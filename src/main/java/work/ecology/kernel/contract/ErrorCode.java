package work.ecology.kernel.contract;

import java.util.Locale;

/**
 * Machine-readable error codes returned by kernel contracts.
 */
public enum ErrorCode {
    MISSING_ARGUMENT,
    INVALID_ARGUMENT,
    INVALID_TYPE,
    NOT_OWNER,
    NOT_AUTHORIZED,
    INSUFFICIENT_FUNDS,
    NOT_FOUND,
    TIMEOUT,
    RUNTIME_ERROR,
    SYNTAX_ERROR,
    INTERNAL_ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
