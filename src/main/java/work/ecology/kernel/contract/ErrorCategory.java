package work.ecology.kernel.contract;

import java.util.Locale;

/**
 * Coarse classification of a contract error, so agents can tell bad input from missing rights.
 */
public enum ErrorCategory {
    VALIDATION,
    PERMISSION,
    RESOURCE,
    EXECUTION,
    SYSTEM;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
