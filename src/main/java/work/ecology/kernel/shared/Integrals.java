package work.ecology.kernel.shared;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Exact integer extraction from decoded JSON values. Fractional numbers, strings and booleans
 * are not integers.
 */
public final class Integrals {
    private Integrals() {}

    public static Optional<Long> exact(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return Optional.of(((Number) value).longValue());
        }
        if (value instanceof BigInteger big && big.bitLength() < 64) {
            return Optional.of(big.longValue());
        }
        return Optional.empty();
    }
}
