package work.ecology.kernel.oracle;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Normalized content keys used for duplicate detection.
 */
public final class Fingerprints {
    private Fingerprints() {}

    /**
     * SHA-256 of the content with surrounding whitespace removed and case folded.
     */
    public static String of(String content) {
        var normalized = (content == null ? "" : content).strip().toLowerCase(Locale.ROOT);
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(normalized.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
