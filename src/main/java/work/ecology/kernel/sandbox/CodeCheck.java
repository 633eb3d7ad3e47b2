package work.ecology.kernel.sandbox;

/**
 * Result of the static pre-check performed by {@link SandboxedExecutor#validateCode(String)}.
 */
public record CodeCheck(boolean valid, String message) {
    static CodeCheck ok() {
        return new CodeCheck(true, "");
    }

    static CodeCheck invalid(String message) {
        return new CodeCheck(false, message);
    }
}
