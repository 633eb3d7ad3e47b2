package work.ecology.kernel.intent;

import java.util.Objects;

/**
 * Either a typed intent or a descriptive error.
 */
public record IntentParse(ActionIntent intent, String error) {
    public static IntentParse ok(ActionIntent intent) {
        return new IntentParse(Objects.requireNonNull(intent, "intent"), null);
    }

    public static IntentParse invalid(String error) {
        return new IntentParse(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isValid() {
        return intent != null;
    }
}
