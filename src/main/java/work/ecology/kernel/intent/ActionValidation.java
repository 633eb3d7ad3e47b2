package work.ecology.kernel.intent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Either the parsed action mapping or a descriptive error.
 */
public record ActionValidation(Map<String, Object> action, String error) {
    public ActionValidation {
        if ((action == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of action or error must be set");
        }
        action = action == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(action));
    }

    public static ActionValidation ok(Map<String, Object> action) {
        return new ActionValidation(Objects.requireNonNull(action, "action"), null);
    }

    public static ActionValidation invalid(String error) {
        return new ActionValidation(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isValid() {
        return action != null;
    }
}
