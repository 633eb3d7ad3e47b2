package work.ecology.kernel.intent;

import java.util.Map;

/**
 * A validated action, consumed once by a kernel action handler.
 */
public interface ActionIntent {
    ActionType actionType();

    /** Principal issuing the action. */
    String principalId();

    /** Compact form for logs and action results; long text fields are truncated. */
    Map<String, Object> toMap();

    static String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 100 ? text.substring(0, 100) + "..." : text;
    }
}
