package work.ecology.kernel.oracle;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of scoring one artifact. {@code score} is 0..100; {@code error} is empty on success.
 */
public record ScoreResult(boolean success, int score, String reason, String error) {
    public static final String DUPLICATE_REASON = "Duplicate";

    public ScoreResult {
        reason = reason == null ? "" : reason;
        error = error == null ? "" : error;
    }

    public static ScoreResult scored(int score, String reason) {
        return new ScoreResult(true, score, reason, "");
    }

    public static ScoreResult duplicate() {
        return new ScoreResult(true, 0, DUPLICATE_REASON, "");
    }

    public static ScoreResult failed(String error) {
        return new ScoreResult(false, 0, "", error);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("success", success);
        map.put("score", score);
        map.put("reason", reason);
        map.put("error", error);
        return map;
    }
}
