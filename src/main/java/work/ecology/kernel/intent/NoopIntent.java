package work.ecology.kernel.intent;

import java.util.LinkedHashMap;
import java.util.Map;

public record NoopIntent(String principalId) implements ActionIntent {
    @Override
    public ActionType actionType() {
        return ActionType.NOOP;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("action_type", actionType().wireName());
        map.put("principal_id", principalId);
        return map;
    }
}
