package work.ecology.kernel.intent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record QueryKernelIntent(String principalId, String queryType, Map<String, Object> params)
    implements ActionIntent {

    public QueryKernelIntent {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    @Override
    public ActionType actionType() {
        return ActionType.QUERY_KERNEL;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("action_type", actionType().wireName());
        map.put("principal_id", principalId);
        map.put("query_type", queryType);
        map.put("params", params);
        return map;
    }
}
