package work.ecology.kernel.contract;

import java.util.List;
import java.util.Map;

/**
 * A method exposed by a kernel contract.
 */
@FunctionalInterface
public interface ContractMethod {
    Map<String, Object> invoke(String invokerId, List<Object> args) throws Exception;
}
