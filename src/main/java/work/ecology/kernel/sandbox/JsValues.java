package work.ecology.kernel.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;

/**
 * Moves plain data (maps, lists, strings, numbers, booleans, null) across the sandbox boundary.
 *
 * <p>Host values always enter the guest as freshly parsed JSON, so artifact code never holds a
 * reference to a host object.
 */
final class JsValues {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final int MAX_DEPTH = 64;
    private static final String SOURCE_READER =
        "(function (apply, toString) { return function (fn) { return apply(toString, fn, []); }; })"
            + "(Reflect.apply, Function.prototype.toString)";

    private final Context context;
    private final Value jsonParse;
    private final Value sourceReader;

    private JsValues(Context context, Value jsonParse, Value sourceReader) {
        this.context = context;
        this.jsonParse = jsonParse;
        this.sourceReader = sourceReader;
    }

    /**
     * Captures {@code JSON.parse} and {@code Function.prototype.toString} before the prelude
     * prunes the globals and before artifact code has a chance to replace either.
     */
    static JsValues capture(Context context) {
        return new JsValues(context, context.eval("js", "JSON.parse"), context.eval("js", SOURCE_READER));
    }

    /** Source text of a guest function, read through the captured {@code toString}. */
    String sourceOf(Value function) {
        return sourceReader.execute(function).asString();
    }

    Value toJs(Object value) {
        if (value == null) {
            return context.asValue(null);
        }
        try {
            return jsonParse.execute(JSON.writeValueAsString(value));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Value cannot cross the sandbox boundary: " + ex.getOriginalMessage(), ex);
        }
    }

    static Object toJava(Value value) {
        return toJava(value, 0);
    }

    private static Object toJava(Value value, int depth) {
        if (depth > MAX_DEPTH) {
            throw new IllegalArgumentException("Result nesting exceeds " + MAX_DEPTH + " levels (cyclic value?)");
        }
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            if (value.fitsInInt()) return value.asInt();
            if (value.fitsInLong()) return value.asLong();
            if (value.fitsInDouble()) return value.asDouble();
            return value.toString();
        }
        if (value.isString()) {
            return value.asString();
        }
        if (value.isInstant()) {
            return value.asInstant().toString();
        }
        if (value.canExecute()) {
            return value.toString();
        }
        if (value.hasArrayElements()) {
            List<Object> list = new ArrayList<>();
            long size = value.getArraySize();
            for (long i = 0; i < size; i++) {
                list.add(toJava(value.getArrayElement(i), depth + 1));
            }
            return list;
        }
        if (value.hasHashEntries()) {
            Map<String, Object> map = new LinkedHashMap<>();
            Value iterator = value.getHashEntriesIterator();
            while (iterator.hasIteratorNextElement()) {
                Value entry = iterator.getIteratorNextElement();
                map.put(String.valueOf(toJava(entry.getArrayElement(0), depth + 1)), toJava(entry.getArrayElement(1), depth + 1));
            }
            return map;
        }
        if (value.hasMembers()) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : value.getMemberKeys()) {
                map.put(key, toJava(value.getMember(key), depth + 1));
            }
            return map;
        }
        return value.toString();
    }

    /**
     * Resolves a promise returned by {@code run}. Pending jobs are drained when control returns to
     * the host, so a promise that is still pending afterwards will never settle.
     */
    static Object await(Value value) {
        if (value == null || !value.canInvokeMember("then")) {
            return toJava(value);
        }
        CompletableFuture<Object> future = new CompletableFuture<>();
        ProxyExecutable resolve = args -> {
            future.complete(args.length > 0 ? toJava(args[0]) : null);
            return null;
        };
        ProxyExecutable reject = args -> {
            future.completeExceptionally(new ScriptRejectedException(describeRejection(args.length > 0 ? args[0] : null)));
            return null;
        };
        value.invokeMember("then", resolve, reject);
        if (!future.isDone()) {
            throw new ScriptRejectedException("run() returned a promise that never settled");
        }
        return future.join();
    }

    private static String describeRejection(Value reason) {
        if (reason == null || reason.isNull()) {
            return "Promise rejected";
        }
        if (reason.isException() || reason.isString()) {
            return reason.toString();
        }
        Object converted = toJava(reason);
        if (converted instanceof Map || converted instanceof List) {
            try {
                return JSON.writeValueAsString(converted);
            } catch (JsonProcessingException ex) {
                return String.valueOf(converted);
            }
        }
        return String.valueOf(converted);
    }

    /**
     * Raised when the promise returned by {@code run} rejects.
     */
    static final class ScriptRejectedException extends RuntimeException {
        ScriptRejectedException(String message) {
            super(message);
        }
    }
}
