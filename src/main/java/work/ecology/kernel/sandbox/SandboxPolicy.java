package work.ecology.kernel.sandbox;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Allow-lists and deny-lists applied to every sandboxed execution.
 *
 * <p>The global object is pruned to {@link #globals()} before artifact code runs; everything
 * else (engine helpers, {@code eval}, {@code Function}, reflection) is simply absent.
 */
public final class SandboxPolicy {
    public static final List<String> AVAILABLE_MODULES = List.of("math", "json", "random", "datetime");

    static final List<String> HELPERS = List.of("len", "sum", "sorted", "range", "any", "all", "zip", "abs", "round");

    private static final List<String> INTRINSICS = List.of(
        "Object", "Array", "String", "Number", "Boolean", "Symbol", "BigInt",
        "Math", "JSON", "Date", "Map", "Set", "WeakMap", "WeakSet", "Promise", "RegExp",
        "Error", "TypeError", "RangeError", "ReferenceError", "SyntaxError", "EvalError", "URIError",
        "AggregateError",
        "parseInt", "parseFloat", "isNaN", "isFinite", "Infinity", "NaN", "undefined",
        "encodeURIComponent", "decodeURIComponent", "encodeURI", "decodeURI"
    );

    /** Names that grant OS, process, network or runtime access. */
    static final Set<String> DENIED_MODULES = Set.of(
        "os", "sys", "subprocess", "child_process", "fs", "net", "http", "https", "process",
        "vm", "worker_threads", "module", "socket", "shutil", "ctypes", "importlib", "builtins",
        "inspect", "gc", "signal", "threading", "multiprocessing", "pickle", "java", "polyglot"
    );

    /** Globals whose absence is a sandbox guarantee rather than an ordinary undefined name. */
    static final Set<String> FORBIDDEN_GLOBALS = Set.of(
        "eval", "Function", "Reflect", "Proxy", "globalThis", "process", "Java", "Polyglot", "Graal",
        "load", "loadWithNewGlobal", "print", "printErr", "quit", "exit", "__import__", "WebAssembly"
    );

    private static final Pattern STATIC_IMPORT = Pattern.compile("(?m)^\\s*(?:import|export)\\s+[\\w{*'\"]");
    private static final Pattern DYNAMIC_IMPORT = Pattern.compile(
        "\\bimport(?:\\s|/\\*.*?\\*/|//[^\\n]*)*(?:\\(|\\.)", Pattern.DOTALL);
    private static final Pattern UNDEFINED_NAME = Pattern.compile("ReferenceError: (\\S+) is not defined");

    private final List<String> modules;

    private SandboxPolicy(List<String> modules) {
        this.modules = List.copyOf(modules);
    }

    public static SandboxPolicy defaults() {
        return new SandboxPolicy(AVAILABLE_MODULES);
    }

    /**
     * Restricts the preloaded modules to the given names; unknown names are ignored.
     */
    public static SandboxPolicy withModules(List<String> preloaded) {
        if (preloaded == null) {
            return defaults();
        }
        return new SandboxPolicy(preloaded.stream().filter(AVAILABLE_MODULES::contains).distinct().toList());
    }

    public List<String> modules() {
        return modules;
    }

    public List<String> globals() {
        List<String> names = new ArrayList<>(INTRINSICS);
        names.addAll(HELPERS);
        names.addAll(modules);
        names.add("require");
        names.add("ImportError");
        return names;
    }

    /**
     * Policy handed to the prelude installer.
     */
    Map<String, Object> toPreludeInput() {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("modules", modules);
        input.put("deniedModules", DENIED_MODULES.stream().sorted().toList());
        input.put("globals", globals());
        return input;
    }

    /**
     * Source-level checks for constructs the script engine would otherwise reject with a less
     * useful parse error.
     */
    Optional<String> staticViolation(String code) {
        if (code == null) {
            return Optional.empty();
        }
        if (STATIC_IMPORT.matcher(code).find()) {
            return Optional.of("import/export statements are not allowed in the sandbox; use require(name) for "
                + String.join(", ", modules));
        }
        if (DYNAMIC_IMPORT.matcher(code).find()) {
            return Optional.of("dynamic import() is not allowed in the sandbox");
        }
        return Optional.empty();
    }

    /**
     * Returns the forbidden global named by a {@code ReferenceError} message, if any.
     */
    Optional<String> forbiddenReference(String message) {
        if (message == null) {
            return Optional.empty();
        }
        Matcher matcher = UNDEFINED_NAME.matcher(message);
        if (matcher.find() && FORBIDDEN_GLOBALS.contains(matcher.group(1))) {
            return Optional.of(matcher.group(1));
        }
        return Optional.empty();
    }
}
