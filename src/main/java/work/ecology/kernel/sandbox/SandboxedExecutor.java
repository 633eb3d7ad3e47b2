package work.ecology.kernel.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.EnvironmentAccess;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.io.IOAccess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.ecology.kernel.ledger.Ledger;

/**
 * Runs artifact code (JavaScript defining a {@code run} entry point) inside a restricted
 * polyglot context.
 *
 * <p>Every execution gets a fresh context with no host access, no IO, no threads, no processes
 * and no environment. The global object is pruned to {@link SandboxPolicy#globals()} before the
 * artifact is evaluated. The body runs on a worker thread so that the wall-clock timeout can cancel
 * code without suspension points.
 */
public final class SandboxedExecutor implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SandboxedExecutor.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    private static final String PRELUDE_RESOURCE = "/sandbox/prelude.js";
    private static final Pattern RUN_DEFINITION = Pattern.compile(
        "\\b(?:async\\s+)?function\\s*\\*?\\s*run\\s*\\(|\\b(?:const|let|var)\\s+run\\s*="
    );
    private static final Pattern BAD_INDEX = Pattern.compile(
        "Cannot read propert(?:y '\\d+' of|ies of \\w+ \\(reading '\\d+'\\))"
    );
    private static final AtomicInteger WORKER_IDS = new AtomicInteger();

    private final Duration timeout;
    private final SandboxPolicy policy;
    private final ExecutorService workers;
    private final Engine engine;
    private final String engineError;

    public SandboxedExecutor() {
        this(DEFAULT_TIMEOUT, SandboxPolicy.defaults());
    }

    public SandboxedExecutor(Duration timeout) {
        this(timeout, SandboxPolicy.defaults());
    }

    public SandboxedExecutor(Duration timeout, SandboxPolicy policy) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Sandbox timeout must be positive, got " + timeout);
        }
        this.timeout = timeout;
        this.policy = Objects.requireNonNull(policy, "policy");
        this.workers = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "sandbox-worker-" + WORKER_IDS.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        Engine created = null;
        String error = null;
        try {
            created = Engine.newBuilder()
                .option("engine.WarnInterpreterOnly", "false")
                .build();
        } catch (RuntimeException ex) {
            error = ex.getMessage();
            LOG.warn("Polyglot engine unavailable, every sandboxed run will fail: {}", error);
        }
        this.engine = created;
        this.engineError = error;
    }

    public Duration timeout() {
        return timeout;
    }

    public SandboxPolicy policy() {
        return policy;
    }

    /**
     * Cheap pre-check: non-empty, declares {@code run}, and parses. Nothing is executed.
     */
    public CodeCheck validateCode(String code) {
        if (code == null || code.isBlank()) {
            return CodeCheck.invalid("Empty code");
        }
        if (!RUN_DEFINITION.matcher(code).find()) {
            return CodeCheck.invalid("Code must define a run() function");
        }
        Context context;
        try {
            context = newContext();
        } catch (RuntimeException ex) {
            return CodeCheck.invalid("Unable to construct restricted environment: " + ex.getMessage());
        }
        try {
            context.parse(Source.newBuilder("js", code, "artifact.js").buildLiteral());
            return CodeCheck.ok();
        } catch (PolyglotException ex) {
            if (ex.isSyntaxError()) {
                return CodeCheck.invalid("Syntax error: " + ex.getMessage());
            }
            return CodeCheck.invalid("Compilation failed: " + ex.getMessage());
        } finally {
            closeQuietly(context, false);
        }
    }

    public ExecutionResult execute(String code, List<?> args) {
        return run(code, args, WalletCapabilities.unbound());
    }

    /**
     * Same as {@link #execute(String, List)}, with {@code pay}/{@code get_balance} bound to
     * {@code artifactId}'s wallet when both an artifact id and a ledger are supplied.
     */
    public ExecutionResult executeWithWallet(String code, List<?> args, String artifactId, Ledger ledger) {
        WalletCapabilities wallet = artifactId == null || artifactId.isBlank() || ledger == null
            ? WalletCapabilities.unbound()
            : WalletCapabilities.bind(artifactId, ledger);
        return run(code, args, wallet);
    }

    private ExecutionResult run(String code, List<?> rawArgs, WalletCapabilities wallet) {
        Optional<String> violation = policy.staticViolation(code);
        if (violation.isPresent()) {
            return ExecutionResult.rejected(FailureKind.SANDBOX_VIOLATION, "Sandbox violation: " + violation.get());
        }
        CodeCheck check = validateCode(code);
        if (!check.valid()) {
            return ExecutionResult.rejected(FailureKind.VALIDATION, check.message());
        }
        List<Object> args = decodeJsonArgs(rawArgs);

        Execution execution = new Execution();
        long started = System.nanoTime();
        Future<ExecutionResult> future;
        try {
            future = workers.submit(() -> runIsolated(code, args, wallet, execution, started));
        } catch (RejectedExecutionException ex) {
            return ExecutionResult.rejected(FailureKind.UNAVAILABLE, "Sandbox executor is closed");
        }
        try {
            ExecutionResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            LOG.debug("Sandboxed run finished in {} ms (success={})", result.executionTimeMs(), result.success());
            return result;
        } catch (TimeoutException ex) {
            execution.cancel();
            future.cancel(true);
            LOG.warn("Sandboxed run{} timed out after {} ms",
                wallet.isBound() ? " of " + wallet.artifactId() : "", timeout.toMillis());
            return ExecutionResult.failure(FailureKind.TIMEOUT, timeoutMessage(), elapsedMs(started), wallet.payments());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            execution.cancel();
            return ExecutionResult.failure(FailureKind.UNAVAILABLE, "Execution interrupted", elapsedMs(started), wallet.payments());
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            LOG.warn("Sandboxed run failed outside artifact code", cause);
            return ExecutionResult.failure(FailureKind.RUNTIME, "Runtime error: " + describe(cause), elapsedMs(started), wallet.payments());
        }
    }

    private ExecutionResult runIsolated(
        String code,
        List<Object> args,
        WalletCapabilities wallet,
        Execution execution,
        long started
    ) {
        Context context;
        try {
            context = newContext();
        } catch (RuntimeException ex) {
            LOG.warn("Unable to construct sandbox context: {}", ex.getMessage());
            return ExecutionResult.failure(FailureKind.UNAVAILABLE,
                "Unable to construct restricted environment: " + ex.getMessage(), elapsedMs(started), List.of());
        }
        if (!execution.attach(context)) {
            closeQuietly(context, false);
            return ExecutionResult.failure(FailureKind.TIMEOUT, timeoutMessage(), elapsedMs(started), List.of());
        }
        try {
            JsValues values = JsValues.capture(context);
            List<String> leftovers = installPrelude(context, values);
            if (!leftovers.isEmpty()) {
                LOG.warn("Sandbox globals survived pruning: {}", leftovers);
                return ExecutionResult.failure(FailureKind.UNAVAILABLE,
                    "Unable to construct restricted environment: globals still reachable " + leftovers,
                    elapsedMs(started), List.of());
            }
            wallet.install(context, values);
            List<Value> jsArgs = new ArrayList<>(args.size());
            for (Object arg : args) {
                jsArgs.add(values.toJs(arg));
            }

            context.eval(Source.newBuilder("js", code, "artifact.js").buildLiteral());
            Value entry = context.eval("js", "typeof run === 'undefined' ? undefined : run");
            if (entry == null || entry.isNull()) {
                return ExecutionResult.failure(FailureKind.VALIDATION, "Code did not define a run() function",
                    elapsedMs(started), wallet.payments());
            }
            if (!entry.canExecute()) {
                return ExecutionResult.failure(FailureKind.VALIDATION, "run is not callable",
                    elapsedMs(started), wallet.payments());
            }
            RunSignature signature = RunSignature.of(values.sourceOf(entry), entry.getMember("length").asInt());
            if (!signature.accepts(jsArgs.size())) {
                return ExecutionResult.failure(FailureKind.ARGUMENT, signature.mismatch(jsArgs.size()),
                    elapsedMs(started), wallet.payments());
            }
            Object result = JsValues.await(entry.execute(jsArgs.toArray()));
            return ExecutionResult.success(result, elapsedMs(started), wallet.payments());
        } catch (PolyglotException ex) {
            return fromPolyglot(ex, elapsedMs(started), wallet);
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            return ExecutionResult.failure(FailureKind.RUNTIME, formatRuntimeError(describe(cause)),
                elapsedMs(started), wallet.payments());
        } catch (JsValues.ScriptRejectedException | IllegalArgumentException ex) {
            return ExecutionResult.failure(FailureKind.RUNTIME, formatRuntimeError(ex.getMessage()),
                elapsedMs(started), wallet.payments());
        } finally {
            closeQuietly(context, false);
        }
    }

    private List<String> installPrelude(Context context, JsValues values) {
        Value installer = context.eval(Source.newBuilder("js", Prelude.SOURCE, "prelude.js").buildLiteral());
        Value leftovers = installer.execute(values.toJs(policy.toPreludeInput()));
        List<String> names = new ArrayList<>();
        for (long i = 0; i < leftovers.getArraySize(); i++) {
            names.add(leftovers.getArrayElement(i).asString());
        }
        return names;
    }

    private ExecutionResult fromPolyglot(PolyglotException ex, double elapsed, WalletCapabilities wallet) {
        List<Map<String, Object>> payments = wallet.payments();
        if (ex.isCancelled() || ex.isInterrupted()) {
            return ExecutionResult.failure(FailureKind.TIMEOUT, timeoutMessage(), elapsed, payments);
        }
        if (ex.isSyntaxError()) {
            return ExecutionResult.failure(FailureKind.VALIDATION, "Syntax error: " + ex.getMessage(), elapsed, payments);
        }
        if (ex.isResourceExhausted()) {
            return ExecutionResult.failure(FailureKind.RUNTIME, "Runtime error: resource exhausted: " + ex.getMessage(), elapsed, payments);
        }
        if (ex.isHostException()) {
            return ExecutionResult.failure(FailureKind.RUNTIME, formatRuntimeError(describe(ex.asHostException())), elapsed, payments);
        }
        String message = ex.getMessage();
        if (message != null && (message.startsWith("ImportError") || message.contains("Import of '")
            || message.contains("Operation is not allowed"))) {
            return ExecutionResult.failure(FailureKind.SANDBOX_VIOLATION, "Sandbox violation: " + message, elapsed, payments);
        }
        Optional<String> forbidden = policy.forbiddenReference(message);
        if (forbidden.isPresent()) {
            return ExecutionResult.failure(FailureKind.SANDBOX_VIOLATION,
                "Sandbox violation: '" + forbidden.get() + "' is not available in the sandbox (" + message + ")",
                elapsed, payments);
        }
        return ExecutionResult.failure(FailureKind.RUNTIME, formatRuntimeError(message), elapsed, payments);
    }

    private static String formatRuntimeError(String message) {
        String base = "Runtime error: " + message;
        if (message == null) {
            return base;
        }
        if (message.contains("pay is not defined") || message.contains("get_balance is not defined")) {
            return base + ". Hint: pay() and get_balance() exist only when the artifact runs with a wallet.";
        }
        if (message.startsWith("ReferenceError") && message.contains("is not defined")) {
            return base + ". Hint: only math, json, random, datetime and the built-in helpers are defined; "
                + "declare everything else yourself.";
        }
        if (BAD_INDEX.matcher(message).find()) {
            return base + ". Hint: the indexed element does not exist; check the list length before indexing.";
        }
        if (message.startsWith("RangeError")) {
            return base + ". Hint: a length, index or count is out of range.";
        }
        if (message.startsWith("TypeError") && message.contains("Cannot read propert")) {
            return base + ". Hint: the value is null or undefined; check it exists before reading its properties.";
        }
        return base;
    }

    private String timeoutMessage() {
        return "Execution timed out after " + timeout.toMillis() + " ms";
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static double elapsedMs(long started) {
        return (System.nanoTime() - started) / 1_000_000.0;
    }

    /**
     * Decodes string arguments that hold JSON objects or arrays; everything else passes through.
     */
    static List<Object> decodeJsonArgs(List<?> args) {
        List<Object> decoded = new ArrayList<>();
        if (args == null) {
            return decoded;
        }
        for (Object arg : args) {
            if (arg instanceof String text) {
                String trimmed = text.trim();
                if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
                    try {
                        Object parsed = JSON.readValue(trimmed, Object.class);
                        if (parsed instanceof Map || parsed instanceof List) {
                            decoded.add(parsed);
                            continue;
                        }
                    } catch (JsonProcessingException ex) {
                        LOG.trace("Argument is not JSON, passing it through: {}", ex.getOriginalMessage());
                    }
                }
            }
            decoded.add(arg);
        }
        return decoded;
    }

    private Context newContext() {
        if (engine == null) {
            throw new IllegalStateException("polyglot engine unavailable (" + engineError + ")");
        }
        return Context.newBuilder("js")
            .engine(engine)
            .allowHostAccess(HostAccess.EXPLICIT)
            .allowHostClassLookup(className -> false)
            .allowIO(IOAccess.NONE)
            .allowCreateThread(false)
            .allowCreateProcess(false)
            .allowNativeAccess(false)
            .allowEnvironmentAccess(EnvironmentAccess.NONE)
            .allowPolyglotAccess(PolyglotAccess.NONE)
            .allowExperimentalOptions(true)
            .option("js.ecmascript-version", "2023")
            .build();
    }

    private static void closeQuietly(Context context, boolean cancel) {
        try {
            context.close(cancel);
        } catch (PolyglotException | IllegalStateException ex) {
            LOG.debug("Sandbox context close reported: {}", ex.getMessage());
        }
    }

    @Override
    public void close() {
        workers.shutdownNow();
        if (engine == null) {
            return;
        }
        try {
            engine.close(true);
        } catch (PolyglotException | IllegalStateException ex) {
            LOG.debug("Sandbox engine close reported: {}", ex.getMessage());
        }
    }

    /**
     * Links the host thread waiting on a result with the context running on the worker, so a
     * timeout can cancel the context whichever side gets there first.
     */
    private static final class Execution {
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private final AtomicReference<Context> context = new AtomicReference<>();

        boolean attach(Context ctx) {
            context.set(ctx);
            return !cancelled.get();
        }

        void cancel() {
            cancelled.set(true);
            Context ctx = context.get();
            if (ctx != null) {
                closeQuietly(ctx, true);
            }
        }
    }

    private static final class Prelude {
        static final String SOURCE = load();

        private Prelude() {}

        private static String load() {
            try (InputStream in = SandboxedExecutor.class.getResourceAsStream(PRELUDE_RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Sandbox prelude missing from resources (" + PRELUDE_RESOURCE + ")");
                }
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new IllegalStateException("Unable to read sandbox prelude: " + ex.getMessage(), ex);
            }
        }
    }
}
