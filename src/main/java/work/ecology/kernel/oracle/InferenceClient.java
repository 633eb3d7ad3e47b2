package work.ecology.kernel.oracle;

/**
 * Model provider answering a single prompt.
 */
@FunctionalInterface
public interface InferenceClient {
    String complete(String prompt) throws Exception;
}
