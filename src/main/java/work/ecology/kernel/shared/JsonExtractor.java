package work.ecology.kernel.shared;

import java.util.Optional;

/**
 * Pulls the first JSON object out of free-form model output.
 */
public final class JsonExtractor {
    private static final String FENCE = "```";

    private JsonExtractor() {}

    public static Optional<String> extract(String text) {
        if (text == null) {
            return Optional.empty();
        }
        var body = stripFence(text.strip());
        int start = body.indexOf('{');
        int end = body.lastIndexOf('}');
        if (start < 0 || end < start) {
            return Optional.empty();
        }
        return Optional.of(body.substring(start, end + 1));
    }

    /**
     * Keeps only the lines of the first fenced block ({@code ```json} or a bare fence) when the
     * text contains one.
     */
    private static String stripFence(String text) {
        int open = text.indexOf(FENCE);
        if (open < 0) {
            return text;
        }
        int bodyStart = text.indexOf('\n', open);
        if (bodyStart < 0) {
            return text;
        }
        int close = text.indexOf(FENCE, bodyStart + 1);
        var block = close < 0 ? text.substring(bodyStart + 1) : text.substring(bodyStart + 1, close);
        return block.indexOf('{') >= 0 ? block : text;
    }
}
