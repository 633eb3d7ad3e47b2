package work.ecology.kernel.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.ecology.kernel.shared.JsonExtractor;

/**
 * Scores code by asking a model for a {@code {"score": n, "reason": "..."}} verdict.
 */
public final class PromptScoringBackend implements ScoringBackend {
    private static final Logger LOG = LoggerFactory.getLogger(PromptScoringBackend.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    public static final int DEFAULT_MAX_CONTENT_LENGTH = 2000;
    static final int MIN_SCORE = 0;
    static final int MAX_SCORE = 100;

    static final String PROMPT_TEMPLATE = """
        You are evaluating executable code submitted to an agent marketplace.
        Rate this code on quality and utility.

        Consider:
        - Does it solve a real, useful problem?
        - Is the code correct and functional?
        - Is it well-structured and readable?
        - Does it handle errors appropriately?
        - Is it original (not trivial or boilerplate)?

        Code to evaluate:
        ---
        Artifact ID: %s
        Type: %s
        Code: %s
        ---

        Respond with ONLY a JSON object in this exact format:
        {"score": <number 0-100>, "reason": "<brief explanation>"}

        Score guidelines:
        - 0-10: Broken, trivial, or useless (e.g., empty function, syntax errors)
        - 11-30: Minimal utility, poor quality
        - 31-50: Basic functionality, some utility
        - 51-70: Solid tool, good quality
        - 71-90: Excellent utility, well-crafted
        - 91-100: Exceptional - innovative, high-value tool

        Respond with ONLY the JSON object.
        """;

    private final InferenceClient client;
    private final int maxContentLength;

    public PromptScoringBackend(InferenceClient client) {
        this(client, DEFAULT_MAX_CONTENT_LENGTH);
    }

    public PromptScoringBackend(InferenceClient client, int maxContentLength) {
        this.client = Objects.requireNonNull(client, "client");
        if (maxContentLength <= 0) {
            throw new IllegalArgumentException("maxContentLength must be positive, got " + maxContentLength);
        }
        this.maxContentLength = maxContentLength;
    }

    @Override
    public ScoreResult score(String artifactId, String artifactType, String content) {
        String prompt = buildPrompt(artifactId, artifactType, content);
        String reply;
        try {
            reply = client.complete(prompt);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return ScoreResult.failed("Inference call interrupted");
        } catch (Exception ex) {
            LOG.warn("Scoring call for {} failed: {}", artifactId, ex.getMessage());
            return ScoreResult.failed("Inference call failed: " + ex.getMessage());
        }
        return parseReply(reply);
    }

    String buildPrompt(String artifactId, String artifactType, String content) {
        String body = content == null ? "" : content;
        if (body.length() > maxContentLength) {
            body = body.substring(0, maxContentLength) + "... [truncated]";
        }
        return PROMPT_TEMPLATE.formatted(artifactId, artifactType, body);
    }

    static ScoreResult parseReply(String reply) {
        Optional<String> json = JsonExtractor.extract(reply);
        if (json.isEmpty()) {
            return ScoreResult.failed("Failed to parse scorer response: no JSON object found");
        }
        JsonNode node;
        try {
            node = JSON.readTree(json.get());
        } catch (JsonProcessingException ex) {
            return ScoreResult.failed("Failed to parse scorer response: " + ex.getOriginalMessage());
        }
        JsonNode rawScore = node.path("score");
        int score;
        if (rawScore.isNumber()) {
            score = (int) Math.max(MIN_SCORE, Math.min(MAX_SCORE, Math.round(rawScore.asDouble())));
        } else if (rawScore.isTextual()) {
            try {
                score = Math.max(MIN_SCORE, Math.min(MAX_SCORE, Integer.parseInt(rawScore.asText().trim())));
            } catch (NumberFormatException ex) {
                return ScoreResult.failed("Failed to parse scorer response: score '" + rawScore.asText() + "' is not a number");
            }
        } else if (rawScore.isMissingNode() || rawScore.isNull()) {
            score = 0;
        } else {
            return ScoreResult.failed("Failed to parse scorer response: score is not a number");
        }
        return ScoreResult.scored(score, node.path("reason").asText(""));
    }
}
