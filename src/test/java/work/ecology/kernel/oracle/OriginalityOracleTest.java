package work.ecology.kernel.oracle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class OriginalityOracleTest {

    @Test
    void firstSubmissionIsScoredAndRepeatIsDuplicate() {
        List<String> calls = new ArrayList<>();
        var oracle = new OriginalityOracle((id, type, content) -> {
            calls.add(id);
            return ScoreResult.scored(72, "useful");
        });

        var first = oracle.scoreArtifact("a1", "tool", "function run() { return 1; }");
        assertTrue(first.success());
        assertEquals(72, first.score());
        assertEquals("useful", first.reason());

        var second = oracle.scoreArtifact("a2", "tool", "  FUNCTION RUN() { RETURN 1; }\n");
        assertTrue(second.success());
        assertEquals(0, second.score());
        assertEquals(ScoreResult.DUPLICATE_REASON, second.reason());
        assertEquals(List.of("a1"), calls);
    }

    @Test
    void isOriginalDoesNotRecord() {
        var oracle = new OriginalityOracle((id, type, content) -> ScoreResult.scored(50, "ok"));
        assertTrue(oracle.isOriginal("hello"));
        assertTrue(oracle.isOriginal("hello"));
        assertEquals(0, oracle.fingerprintCount());

        oracle.scoreArtifact("x", "doc", "hello");
        assertFalse(oracle.isOriginal("  Hello "));
        assertEquals(1, oracle.fingerprintCount());
    }

    @Test
    void exhaustedBudgetSkipsScoringAndRecordsNothing() {
        var oracle = new OriginalityOracle((id, type, content) -> ScoreResult.scored(90, "great"));
        var skipped = oracle.scoreArtifact("x", "tool", "code", () -> true);
        assertFalse(skipped.success());
        assertEquals("Scoring budget exhausted - scoring skipped", skipped.error());
        assertTrue(oracle.isOriginal("code"));
    }

    @Test
    void backendFailureKeepsFingerprint() {
        var oracle = new OriginalityOracle((id, type, content) -> {
            throw new IllegalStateException("model offline");
        });
        var failed = oracle.scoreArtifact("x", "tool", "body");
        assertFalse(failed.success());
        assertEquals("Scoring failed: model offline", failed.error());

        var retry = oracle.scoreArtifact("y", "tool", "body");
        assertEquals(ScoreResult.DUPLICATE_REASON, retry.reason());
    }

    @Test
    void separateOraclesDoNotShareFingerprints() {
        var left = new OriginalityOracle((id, type, content) -> ScoreResult.scored(10, ""));
        var right = new OriginalityOracle((id, type, content) -> ScoreResult.scored(10, ""));
        left.scoreArtifact("x", "doc", "shared text");
        assertTrue(right.isOriginal("shared text"));
    }

    @Test
    void fingerprintsNormalizeCaseAndOuterWhitespace() {
        assertEquals(Fingerprints.of("Abc"), Fingerprints.of("  abc\t"));
        assertFalse(Fingerprints.of("a b").equals(Fingerprints.of("ab")));
        assertEquals(64, Fingerprints.of("").length());
    }
}
