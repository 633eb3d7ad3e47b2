package work.ecology.kernel.oracle;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Duplicate-content gate in front of a {@link ScoringBackend}.
 *
 * <p>Each instance owns its own fingerprint set, so several kernels can coexist in one process.
 * A fingerprint is recorded before the backend is consulted and stays recorded even when the
 * backend fails.
 */
public final class OriginalityOracle {
    private static final Logger LOG = LoggerFactory.getLogger(OriginalityOracle.class);

    private final ScoringBackend backend;
    private final Set<String> seen = ConcurrentHashMap.newKeySet();

    public OriginalityOracle(ScoringBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend");
    }

    /** Read-only: does not record the fingerprint. */
    public boolean isOriginal(String content) {
        return !seen.contains(Fingerprints.of(content));
    }

    public ScoreResult scoreArtifact(String artifactId, String artifactType, String content) {
        return scoreArtifact(artifactId, artifactType, content, () -> false);
    }

    /**
     * Scores content, skipping the backend entirely when {@code budgetExhausted} reports true.
     */
    public ScoreResult scoreArtifact(String artifactId, String artifactType, String content, BooleanSupplier budgetExhausted) {
        if (budgetExhausted != null && budgetExhausted.getAsBoolean()) {
            return ScoreResult.failed("Scoring budget exhausted - scoring skipped");
        }
        if (!seen.add(Fingerprints.of(content))) {
            LOG.info("Artifact {} rejected as duplicate content", artifactId);
            return ScoreResult.duplicate();
        }
        ScoreResult result;
        try {
            result = backend.score(artifactId, artifactType, content);
        } catch (RuntimeException ex) {
            LOG.warn("Scoring backend failed for {}", artifactId, ex);
            return ScoreResult.failed("Scoring failed: " + ex.getMessage());
        }
        if (result == null) {
            return ScoreResult.failed("Scoring backend returned no result");
        }
        LOG.debug("Artifact {} scored {} ({})", artifactId, result.score(), result.success() ? "ok" : result.error());
        return result;
    }

    public int fingerprintCount() {
        return seen.size();
    }
}
