package work.ecology.kernel.oracle;

/**
 * External scorer consulted for content the oracle has not seen before.
 */
@FunctionalInterface
public interface ScoringBackend {
    ScoreResult score(String artifactId, String artifactType, String content);
}
