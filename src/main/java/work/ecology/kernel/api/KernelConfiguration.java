package work.ecology.kernel.api;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import work.ecology.kernel.oracle.PromptScoringBackend;
import work.ecology.kernel.sandbox.SandboxPolicy;

/**
 * Immutable kernel settings: sandbox limits, execution and thinking costs, scorer limits.
 */
public record KernelConfiguration(
    Duration executorTimeout,
    List<String> preloadedModules,
    long invokeComputeCost,
    double rateInput,
    double rateOutput,
    long computeQuota,
    int maxContentLength
) {
    public KernelConfiguration {
        Objects.requireNonNull(executorTimeout, "executorTimeout");
        Objects.requireNonNull(preloadedModules, "preloadedModules");
        if (executorTimeout.isZero() || executorTimeout.isNegative()) {
            throw new IllegalArgumentException("executor timeout must be positive, got " + executorTimeout);
        }
        for (String module : preloadedModules) {
            if (!SandboxPolicy.AVAILABLE_MODULES.contains(module)) {
                throw new IllegalArgumentException("Unknown sandbox module '" + module + "'. Available: "
                    + String.join(", ", SandboxPolicy.AVAILABLE_MODULES));
            }
        }
        preloadedModules = List.copyOf(preloadedModules);
        requireNonNegative("invoke_compute_cost", invokeComputeCost);
        requireNonNegative("rate_input", rateInput);
        requireNonNegative("rate_output", rateOutput);
        requireNonNegative("compute_quota", computeQuota);
        if (maxContentLength <= 0) {
            throw new IllegalArgumentException("max_content_length must be positive, got " + maxContentLength);
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative, got " + value);
        }
    }

    public static KernelConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .executorTimeout(executorTimeout)
            .preloadedModules(preloadedModules)
            .invokeComputeCost(invokeComputeCost)
            .rateInput(rateInput)
            .rateOutput(rateOutput)
            .computeQuota(computeQuota)
            .maxContentLength(maxContentLength);
    }

    public static final class Builder {
        private Duration executorTimeout = Duration.ofSeconds(5);
        private List<String> preloadedModules = SandboxPolicy.AVAILABLE_MODULES;
        private long invokeComputeCost = 2;
        private double rateInput = 1.0;
        private double rateOutput = 3.0;
        private long computeQuota = 1000;
        private int maxContentLength = PromptScoringBackend.DEFAULT_MAX_CONTENT_LENGTH;

        public Builder executorTimeout(Duration executorTimeout) {
            this.executorTimeout = executorTimeout;
            return this;
        }

        public Builder preloadedModules(List<String> preloadedModules) {
            this.preloadedModules = preloadedModules;
            return this;
        }

        public Builder invokeComputeCost(long invokeComputeCost) {
            this.invokeComputeCost = invokeComputeCost;
            return this;
        }

        public Builder rateInput(double rateInput) {
            this.rateInput = rateInput;
            return this;
        }

        public Builder rateOutput(double rateOutput) {
            this.rateOutput = rateOutput;
            return this;
        }

        public Builder computeQuota(long computeQuota) {
            this.computeQuota = computeQuota;
            return this;
        }

        public Builder maxContentLength(int maxContentLength) {
            this.maxContentLength = maxContentLength;
            return this;
        }

        public KernelConfiguration build() {
            return new KernelConfiguration(
                executorTimeout,
                preloadedModules,
                invokeComputeCost,
                rateInput,
                rateOutput,
                computeQuota,
                maxContentLength
            );
        }
    }
}
