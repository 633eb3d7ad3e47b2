package work.ecology.kernel.cli;

import picocli.CommandLine;
import work.ecology.kernel.sandbox.SandboxPolicy;

/**
 * Reports the kernel build and the sandbox surface artifacts can rely on.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "agent-kernel (java) " + (implementationVersion == null ? "development" : implementationVersion),
            "sandbox: ECMAScript 2023, modules " + String.join(", ", SandboxPolicy.AVAILABLE_MODULES)
        };
    }
}
