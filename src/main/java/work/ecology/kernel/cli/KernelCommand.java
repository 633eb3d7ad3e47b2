package work.ecology.kernel.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "agent-kernel",
    description = "Run and check agent artifacts against the ecology kernel.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        ExecCommand.class,
        CheckActionCommand.class,
        CheckCodeCommand.class
    }
)
final class KernelCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand (exec, check-action, check-code)");
    }
}
