package work.ecology.kernel.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.ecology.kernel.sandbox.CodeCheck;
import work.ecology.kernel.sandbox.SandboxedExecutor;

@CommandLine.Command(
    name = "check-code",
    description = "Pre-check artifact code without running it.",
    mixinStandardHelpOptions = true
)
final class CheckCodeCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private OutputOptions output = new OutputOptions();

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "JavaScript file defining run().")
    private Path file;

    @Override
    public Integer call() throws Exception {
        CodeCheck check;
        try (SandboxedExecutor executor = new SandboxedExecutor()) {
            check = executor.validateCode(Files.readString(file));
        }
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("valid", check.valid());
        report.put("message", check.message());
        spec.commandLine().getOut().println(output.render(report));
        return check.valid() ? 0 : 1;
    }
}
