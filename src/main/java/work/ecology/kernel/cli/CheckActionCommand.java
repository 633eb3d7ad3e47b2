package work.ecology.kernel.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.ecology.kernel.intent.ActionSchema;
import work.ecology.kernel.intent.ActionValidation;

@CommandLine.Command(
    name = "check-action",
    description = "Validate agent output against the action schema.",
    mixinStandardHelpOptions = true
)
final class CheckActionCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private OutputOptions output = new OutputOptions();

    @CommandLine.Parameters(
        index = "0",
        arity = "0..1",
        paramLabel = "FILE|-",
        description = "File holding the agent output; '-' or nothing reads stdin."
    )
    private String source = "-";

    @Override
    public Integer call() throws Exception {
        ActionValidation validation = ActionSchema.validateActionJson(readSource());
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("valid", validation.isValid());
        if (validation.isValid()) {
            report.put("action", validation.action());
        } else {
            report.put("error", validation.error());
        }
        spec.commandLine().getOut().println(output.render(report));
        return validation.isValid() ? 0 : 1;
    }

    private String readSource() throws IOException {
        if (source == null || "-".equals(source)) {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(source));
    }
}
