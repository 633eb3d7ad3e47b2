package work.ecology.kernel.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.ecology.kernel.api.AgentKernel;
import work.ecology.kernel.api.KernelConfigLoader;
import work.ecology.kernel.api.KernelConfiguration;
import work.ecology.kernel.sandbox.ExecutionResult;

@CommandLine.Command(
    name = "exec",
    description = "Execute artifact code in the sandbox, optionally with a funded wallet.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class ExecCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private OutputOptions output = new OutputOptions();

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "JavaScript file defining run().")
    private Path file;

    @CommandLine.Option(
        names = "--arg",
        paramLabel = "JSON",
        description = "Positional argument for run(), as JSON; text that is not JSON is passed as a string."
    )
    private List<String> rawArgs = new ArrayList<>();

    @CommandLine.Option(
        names = "--artifact-id",
        description = "Bind pay()/get_balance() to this artifact's wallet.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String artifactId;

    @CommandLine.Option(names = "--fund", description = "Starting scrip of the artifact wallet.", defaultValue = "0")
    private long fund;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "TOML",
        description = "Kernel configuration overriding the bundled defaults.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @Override
    public Integer call() throws Exception {
        if (fund < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--fund must not be negative");
        }
        if (fund > 0 && artifactId == null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--fund requires --artifact-id");
        }
        String code = Files.readString(file);
        List<Object> args = new ArrayList<>();
        for (String raw : rawArgs) {
            args.add(decode(raw));
        }
        KernelConfiguration configuration = KernelConfigLoader.load(config);
        try (AgentKernel kernel = AgentKernel.withoutScorer(configuration)) {
            ExecutionResult result;
            Map<String, Object> report = new LinkedHashMap<>();
            if (artifactId != null) {
                kernel.ledger().createPrincipal(artifactId, fund);
                result = kernel.executor().executeWithWallet(code, args, artifactId, kernel.ledger());
                report.put("result", result.toSerializableMap());
                report.put("balances", kernel.ledger().getAllScrip());
            } else {
                result = kernel.executor().execute(code, args);
                report.put("result", result.toSerializableMap());
            }
            spec.commandLine().getOut().println(output.render(report));
            return result.success() ? 0 : 1;
        }
    }

    private static Object decode(String raw) {
        try {
            return JSON.readValue(raw, Object.class);
        } catch (JsonProcessingException ex) {
            return raw;
        }
    }
}
