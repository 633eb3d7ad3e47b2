package work.ecology.kernel.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import picocli.CommandLine;

/**
 * {@code --format} handling shared by every subcommand.
 */
final class OutputOptions {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    enum Format { JSON, YAML }

    @CommandLine.Option(
        names = "--format",
        description = "Output format (${COMPLETION-CANDIDATES}).",
        defaultValue = "json"
    )
    Format format = Format.JSON;

    String render(Object value) throws JsonProcessingException {
        return switch (format) {
            case JSON -> JSON_WRITER.writeValueAsString(value);
            case YAML -> YAML_MAPPER.writeValueAsString(value);
        };
    }
}
