package work.lcod.completion.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

import picocli.CommandLine;
import work.lcod.completion.api.CompletionRunConfiguration;
import work.lcod.completion.api.CompletionRunner;
import work.lcod.completion.api.LogLevel;
import work.lcod.completion.api.RunResult;
import work.lcod.completion.config.CompletionConfig;
import work.lcod.completion.config.CompletionConfigLoader;
import work.lcod.completion.process.Pipeline;
import work.lcod.completion.process.Process;
import work.lcod.completion.process.ProcessHelp;
import work.lcod.completion.runtime.CompletionContext;
import work.lcod.completion.runtime.PipelineLoader;

@CommandLine.Command(
    name = "lcod-complete",
    description = "Complete the file parameters of a pipeline from attribute values.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class CompleteCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-p", "--pipeline"},
        required = true,
        description = "Pipeline description (YAML)."
    )
    private Path pipelinePath;

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "Completion configuration (TOML); attributes are disabled without one.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path configPath;

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "PATH|-",
        description = "JSON inputs file; use '-' to read from stdin (default: {}).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String input;

    @CommandLine.Option(
        names = {"-a", "--attribute"},
        paramLabel = "NAME=VALUE",
        description = "Attribute value, overrides the 'attributes' object of the inputs. Repeatable."
    )
    private Map<String, String> attributes = new LinkedHashMap<>();

    @CommandLine.Option(
        names = "--describe",
        description = "Print the parameters of the pipeline and of its nodes instead of completing them."
    )
    private boolean describe;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        resolveLogLevel().applyToSimpleLogger();

        var pipeline = pipelinePath.toAbsolutePath().normalize();
        if (!Files.isRegularFile(pipeline)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Pipeline file not found: " + pipeline);
        }
        var out = spec.commandLine().getOut();
        if (describe) {
            describe(pipeline, out);
            return 0;
        }

        var builder = CompletionRunConfiguration.builder()
            .pipelinePath(pipeline)
            .inputPayload(loadInputPayload())
            .attributes(attributes);
        if (configPath != null) {
            builder.configPath(configPath.toAbsolutePath().normalize());
        }
        RunResult result = new CompletionRunner().run(builder.build());
        out.println(result.toPrettyJson());
        out.flush();
        return result.status().exitCode();
    }

    private void describe(Path pipelinePath, PrintWriter out) {
        var config = configPath != null ? CompletionConfigLoader.load(configPath) : CompletionConfig.defaults();
        var pipeline = PipelineLoader.loadFromLocalFile(pipelinePath, CompletionContext.create(config));
        describe(pipeline, pipeline.name(), out);
        out.flush();
    }

    private void describe(Process process, String title, PrintWriter out) {
        out.println(title);
        out.println("=".repeat(title.length()));
        out.println();
        out.println(ProcessHelp.describe(process));
        out.println();
        if (process instanceof Pipeline pipeline) {
            for (var entry : pipeline.nodes().entrySet()) {
                describe(entry.getValue().process(), title + "." + entry.getKey(), out);
            }
        }
    }

    private String loadInputPayload() {
        if (input == null || input.isBlank()) {
            return "{}";
        }
        String payload;
        if ("-".equals(input)) {
            try {
                payload = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read stdin: " + ex.getMessage());
            }
        } else {
            var path = Paths.get(input).toAbsolutePath().normalize();
            try {
                payload = Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read input file: " + path);
            }
        }
        validateJsonPayload(payload);
        return payload.isBlank() ? "{}" : payload;
    }

    private void validateJsonPayload(String payload) {
        if (payload.isBlank()) {
            return;
        }
        try {
            var node = JSON.readTree(payload);
            if (node != null && !node.isObject()) {
                throw new CommandLine.ParameterException(spec.commandLine(), "JSON payload must be an object");
            }
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid JSON payload: " + ex.getMessage());
        }
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("LCOD_LOG_LEVEL");
        }
        try {
            return LogLevel.from(candidate);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }
}
