package work.lcod.completion.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import work.lcod.completion.process.AbstractProcess;
import work.lcod.completion.process.DeclaredProcess;
import work.lcod.completion.process.ParameterKind;
import work.lcod.completion.process.ParameterSpec;
import work.lcod.completion.process.Pipeline;

/**
 * Loads pipeline descriptions (YAML) into {@link Pipeline} instances bound to a completion context.
 *
 * <pre>
 * pipeline:
 *   name: preprocessing
 *   parameters: [{name: t1, kind: file}]
 *   nodes:
 *     - {name: denoise, parameters: [{name: input, kind: file}, {name: output, kind: file, output: true}]}
 *     - {name: sub, pipeline: {name: ..., nodes: [...]}}
 *   links:
 *     - {from: t1, to: denoise.input}
 * </pre>
 */
public final class PipelineLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private PipelineLoader() {}

    public static Pipeline loadFromLocalFile(Path path, CompletionContext context) {
        try (var in = Files.newInputStream(path)) {
            return parse(in, context);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read pipeline: " + path, ex);
        }
    }

    public static Pipeline parse(InputStream in, CompletionContext context) throws IOException {
        var root = YAML_MAPPER.readTree(in);
        if (root == null || !root.hasNonNull("pipeline")) {
            throw new IllegalArgumentException("Pipeline description must contain a 'pipeline' entry");
        }
        return buildPipeline(root.get("pipeline"), context);
    }

    private static Pipeline buildPipeline(JsonNode node, CompletionContext context) {
        var pipeline = new Pipeline(requireText(node, "name"), context);
        describe(pipeline, node);
        for (var spec : readParameters(node.get("parameters"))) {
            pipeline.declare(spec);
        }
        var nodes = node.get("nodes");
        if (nodes != null && nodes.isArray()) {
            for (var child : nodes) {
                var nodeName = requireText(child, "name");
                if (child.hasNonNull("pipeline")) {
                    pipeline.add(nodeName, buildPipeline(child.get("pipeline"), context));
                } else {
                    var processName = child.hasNonNull("process") ? child.get("process").asText() : nodeName;
                    var process = new DeclaredProcess(processName, context, readParameters(child.get("parameters")));
                    describe(process, child);
                    pipeline.add(nodeName, process);
                }
            }
        }
        var links = node.get("links");
        if (links != null && links.isArray()) {
            for (var link : links) {
                pipeline.link(requireText(link, "from"), requireText(link, "to"));
            }
        }
        return pipeline;
    }

    private static List<ParameterSpec> readParameters(JsonNode parameters) {
        var specs = new ArrayList<ParameterSpec>();
        if (parameters == null || !parameters.isArray()) {
            return specs;
        }
        for (var parameter : parameters) {
            specs.add(new ParameterSpec(
                requireText(parameter, "name"),
                ParameterKind.from(parameter.path("kind").asText(null)),
                parameter.path("output").asBoolean(false),
                parameter.path("optional").asBoolean(false),
                parameter.path("description").asText("")
            ));
        }
        return specs;
    }

    private static void describe(AbstractProcess process, JsonNode node) {
        if (node.hasNonNull("description")) {
            process.setDescription(node.get("description").asText());
        }
    }

    private static String requireText(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new IllegalArgumentException("Missing '" + field + "' in pipeline description: " + node);
        }
        return value.asText();
    }
}
