package work.lcod.completion.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.completion.attributes.AttributeSet;
import work.lcod.completion.config.CompletionConfig;
import work.lcod.completion.config.CompletionConfigLoader;
import work.lcod.completion.engine.CompletionEngine;
import work.lcod.completion.engine.CompletionIssue;
import work.lcod.completion.engine.CompletionReport;
import work.lcod.completion.process.Pipeline;
import work.lcod.completion.process.Process;
import work.lcod.completion.runtime.CompletionContext;
import work.lcod.completion.runtime.PipelineLoader;

/**
 * Public entry point for embedding parameter completion: loads a pipeline and its configuration, completes it and
 * reports the parameters of every node.
 */
public final class CompletionRunner {
    /** Key of the attribute object inside the JSON input payload. */
    public static final String ATTRIBUTES_FIELD = "attributes";

    private static final Logger log = LoggerFactory.getLogger(CompletionRunner.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    public RunResult run(CompletionRunConfiguration configuration) {
        var started = Instant.now();
        try {
            var config = configuration.configPath()
                .map(CompletionConfigLoader::load)
                .orElseGet(CompletionConfig::defaults);
            var context = CompletionContext.create(config);
            var pipeline = PipelineLoader.loadFromLocalFile(configuration.pipelinePath(), context);
            var engine = CompletionEngine.forProcess(pipeline, null);
            var inputs = buildInputs(configuration, engine.getAttributeValues());

            var report = engine.completeParameters(inputs);
            log.info("Completed pipeline {} with {} issue(s)", pipeline.name(), report.issues().size());

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("pipeline", configuration.pipelinePath().toString());
            metadata.put("attributes", engine.getAttributeValues().exportToMap());
            metadata.put("parameters", collectParameters(pipeline));
            metadata.put("issues", describeIssues(report));
            return RunResult.completed(report, metadata, started);
        } catch (Exception ex) {
            log.debug("Completion run failed", ex);
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("pipeline", configuration.pipelinePath().toString());
            if (ex.getMessage() != null && !ex.getMessage().isBlank()) {
                errorMeta.put("error", ex.getMessage());
            }
            return RunResult.failure(ex.getMessage(), errorMeta, started);
        }
    }

    public RunResult runToJson(CompletionRunConfiguration configuration) {
        var result = run(configuration);
        try {
            return result.withSerializedPayload(result.toPrettyJson());
        } catch (IllegalStateException ex) {
            return RunResult.failure(ex.getMessage(), Map.of(), result.startedAt());
        }
    }

    /**
     * Parameters of {@code process} and of all its descendants, keyed by dotted node path.
     */
    public static Map<String, Map<String, Object>> collectParameters(Process process) {
        var result = new LinkedHashMap<String, Map<String, Object>>();
        collect(process, process.name(), result);
        return result;
    }

    private static void collect(Process process, String key, Map<String, Map<String, Object>> out) {
        out.put(key, process.exportParameters());
        if (process instanceof Pipeline pipeline) {
            for (var entry : pipeline.nodes().entrySet()) {
                collect(entry.getValue().process(), key + "." + entry.getKey(), out);
            }
        }
    }

    /**
     * JSON numbers and booleans given for string attributes are passed as their text, so {@code {"subject": 1}} reads
     * as subject {@code "1"}. Other values are passed as parsed.
     */
    private Map<String, Object> buildInputs(CompletionRunConfiguration configuration, AttributeSet declared) {
        var inputs = parsePayload(configuration.inputPayload());
        var attributes = new LinkedHashMap<String, Object>();
        var given = inputs.remove(ATTRIBUTES_FIELD);
        if (given instanceof Map<?, ?> map) {
            map.forEach((key, value) -> {
                var name = String.valueOf(key);
                attributes.put(name, coerce(declared, name, value));
            });
        } else if (given != null) {
            throw new IllegalArgumentException("'" + ATTRIBUTES_FIELD + "' must be a JSON object");
        }
        attributes.putAll(configuration.attributes());
        if (!attributes.isEmpty()) {
            inputs.put(CompletionEngine.ATTRIBUTES_KEY, attributes);
        }
        return inputs;
    }

    private static Object coerce(AttributeSet declared, String name, Object value) {
        if (!(value instanceof Number || value instanceof Boolean)) {
            return value;
        }
        var expectsText = declared.definition(name).map(def -> def.type() == String.class).orElse(false);
        return expectsText ? String.valueOf(value) : value;
    }

    private Map<String, Object> parsePayload(String payload) {
        if (payload == null || payload.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            var parsed = JSON.readValue(payload, MAP_REF);
            return parsed == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parsed);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid JSON input payload", ex);
        }
    }

    private static List<Map<String, Object>> describeIssues(CompletionReport report) {
        var issues = new ArrayList<Map<String, Object>>();
        for (CompletionIssue issue : report.issues()) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("kind", issue.kind().name());
            entry.put("context", issue.context());
            if (issue.parameter() != null) {
                entry.put("parameter", issue.parameter());
            }
            entry.put("message", issue.message());
            issues.add(entry);
        }
        return issues;
    }
}
