package work.lcod.completion.api;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of one completion run.
 */
public record CompletionRunConfiguration(
    Path pipelinePath,
    Optional<Path> configPath,
    String inputPayload,
    Map<String, Object> attributes
) {
    public CompletionRunConfiguration {
        Objects.requireNonNull(pipelinePath, "pipelinePath");
        Objects.requireNonNull(configPath, "configPath");
        Objects.requireNonNull(inputPayload, "inputPayload");
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path pipelinePath;
        private Optional<Path> configPath = Optional.empty();
        private String inputPayload = "{}";
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        public Builder pipelinePath(Path pipelinePath) {
            this.pipelinePath = pipelinePath;
            return this;
        }

        public Builder configPath(Path configPath) {
            this.configPath = Optional.ofNullable(configPath);
            return this;
        }

        public Builder inputPayload(String inputPayload) {
            this.inputPayload = inputPayload;
            return this;
        }

        public Builder attribute(String name, Object value) {
            this.attributes.put(name, value);
            return this;
        }

        public Builder attributes(Map<String, ?> values) {
            if (values != null) {
                this.attributes.putAll(values);
            }
            return this;
        }

        public CompletionRunConfiguration build() {
            return new CompletionRunConfiguration(pipelinePath, configPath, inputPayload, attributes);
        }
    }
}
