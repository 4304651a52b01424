package work.lcod.completion.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable completion configuration: which attribute schemas, engine factory and path resolver factory are in use,
 * plus free-form sections read by completion plugins.
 */
public record CompletionConfig(
    boolean attributesEnabled,
    String processCompletion,
    String pathCompletion,
    Map<String, String> attributesSchemas,
    Map<String, Map<String, Object>> sections
) {
    public static final String DEFAULT_PROCESS_COMPLETION = "builtin";

    public CompletionConfig {
        Objects.requireNonNull(processCompletion, "processCompletion");
        attributesSchemas = attributesSchemas == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributesSchemas));
        sections = sections == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sections));
    }

    public static CompletionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Object> section(String name) {
        var section = sections.get(name);
        return section == null ? Map.of() : section;
    }

    public Builder toBuilder() {
        var builder = new Builder()
            .attributesEnabled(attributesEnabled)
            .processCompletion(processCompletion)
            .pathCompletion(pathCompletion);
        attributesSchemas.forEach(builder::schema);
        sections.forEach(builder::section);
        return builder;
    }

    public static final class Builder {
        private boolean attributesEnabled;
        private String processCompletion = DEFAULT_PROCESS_COMPLETION;
        private String pathCompletion;
        private final Map<String, String> attributesSchemas = new LinkedHashMap<>();
        private final Map<String, Map<String, Object>> sections = new LinkedHashMap<>();

        public Builder attributesEnabled(boolean attributesEnabled) {
            this.attributesEnabled = attributesEnabled;
            return this;
        }

        public Builder processCompletion(String processCompletion) {
            this.processCompletion = processCompletion == null ? DEFAULT_PROCESS_COMPLETION : processCompletion;
            return this;
        }

        public Builder pathCompletion(String pathCompletion) {
            this.pathCompletion = pathCompletion;
            return this;
        }

        public Builder schema(String directory, String schemaName) {
            attributesSchemas.put(directory, schemaName);
            return this;
        }

        public Builder section(String name, Map<String, Object> content) {
            sections.put(name, content == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(content)));
            return this;
        }

        public CompletionConfig build() {
            return new CompletionConfig(attributesEnabled, processCompletion, pathCompletion, attributesSchemas, sections);
        }
    }
}
