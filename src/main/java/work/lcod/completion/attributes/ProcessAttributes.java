package work.lcod.completion.attributes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.completion.process.Process;

/**
 * Attribute set bound to a process, together with the schemas configured for it (keyed by directory name).
 * The generic implementation declares nothing by itself.
 */
public class ProcessAttributes extends AttributeSet {
    private final Process process;
    private final Map<String, AttributeSchema> schemas;

    public ProcessAttributes(Process process, Map<String, AttributeSchema> schemas) {
        this.process = Objects.requireNonNull(process, "process");
        this.schemas = schemas == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
    }

    public Process process() {
        return process;
    }

    public Map<String, AttributeSchema> schemas() {
        return schemas;
    }
}
