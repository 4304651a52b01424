package work.lcod.completion.attributes;

import java.util.Map;
import work.lcod.completion.process.Process;

/**
 * Builds the attribute set of a specific process. Registered by process name (or contextual name).
 */
@FunctionalInterface
public interface AttributeSetFactory {
    ProcessAttributes create(Process process, Map<String, AttributeSchema> schemas);

    /**
     * Whether the attributes of a pipeline's children are still merged into the set built here. By default a
     * specialized set replaces the merge; names it already declares are never overridden by a child.
     */
    default boolean includesChildAttributes() {
        return false;
    }
}
