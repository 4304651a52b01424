package work.lcod.completion.engine;

import work.lcod.completion.attributes.AttributeSet;
import work.lcod.completion.process.Process;

/**
 * Builds the value of one process parameter (usually a path) from a set of attributes.
 * Implementations must not modify the attribute set.
 */
@FunctionalInterface
public interface PathResolver {
    /**
     * @return the resolved value, or {@code null} when this parameter is not derived from attributes
     */
    Object attributesToPath(Process process, String parameter, AttributeSet attributes);
}
