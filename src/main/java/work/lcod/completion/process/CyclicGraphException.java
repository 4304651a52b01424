package work.lcod.completion.process;

import java.util.List;

/**
 * Raised when the nodes of a pipeline depend on each other in a cycle.
 */
public final class CyclicGraphException extends IllegalStateException {
    private final List<String> nodes;

    public CyclicGraphException(String pipeline, List<String> nodes) {
        super("Pipeline " + pipeline + " contains a dependency cycle between " + nodes);
        this.nodes = List.copyOf(nodes);
    }

    public List<String> nodes() {
        return nodes;
    }
}
