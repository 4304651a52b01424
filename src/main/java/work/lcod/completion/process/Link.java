package work.lcod.completion.process;

import java.util.Objects;

/**
 * Parameter connection inside a pipeline. An empty node name designates the pipeline itself.
 */
public record Link(String sourceNode, String sourceParameter, String targetNode, String targetParameter) {
    public Link {
        sourceNode = sourceNode == null ? "" : sourceNode;
        targetNode = targetNode == null ? "" : targetNode;
        Objects.requireNonNull(sourceParameter, "sourceParameter");
        Objects.requireNonNull(targetParameter, "targetParameter");
    }

    /**
     * Parses {@code "node.parameter"} / {@code "parameter"} endpoints.
     */
    public static Link parse(String source, String target) {
        var from = split(source);
        var to = split(target);
        return new Link(from[0], from[1], to[0], to[1]);
    }

    public boolean isInternal() {
        return !sourceNode.isEmpty() && !targetNode.isEmpty();
    }

    private static String[] split(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("Link endpoint must be non-blank");
        }
        var trimmed = endpoint.trim();
        int dot = trimmed.lastIndexOf('.');
        if (dot < 0) {
            return new String[] {"", trimmed};
        }
        return new String[] {trimmed.substring(0, dot), trimmed.substring(dot + 1)};
    }

    @Override
    public String toString() {
        return endpoint(sourceNode, sourceParameter) + " -> " + endpoint(targetNode, targetParameter);
    }

    private static String endpoint(String node, String parameter) {
        return node.isEmpty() ? parameter : node + "." + parameter;
    }
}
