package work.lcod.completion.process;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Dependency graph of the direct children of one pipeline. An edge {@code a -> b} means that a parameter of
 * {@code b} is fed by a parameter of {@code a}.
 */
public final class PipelineGraph {
    private final String pipeline;
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, Set<String>> successors = new LinkedHashMap<>();
    private final Map<String, Set<String>> predecessors = new LinkedHashMap<>();

    public PipelineGraph(String pipeline, List<Node> nodes, List<Link> links) {
        this.pipeline = pipeline;
        for (var node : nodes) {
            this.nodes.put(node.name(), node);
            successors.put(node.name(), new LinkedHashSet<>());
            predecessors.put(node.name(), new LinkedHashSet<>());
        }
        for (var link : links) {
            if (!link.isInternal()) continue;
            requireNode(link.sourceNode());
            requireNode(link.targetNode());
            successors.get(link.sourceNode()).add(link.targetNode());
            predecessors.get(link.targetNode()).add(link.sourceNode());
        }
    }

    public String pipeline() {
        return pipeline;
    }

    public List<Node> nodes() {
        return List.copyOf(nodes.values());
    }

    public Set<String> successors(String node) {
        requireNode(node);
        return Collections.unmodifiableSet(successors.get(node));
    }

    public Set<String> predecessors(String node) {
        requireNode(node);
        return Collections.unmodifiableSet(predecessors.get(node));
    }

    /**
     * Producers before consumers; independent nodes keep their declaration order.
     *
     * @throws CyclicGraphException when the dependencies form a cycle
     */
    public List<Node> topologicalOrder() {
        var index = new LinkedHashMap<String, Integer>();
        var names = new ArrayList<>(nodes.keySet());
        for (int i = 0; i < names.size(); i++) {
            index.put(names.get(i), i);
        }
        var remaining = new LinkedHashMap<String, Integer>();
        var ready = new TreeSet<Integer>();
        for (var name : names) {
            int degree = predecessors.get(name).size();
            remaining.put(name, degree);
            if (degree == 0) {
                ready.add(index.get(name));
            }
        }
        var order = new ArrayList<Node>(names.size());
        while (!ready.isEmpty()) {
            var name = names.get(ready.pollFirst());
            order.add(nodes.get(name));
            for (var next : successors.get(name)) {
                int degree = remaining.merge(next, -1, Integer::sum);
                if (degree == 0) {
                    ready.add(index.get(next));
                }
            }
        }
        if (order.size() != names.size()) {
            var blocked = new ArrayList<String>();
            remaining.forEach((name, degree) -> {
                if (degree > 0) blocked.add(name);
            });
            throw new CyclicGraphException(pipeline, blocked);
        }
        return order;
    }

    private void requireNode(String node) {
        if (!nodes.containsKey(node)) {
            throw new IllegalArgumentException("Unknown node '" + node + "' in pipeline " + pipeline);
        }
    }
}
