package work.lcod.completion.process;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.completion.runtime.CompletionContext;

/**
 * Process made of named child nodes connected by parameter links. Link targets follow their source values.
 */
public class Pipeline extends AbstractProcess {
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final List<Link> links = new ArrayList<>();

    public Pipeline(String name, CompletionContext context) {
        super(name, context);
    }

    public Node add(String nodeName, Process process) {
        Objects.requireNonNull(process, "process");
        if (nodeName == null || nodeName.isBlank() || nodeName.contains(".")) {
            throw new IllegalArgumentException("Invalid node name: '" + nodeName + "'");
        }
        if (nodes.containsKey(nodeName)) {
            throw new IllegalArgumentException("Node already present in " + name() + ": " + nodeName);
        }
        if (process == this) {
            throw new IllegalArgumentException("Pipeline " + name() + " cannot contain itself");
        }
        var node = Node.of(nodeName, process);
        nodes.put(nodeName, node);
        process.setContextName(qualify(nodeName));
        return node;
    }

    public Map<String, Node> nodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public Node node(String nodeName) {
        var node = nodes.get(nodeName);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node '" + nodeName + "' in pipeline " + name());
        }
        return node;
    }

    public List<Link> links() {
        return Collections.unmodifiableList(links);
    }

    public Link link(String source, String target) {
        return link(Link.parse(source, target));
    }

    /**
     * Connects two parameters; the target receives the current source value and every later change.
     */
    public Link link(Link link) {
        var source = endpoint(link.sourceNode());
        var target = endpoint(link.targetNode());
        requireParameter(source, link.sourceParameter());
        requireParameter(target, link.targetParameter());
        links.add(link);
        source.addParameterListener((process, parameter, oldValue, newValue) -> {
            if (parameter.equals(link.sourceParameter())) {
                target.setParameter(link.targetParameter(), newValue);
            }
        });
        var current = source.getParameter(link.sourceParameter());
        if (current != null) {
            target.setParameter(link.targetParameter(), current);
        }
        return link;
    }

    public PipelineGraph workflowGraph() {
        var internal = links.stream().filter(Link::isInternal).toList();
        return new PipelineGraph(name(), new ArrayList<>(nodes.values()), internal);
    }

    @Override
    public void setContextName(String contextName) {
        super.setContextName(contextName);
        for (var entry : nodes.entrySet()) {
            entry.getValue().process().setContextName(qualify(entry.getKey()));
        }
    }

    private String qualify(String nodeName) {
        var prefix = contextName() == null ? name() : contextName();
        return prefix + "." + nodeName;
    }

    private Process endpoint(String nodeName) {
        return nodeName.isEmpty() ? this : node(nodeName).process();
    }

    private static void requireParameter(Process process, String parameter) {
        if (process.parameter(parameter).isEmpty()) {
            throw new IllegalArgumentException("Unknown parameter '" + parameter + "' on process " + process.name());
        }
    }
}
