package work.lcod.completion.process;

/**
 * One step of a pipeline: either an {@link AtomicNode} or a {@link SubPipelineNode}.
 */
public interface Node {
    String name();

    Process process();

    static Node of(String name, Process process) {
        if (process instanceof Pipeline pipeline) {
            return new SubPipelineNode(name, pipeline);
        }
        return new AtomicNode(name, process);
    }
}
