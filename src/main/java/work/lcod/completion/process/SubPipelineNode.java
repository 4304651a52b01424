package work.lcod.completion.process;

import java.util.Objects;

public record SubPipelineNode(String name, Pipeline pipeline) implements Node {
    public SubPipelineNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pipeline, "pipeline");
    }

    @Override
    public Process process() {
        return pipeline;
    }
}
