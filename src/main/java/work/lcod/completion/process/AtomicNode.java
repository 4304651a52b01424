package work.lcod.completion.process;

import java.util.Objects;

public record AtomicNode(String name, Process process) implements Node {
    public AtomicNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(process, "process");
    }
}
