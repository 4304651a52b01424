package work.lcod.completion.runtime;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.completion.engine.CompletionEngine;
import work.lcod.completion.process.Process;

/**
 * Side table attaching completion engines to process instances (by identity). An attachment is permanent.
 */
public final class EngineAttachments {
    private final Map<Process, CompletionEngine> engines = Collections.synchronizedMap(new IdentityHashMap<>());

    public void attach(Process process, CompletionEngine engine) {
        engines.put(Objects.requireNonNull(process, "process"), Objects.requireNonNull(engine, "engine"));
    }

    public Optional<CompletionEngine> find(Process process) {
        return Optional.ofNullable(engines.get(process));
    }

    public int size() {
        return engines.size();
    }
}
