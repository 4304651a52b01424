package work.lcod.completion.engine;

import work.lcod.completion.process.Process;

/**
 * Returns the engine already attached to the process, or a new base {@link CompletionEngine}. The base engine
 * delegates to child nodes for pipelines and resolves paths through the configured path resolver.
 */
public final class BuiltinCompletionEngineFactory implements CompletionEngineFactory {
    public static final String ID = "builtin";

    @Override
    public CompletionEngine getCompletionEngine(Process process, String name) {
        return process.completionContext().engines().find(process)
            .orElseGet(() -> new CompletionEngine(process, name));
    }
}
