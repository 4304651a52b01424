package work.lcod.completion.engine;

import work.lcod.completion.process.Process;

/**
 * Provides the completion engine of a process, in the context of a contextual name.
 */
@FunctionalInterface
public interface CompletionEngineFactory {
    CompletionEngine getCompletionEngine(Process process, String name);
}
