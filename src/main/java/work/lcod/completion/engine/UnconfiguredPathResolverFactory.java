package work.lcod.completion.engine;

import work.lcod.completion.process.Process;

/**
 * Fallback used when no path completion is configured. Asking it for a resolver is a configuration error.
 */
public final class UnconfiguredPathResolverFactory implements PathResolverFactory {
    public static final UnconfiguredPathResolverFactory INSTANCE = new UnconfiguredPathResolverFactory();

    private UnconfiguredPathResolverFactory() {}

    @Override
    public PathResolver getPathResolver(Process process) {
        throw new CompletionMisuseException(
            "No path completion configured for process " + process.name()
                + "; register a PathResolverFactory and select it with path_completion"
        );
    }
}
