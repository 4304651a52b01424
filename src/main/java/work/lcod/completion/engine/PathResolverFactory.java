package work.lcod.completion.engine;

import work.lcod.completion.process.Process;

/**
 * Provides the path resolver used for a given process.
 */
@FunctionalInterface
public interface PathResolverFactory {
    PathResolver getPathResolver(Process process);
}
