package work.lcod.completion.runtime;

import work.lcod.completion.config.CompletionConfig;

/**
 * SPI for completion schemes. Implementations are discovered via {@link java.util.ServiceLoader}
 * (META-INF/services/work.lcod.completion.runtime.CompletionPlugin) and install their schemas and factories
 * into the registry of every new context.
 */
public interface CompletionPlugin {
    String id();

    void install(ResolverRegistry registry, CompletionConfig config);

    default boolean isEnabled(CompletionConfig config) {
        return true;
    }
}
