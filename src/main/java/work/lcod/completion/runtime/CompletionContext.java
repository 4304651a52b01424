package work.lcod.completion.runtime;

import java.util.Objects;
import work.lcod.completion.config.CompletionConfig;

/**
 * Context shared by the processes of one study: configuration, registry and engine attachments.
 */
public final class CompletionContext {
    private final CompletionConfig config;
    private final ResolverRegistry registry;
    private final EngineAttachments engines = new EngineAttachments();

    public CompletionContext(CompletionConfig config, ResolverRegistry registry) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public static CompletionContext create(CompletionConfig config) {
        return new CompletionContext(config, Registries.create(config));
    }

    public CompletionConfig config() {
        return config;
    }

    public ResolverRegistry registry() {
        return registry;
    }

    public EngineAttachments engines() {
        return engines;
    }
}
