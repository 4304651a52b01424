package work.lcod.completion.runtime;

import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.completion.config.CompletionConfig;
import work.lcod.completion.engine.BuiltinCompletionEngineFactory;
import work.lcod.completion.engine.NullPathResolver;

/**
 * Shared registry bootstrap so the CLI, the runner and tests use the same builtin set.
 */
public final class Registries {
    private static final Logger log = LoggerFactory.getLogger(Registries.class);

    public static final String BUILTIN_ENGINE = BuiltinCompletionEngineFactory.ID;
    public static final String NULL_PATH_RESOLVER = NullPathResolver.ID;

    private Registries() {}

    public static ResolverRegistry builtins() {
        var registry = new ResolverRegistry();
        registry.register(Category.PROCESS_COMPLETION, BUILTIN_ENGINE, new BuiltinCompletionEngineFactory());
        registry.register(Category.PATH_COMPLETION, NULL_PATH_RESOLVER, process -> new NullPathResolver());
        return registry;
    }

    public static ResolverRegistry create(CompletionConfig config) {
        var registry = builtins();
        for (var plugin : ServiceLoader.load(CompletionPlugin.class)) {
            if (!plugin.isEnabled(config)) {
                log.debug("Skipping disabled completion plugin {}", plugin.id());
                continue;
            }
            plugin.install(registry, config);
            log.debug("Installed completion plugin {}", plugin.id());
        }
        return registry;
    }
}
