package work.lcod.completion.runtime;

import java.util.Objects;
import work.lcod.completion.attributes.AttributeSchema;
import work.lcod.completion.attributes.AttributeSetFactory;
import work.lcod.completion.engine.CompletionEngineFactory;
import work.lcod.completion.engine.PathResolverFactory;

/**
 * Typed registry category.
 */
public record Category<T>(String name, Class<T> type) {
    public static final Category<AttributeSchema> SCHEMA = new Category<>("schema", AttributeSchema.class);
    public static final Category<AttributeSetFactory> PROCESS_ATTRIBUTES =
        new Category<>("process_attributes", AttributeSetFactory.class);
    public static final Category<CompletionEngineFactory> PROCESS_COMPLETION =
        new Category<>("process_completion", CompletionEngineFactory.class);
    public static final Category<PathResolverFactory> PATH_COMPLETION =
        new Category<>("path_completion", PathResolverFactory.class);

    public Category {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    @Override
    public String toString() {
        return name;
    }
}
