package work.lcod.completion.runtime;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores schemas, attribute-set factories and completion factories by category and name.
 */
public final class ResolverRegistry {
    private final Map<String, Map<String, Entry>> entries = new ConcurrentHashMap<>();

    public <T> ResolverRegistry register(Category<T> category, String key, T implementation) {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(implementation, "implementation");
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Registry key must be non-blank");
        }
        entries.computeIfAbsent(category.name(), k -> new ConcurrentHashMap<>())
            .put(key, new Entry(category.name(), key, implementation));
        return this;
    }

    /**
     * @throws ImplementationNotFoundException when nothing is registered under {@code key}
     */
    public <T> T get(Category<T> category, String key) {
        return find(category, key).orElseThrow(() -> new ImplementationNotFoundException(category.name(), key));
    }

    public <T> Optional<T> find(Category<T> category, String key) {
        if (key == null) {
            return Optional.empty();
        }
        var byKey = entries.get(category.name());
        var entry = byKey == null ? null : byKey.get(key);
        return entry == null ? Optional.empty() : Optional.of(category.type().cast(entry.implementation()));
    }

    public void unregister(Category<?> category, String key) {
        var byKey = entries.get(category.name());
        if (byKey != null && key != null) {
            byKey.remove(key);
        }
    }

    public Map<String, Entry> entries(Category<?> category) {
        var byKey = entries.get(category.name());
        return byKey == null ? Map.of() : Collections.unmodifiableMap(byKey);
    }

    public record Entry(String category, String key, Object implementation) {}
}
