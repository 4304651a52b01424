package work.lcod.completion.attributes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered, growable set of named attributes. Names must be declared before they can hold a value; a declared name
 * keeps its type for the lifetime of the set.
 */
public class AttributeSet {
    private final Map<String, AttributeDefinition> definitions = new LinkedHashMap<>();
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final List<AttributeListener> listeners = new CopyOnWriteArrayList<>();

    public AttributeSet declare(String name, Class<?> type, Object defaultValue) {
        return declare(new AttributeDefinition(name, type, defaultValue, List.of()));
    }

    public AttributeSet declare(AttributeDefinition definition) {
        return declare(definition, definition.defaultValue());
    }

    /**
     * Declares {@code definition} with an initial value. Re-declaring an existing name with the same type keeps the
     * current value; a different type is rejected.
     */
    public AttributeSet declare(AttributeDefinition definition, Object initialValue) {
        Objects.requireNonNull(definition, "definition");
        var existing = definitions.get(definition.name());
        if (existing != null) {
            if (!existing.type().equals(definition.type())) {
                throw new IllegalArgumentException(
                    "Attribute '" + definition.name() + "' is already declared as " + existing.type().getSimpleName()
                );
            }
            return this;
        }
        definition.validate(initialValue);
        definitions.put(definition.name(), definition);
        values.put(definition.name(), initialValue);
        fire(AttributeChange.Kind.DECLARED, definition.name(), null, initialValue);
        return this;
    }

    public boolean has(String name) {
        return definitions.containsKey(name);
    }

    public Optional<AttributeDefinition> definition(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(definitions.keySet());
    }

    public Map<String, AttributeDefinition> definitions() {
        return Collections.unmodifiableMap(definitions);
    }

    public int size() {
        return definitions.size();
    }

    public Object get(String name) {
        requireDeclared(name);
        return values.get(name);
    }

    public void set(String name, Object value) {
        var definition = requireDeclared(name);
        definition.validate(value);
        var old = values.get(name);
        values.put(name, value);
        if (!Objects.equals(old, value)) {
            fire(AttributeChange.Kind.VALUE, name, old, value);
        }
    }

    /**
     * Plain key/value snapshot, in declaration order.
     */
    public Map<String, Object> exportToMap() {
        return new LinkedHashMap<>(values);
    }

    /**
     * Assigns every entry of {@code source}. All keys must already be declared.
     */
    public void importFromMap(Map<String, ?> source) {
        if (source == null) {
            return;
        }
        for (var entry : source.entrySet()) {
            set(entry.getKey(), entry.getValue());
        }
    }

    public void addListener(AttributeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(AttributeListener listener) {
        listeners.remove(listener);
    }

    private AttributeDefinition requireDeclared(String name) {
        var definition = definitions.get(name);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown attribute: " + name);
        }
        return definition;
    }

    private void fire(AttributeChange.Kind kind, String name, Object old, Object value) {
        if (listeners.isEmpty()) return;
        var change = new AttributeChange(this, kind, name, old, value);
        for (var listener : listeners) {
            listener.attributeChanged(change);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + values;
    }
}
