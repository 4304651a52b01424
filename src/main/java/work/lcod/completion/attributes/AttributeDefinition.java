package work.lcod.completion.attributes;

import java.util.List;
import java.util.Objects;

/**
 * Declared shape of one attribute: its name, value type, default value and, for enumerations, the allowed values.
 */
public record AttributeDefinition(String name, Class<?> type, Object defaultValue, List<Object> allowedValues) {
    public AttributeDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Attribute name must be non-blank");
        }
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
        if (defaultValue != null) {
            checkValue(name, type, allowedValues, defaultValue);
        }
    }

    public static AttributeDefinition string(String name, String defaultValue) {
        return new AttributeDefinition(name, String.class, defaultValue, List.of());
    }

    public static AttributeDefinition choice(String name, String defaultValue, String... values) {
        return new AttributeDefinition(name, String.class, defaultValue, List.of((Object[]) values));
    }

    public boolean isEnumeration() {
        return !allowedValues.isEmpty();
    }

    /**
     * Fails with {@link IllegalArgumentException} when {@code value} does not fit this definition. {@code null} always fits.
     */
    public void validate(Object value) {
        if (value != null) {
            checkValue(name, type, allowedValues, value);
        }
    }

    private static void checkValue(String name, Class<?> type, List<Object> allowed, Object value) {
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(
                "Attribute '" + name + "' expects " + type.getSimpleName() + " but got " + value.getClass().getSimpleName()
            );
        }
        if (!allowed.isEmpty() && !allowed.contains(value)) {
            throw new IllegalArgumentException("Attribute '" + name + "' does not accept " + value + " (allowed: " + allowed + ")");
        }
    }
}
