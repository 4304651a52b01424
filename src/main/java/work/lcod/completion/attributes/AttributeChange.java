package work.lcod.completion.attributes;

/**
 * Notification emitted by an {@link AttributeSet}. {@link Kind#DECLARED} events describe the structure of the set,
 * {@link Kind#VALUE} events an actual value change.
 */
public record AttributeChange(AttributeSet source, Kind kind, String name, Object oldValue, Object newValue) {
    public enum Kind {
        DECLARED,
        VALUE
    }

    public boolean isStructural() {
        return kind == Kind.DECLARED;
    }
}
