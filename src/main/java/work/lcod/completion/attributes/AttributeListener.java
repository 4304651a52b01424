package work.lcod.completion.attributes;

/**
 * Receives attribute declarations and value changes from an {@link AttributeSet}.
 */
@FunctionalInterface
public interface AttributeListener {
    void attributeChanged(AttributeChange change);
}
