package work.lcod.completion.runtime;

/**
 * Registry lookup miss. Callers recover by falling back to a default implementation.
 */
public final class ImplementationNotFoundException extends RuntimeException {
    private final String category;
    private final String key;

    public ImplementationNotFoundException(String category, String key) {
        super("No " + category + " implementation registered for '" + key + "'");
        this.category = category;
        this.key = key;
    }

    public String category() {
        return category;
    }

    public String key() {
        return key;
    }
}
