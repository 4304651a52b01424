package work.lcod.completion.process;

import java.util.Locale;

/**
 * Kind of value a parameter carries. Path kinds are the usual completion targets.
 */
public enum ParameterKind {
    VALUE,
    FILE,
    DIRECTORY;

    public boolean isPath() {
        return this != VALUE;
    }

    public static ParameterKind from(String value) {
        if (value == null || value.isBlank()) {
            return VALUE;
        }
        try {
            return ParameterKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported parameter kind: " + value);
        }
    }
}
