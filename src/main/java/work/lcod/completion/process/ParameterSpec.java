package work.lcod.completion.process;

import java.util.Objects;

/**
 * Declarative description of one process parameter.
 */
public record ParameterSpec(String name, ParameterKind kind, boolean output, boolean optional, String description) {
    public ParameterSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        if (name.isBlank() || name.contains(".")) {
            throw new IllegalArgumentException("Invalid parameter name: '" + name + "'");
        }
        description = description == null ? "" : description;
    }

    public static ParameterSpec value(String name) {
        return new ParameterSpec(name, ParameterKind.VALUE, false, false, "");
    }

    public static ParameterSpec inputFile(String name) {
        return new ParameterSpec(name, ParameterKind.FILE, false, false, "");
    }

    public static ParameterSpec outputFile(String name) {
        return new ParameterSpec(name, ParameterKind.FILE, true, false, "");
    }

    public ParameterSpec withDescription(String text) {
        return new ParameterSpec(name, kind, output, optional, text);
    }

    public ParameterSpec asOptional() {
        return new ParameterSpec(name, kind, output, true, description);
    }
}
