package work.lcod.completion.engine;

import java.util.Objects;

/**
 * A failure tolerated during completion. {@code parameter} is only set for {@link Kind#PARAMETER_RESOLUTION}.
 */
public record CompletionIssue(Kind kind, String context, String parameter, RuntimeException cause) {
    public enum Kind {
        CHILD_CONSTRUCTION,
        CHILD_COMPLETION,
        PARAMETER_RESOLUTION
    }

    public CompletionIssue {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(context, "context");
    }

    public String message() {
        var text = cause == null ? null : cause.getMessage();
        return text == null || text.isBlank() ? (cause == null ? kind.name() : cause.getClass().getSimpleName()) : text;
    }

    @Override
    public String toString() {
        var target = parameter == null ? context : context + "." + parameter;
        return kind + " " + target + ": " + message();
    }
}
