package work.lcod.completion.engine;

/**
 * Programming or configuration error. Never tolerated by a completion pass.
 */
public class CompletionMisuseException extends IllegalStateException {
    public CompletionMisuseException(String message) {
        super(message);
    }
}
