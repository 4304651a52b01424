package work.lcod.completion.engine;

import work.lcod.completion.attributes.AttributeSet;
import work.lcod.completion.process.Process;

/**
 * Resolves nothing.
 */
public final class NullPathResolver implements PathResolver {
    public static final String ID = "null";

    @Override
    public Object attributesToPath(Process process, String parameter, AttributeSet attributes) {
        return null;
    }
}
