package work.lcod.completion.process;

import java.util.List;
import work.lcod.completion.runtime.CompletionContext;

/**
 * Atomic process made of declared parameters only (execution is handled elsewhere).
 */
public final class DeclaredProcess extends AbstractProcess {
    public DeclaredProcess(String name, CompletionContext context) {
        super(name, context);
    }

    public DeclaredProcess(String name, CompletionContext context, List<ParameterSpec> parameters) {
        super(name, context);
        if (parameters != null) {
            parameters.forEach(this::declare);
        }
    }
}
