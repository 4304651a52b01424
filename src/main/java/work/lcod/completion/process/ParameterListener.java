package work.lcod.completion.process;

/**
 * Called after a parameter value of a process changed.
 */
@FunctionalInterface
public interface ParameterListener {
    void parameterChanged(Process process, String name, Object oldValue, Object newValue);
}
