package work.lcod.completion.process;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import work.lcod.completion.runtime.CompletionContext;

/**
 * Base process holding declared parameters and their current values.
 */
public abstract class AbstractProcess implements Process {
    private final String name;
    private final CompletionContext context;
    private final Map<String, ParameterSpec> specs = new LinkedHashMap<>();
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final List<ParameterListener> listeners = new CopyOnWriteArrayList<>();
    private String contextName;
    private String description = "";

    protected AbstractProcess(String name, CompletionContext context) {
        this.name = Objects.requireNonNull(name, "name");
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String contextName() {
        return contextName;
    }

    @Override
    public void setContextName(String contextName) {
        this.contextName = contextName;
    }

    @Override
    public String description() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description == null ? "" : description;
    }

    @Override
    public CompletionContext completionContext() {
        return context;
    }

    public AbstractProcess declare(ParameterSpec spec) {
        Objects.requireNonNull(spec, "spec");
        if (specs.containsKey(spec.name())) {
            throw new IllegalArgumentException("Parameter already declared on " + name + ": " + spec.name());
        }
        specs.put(spec.name(), spec);
        return this;
    }

    @Override
    public List<ParameterSpec> parameters() {
        return List.copyOf(specs.values());
    }

    @Override
    public Object getParameter(String parameter) {
        requireSpec(parameter);
        return values.get(parameter);
    }

    /**
     * Sets a parameter value. {@code null} unsets the parameter; path parameters only accept strings or paths.
     */
    @Override
    public void setParameter(String parameter, Object value) {
        var spec = requireSpec(parameter);
        var normalized = normalize(spec, value);
        var old = values.get(parameter);
        if (normalized == null) {
            values.remove(parameter);
        } else {
            values.put(parameter, normalized);
        }
        if (!Objects.equals(old, normalized)) {
            for (var listener : new ArrayList<>(listeners)) {
                listener.parameterChanged(this, parameter, old, normalized);
            }
        }
    }

    @Override
    public void addParameterListener(ParameterListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeParameterListener(ParameterListener listener) {
        listeners.remove(listener);
    }

    private ParameterSpec requireSpec(String parameter) {
        var spec = specs.get(parameter);
        if (spec == null) {
            throw new IllegalArgumentException("Unknown parameter '" + parameter + "' on process " + name);
        }
        return spec;
    }

    private Object normalize(ParameterSpec spec, Object value) {
        if (value == null || !spec.kind().isPath()) {
            return value;
        }
        if (value instanceof Path path) {
            return path.toString();
        }
        if (value instanceof String str) {
            return str.isEmpty() ? null : str;
        }
        throw new IllegalArgumentException(
            "Parameter '" + spec.name() + "' on " + name + " expects a path but got " + value.getClass().getSimpleName()
        );
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + (contextName == null ? name : contextName) + "]";
    }
}
