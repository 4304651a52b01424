package work.lcod.completion.process;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import work.lcod.completion.runtime.CompletionContext;

/**
 * Contract the completion engine needs from an executable unit: identity, named parameters and the completion
 * context it belongs to.
 */
public interface Process {
    String name();

    /**
     * Dotted name reflecting the position in the enclosing pipeline, or {@code null} for a top-level process.
     */
    String contextName();

    void setContextName(String contextName);

    default String description() {
        return "";
    }

    List<ParameterSpec> parameters();

    default Optional<ParameterSpec> parameter(String name) {
        return parameters().stream().filter(spec -> spec.name().equals(name)).findFirst();
    }

    default Set<String> parameterNames() {
        return parameters().stream().map(ParameterSpec::name).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    Object getParameter(String name);

    void setParameter(String name, Object value);

    default void importParameters(Map<String, ?> values) {
        if (values == null) return;
        for (var entry : values.entrySet()) {
            setParameter(entry.getKey(), entry.getValue());
        }
    }

    default Map<String, Object> exportParameters() {
        var result = new LinkedHashMap<String, Object>();
        for (var spec : parameters()) {
            result.put(spec.name(), getParameter(spec.name()));
        }
        return result;
    }

    default Map<String, Object> inputs() {
        var result = new LinkedHashMap<String, Object>();
        for (var spec : parameters()) {
            if (!spec.output()) result.put(spec.name(), getParameter(spec.name()));
        }
        return result;
    }

    default Map<String, Object> outputs() {
        var result = new LinkedHashMap<String, Object>();
        for (var spec : parameters()) {
            if (spec.output()) result.put(spec.name(), getParameter(spec.name()));
        }
        return result;
    }

    void addParameterListener(ParameterListener listener);

    void removeParameterListener(ParameterListener listener);

    CompletionContext completionContext();
}
