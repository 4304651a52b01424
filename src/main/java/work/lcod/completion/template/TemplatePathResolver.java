package work.lcod.completion.template;

import java.util.Map;
import java.util.Set;
import work.lcod.completion.attributes.AttributeSet;
import work.lcod.completion.engine.PathResolver;
import work.lcod.completion.process.Process;

/**
 * Resolves parameters from per-process templates. Templates are looked up by contextual name, then process name.
 */
public final class TemplatePathResolver implements PathResolver {
    static final Set<String> BUILTINS = Set.of("process", "parameter");

    private final Map<String, Map<String, PathTemplate>> templates;

    public TemplatePathResolver(Map<String, Map<String, PathTemplate>> templates) {
        this.templates = templates == null ? Map.of() : templates;
    }

    @Override
    public Object attributesToPath(Process process, String parameter, AttributeSet attributes) {
        var template = find(process, parameter);
        if (template == null) {
            return null;
        }
        return template.render(placeholder -> {
            if ("process".equals(placeholder)) return process.name();
            if ("parameter".equals(placeholder)) return parameter;
            if (!attributes.has(placeholder)) {
                throw new IllegalArgumentException(
                    "Template of " + process.name() + "." + parameter + " uses undeclared attribute " + placeholder
                );
            }
            return attributes.get(placeholder);
        });
    }

    private PathTemplate find(Process process, String parameter) {
        if (process.contextName() != null) {
            var byContext = templates.get(process.contextName());
            if (byContext != null && byContext.containsKey(parameter)) {
                return byContext.get(parameter);
            }
        }
        var byName = templates.get(process.name());
        return byName == null ? null : byName.get(parameter);
    }
}
