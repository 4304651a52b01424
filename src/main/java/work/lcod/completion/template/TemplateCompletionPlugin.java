package work.lcod.completion.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import work.lcod.completion.config.CompletionConfig;
import work.lcod.completion.runtime.Category;
import work.lcod.completion.runtime.CompletionPlugin;
import work.lcod.completion.runtime.ResolverRegistry;

/**
 * Template path scheme. Reads the {@code templates} and {@code template_attributes} sections and registers the
 * {@code template} schema, one attribute-set factory per templated process and the {@code template} path resolver.
 */
public final class TemplateCompletionPlugin implements CompletionPlugin {
    public static final String ID = "template";
    static final String TEMPLATES_SECTION = "templates";
    static final String ATTRIBUTES_SECTION = "template_attributes";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public void install(ResolverRegistry registry, CompletionConfig config) {
        var templates = readTemplates(config.section(TEMPLATES_SECTION));
        var schema = TemplateSchema.from(config.section(ATTRIBUTES_SECTION), templates);
        registry.register(Category.SCHEMA, ID, schema);
        templates.forEach((processName, byParameter) -> {
            var used = new LinkedHashSet<String>();
            byParameter.values().forEach(template -> used.addAll(template.placeholders()));
            used.removeAll(TemplatePathResolver.BUILTINS);
            registry.register(Category.PROCESS_ATTRIBUTES, processName, new TemplateAttributeSetFactory(schema, used));
        });
        var resolver = new TemplatePathResolver(templates);
        registry.register(Category.PATH_COMPLETION, ID, process -> resolver);
    }

    static Map<String, Map<String, PathTemplate>> readTemplates(Map<String, Object> section) {
        var result = new LinkedHashMap<String, Map<String, PathTemplate>>();
        section.forEach((processName, value) -> {
            if (!(value instanceof Map<?, ?> byParameter)) {
                throw new IllegalArgumentException("templates." + processName + " must be a table of parameter templates");
            }
            var templates = new LinkedHashMap<String, PathTemplate>();
            byParameter.forEach((parameter, pattern) -> {
                if (!(pattern instanceof String str)) {
                    throw new IllegalArgumentException("templates." + processName + "." + parameter + " must be a string");
                }
                templates.put(String.valueOf(parameter), new PathTemplate(str));
            });
            result.put(processName, Collections.unmodifiableMap(templates));
        });
        return Collections.unmodifiableMap(result);
    }
}
