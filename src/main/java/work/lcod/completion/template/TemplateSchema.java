package work.lcod.completion.template;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.completion.attributes.AttributeDefinition;
import work.lcod.completion.attributes.AttributeSchema;

/**
 * String attributes used by the configured templates, with the defaults of the {@code template_attributes} section.
 */
public final class TemplateSchema implements AttributeSchema {
    private final List<AttributeDefinition> attributes;

    private TemplateSchema(List<AttributeDefinition> attributes) {
        this.attributes = List.copyOf(attributes);
    }

    static TemplateSchema from(Map<String, Object> defaults, Map<String, Map<String, PathTemplate>> templates) {
        var definitions = new LinkedHashMap<String, AttributeDefinition>();
        defaults.forEach((name, value) ->
            definitions.put(name, AttributeDefinition.string(name, value == null ? null : value.toString())));
        for (var byParameter : templates.values()) {
            for (var template : byParameter.values()) {
                for (var placeholder : template.placeholders()) {
                    if (!TemplatePathResolver.BUILTINS.contains(placeholder)) {
                        definitions.putIfAbsent(placeholder, AttributeDefinition.string(placeholder, null));
                    }
                }
            }
        }
        return new TemplateSchema(new ArrayList<>(definitions.values()));
    }

    @Override
    public String name() {
        return TemplateCompletionPlugin.ID;
    }

    @Override
    public List<AttributeDefinition> attributes() {
        return attributes;
    }
}
