package work.lcod.completion.template;

import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.completion.attributes.AttributeSchema;
import work.lcod.completion.attributes.AttributeSetFactory;
import work.lcod.completion.attributes.ProcessAttributes;
import work.lcod.completion.process.Process;

/**
 * Declares the attributes referenced by the templates of one process. A templated pipeline keeps the attributes of
 * its children as well, so they can still be completed.
 */
final class TemplateAttributeSetFactory implements AttributeSetFactory {
    private final AttributeSchema schema;
    private final List<String> used;

    TemplateAttributeSetFactory(AttributeSchema schema, Set<String> used) {
        this.schema = schema;
        this.used = List.copyOf(used);
    }

    @Override
    public ProcessAttributes create(Process process, Map<String, AttributeSchema> schemas) {
        var attributes = new ProcessAttributes(process, schemas);
        for (var name : used) {
            schema.find(name).ifPresent(attributes::declare);
        }
        return attributes;
    }

    @Override
    public boolean includesChildAttributes() {
        return true;
    }
}
