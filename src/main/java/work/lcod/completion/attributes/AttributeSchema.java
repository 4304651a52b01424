package work.lcod.completion.attributes;

import java.util.List;
import java.util.Optional;

/**
 * Named catalogue of attribute definitions describing one data organization.
 */
public interface AttributeSchema {
    String name();

    List<AttributeDefinition> attributes();

    default Optional<AttributeDefinition> find(String attribute) {
        return attributes().stream().filter(def -> def.name().equals(attribute)).findFirst();
    }
}
