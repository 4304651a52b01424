package work.lcod.completion.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads {@link CompletionConfig} from TOML. The {@code [attributes]} table drives the engine; every other top-level
 * table is kept as a named section for plugins.
 */
public final class CompletionConfigLoader {
    static final String ATTRIBUTES_TABLE = "attributes";

    private CompletionConfigLoader() {}

    public static CompletionConfig load(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read completion config: " + path, ex);
        }
    }

    public static CompletionConfig parse(String toml) {
        TomlParseResult result = Toml.parse(toml == null ? "" : toml);
        if (result.hasErrors()) {
            var messages = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid completion config: " + messages);
        }
        return fromToml(result);
    }

    public static CompletionConfig fromToml(TomlTable root) {
        var builder = CompletionConfig.builder();
        TomlTable attributes = root.getTable(ATTRIBUTES_TABLE);
        if (attributes != null) {
            builder.attributesEnabled(Optional.ofNullable(attributes.getBoolean("enabled")).orElse(true));
            builder.processCompletion(attributes.getString("process_completion"));
            builder.pathCompletion(attributes.getString("path_completion"));
            TomlTable schemas = attributes.getTable("schemas");
            if (schemas != null) {
                for (String key : schemas.keySet()) {
                    Object value = schemas.get(List.of(key));
                    if (value instanceof String schemaName && !schemaName.isBlank()) {
                        builder.schema(key, schemaName);
                    }
                }
            }
        }
        for (String key : root.keySet()) {
            if (ATTRIBUTES_TABLE.equals(key)) continue;
            Object value = root.get(List.of(key));
            if (value instanceof TomlTable table) {
                builder.section(key, toMap(table));
            }
        }
        return builder.build();
    }

    private static Map<String, Object> toMap(TomlTable table) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : table.keySet()) {
            result.put(key, convert(table.get(List.of(key))));
        }
        return result;
    }

    private static Object convert(Object value) {
        if (value instanceof TomlTable table) {
            return toMap(table);
        }
        if (value instanceof TomlArray array) {
            List<Object> items = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                items.add(convert(array.get(i)));
            }
            return items;
        }
        return value;
    }
}
