package work.lcod.completion.template;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Path pattern with {@code {name}} placeholders, e.g. {@code {root}/{subject}/{process}_{parameter}.nii}.
 */
public final class PathTemplate {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private final String pattern;
    private final Set<String> placeholders;

    public PathTemplate(String pattern) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        var names = new LinkedHashSet<String>();
        Matcher matcher = PLACEHOLDER.matcher(pattern);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        this.placeholders = Collections.unmodifiableSet(names);
    }

    public String pattern() {
        return pattern;
    }

    public Set<String> placeholders() {
        return placeholders;
    }

    /**
     * Substitutes every placeholder. Returns {@code null} as soon as one value is {@code null} or blank.
     */
    public String render(Function<String, Object> values) {
        Matcher matcher = PLACEHOLDER.matcher(pattern);
        var result = new StringBuilder();
        while (matcher.find()) {
            Object value = values.apply(matcher.group(1));
            if (value == null || value.toString().isBlank()) {
                return null;
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value.toString()));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
