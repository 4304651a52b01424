package work.lcod.completion.process;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders a plain-text description of a process from its declared parameters.
 */
public final class ProcessHelp {
    private ProcessHelp() {}

    public static String describe(Process process) {
        var lines = new ArrayList<String>();
        if (process.description() != null && !process.description().isBlank()) {
            lines.addAll(List.of(process.description().split("\n")));
        } else {
            lines.add(process.name());
        }
        lines.add("");
        lines.addAll(inputLines(process));
        lines.add("");
        lines.addAll(outputLines(process));
        return String.join("\n", lines);
    }

    static List<String> inputLines(Process process) {
        var lines = new ArrayList<String>(List.of("Inputs", "~".repeat(6), ""));
        var mandatory = new ArrayList<String>();
        var optional = new ArrayList<String>();
        for (var spec : process.parameters()) {
            if (spec.output()) continue;
            (spec.optional() ? optional : mandatory).add(line(spec));
        }
        if (!mandatory.isEmpty()) {
            lines.add("[Mandatory]");
            lines.add("");
            lines.addAll(mandatory);
        }
        if (!optional.isEmpty()) {
            if (!mandatory.isEmpty()) lines.add("");
            lines.add("[Optional]");
            lines.add("");
            lines.addAll(optional);
        }
        return lines;
    }

    static List<String> outputLines(Process process) {
        var outputs = process.parameters().stream().filter(ParameterSpec::output).toList();
        if (outputs.isEmpty()) {
            return List.of("");
        }
        var lines = new ArrayList<String>(List.of("Outputs", "~".repeat(7), ""));
        outputs.forEach(spec -> lines.add(line(spec)));
        return lines;
    }

    private static String line(ParameterSpec spec) {
        var text = spec.name() + ": " + spec.kind().name().toLowerCase(Locale.ROOT);
        if (!spec.description().isBlank()) {
            text += " (" + spec.description() + ")";
        }
        return text;
    }
}
