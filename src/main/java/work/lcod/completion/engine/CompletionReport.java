package work.lcod.completion.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one completion pass: values assigned to the engine's own process and every tolerated failure,
 * including those of descendant engines.
 */
public final class CompletionReport {
    private final String context;
    private final Map<String, Object> resolved;
    private final List<CompletionIssue> issues;

    private CompletionReport(String context, Map<String, Object> resolved, List<CompletionIssue> issues) {
        this.context = context;
        this.resolved = Collections.unmodifiableMap(new LinkedHashMap<>(resolved));
        this.issues = List.copyOf(issues);
    }

    public String context() {
        return context;
    }

    public Map<String, Object> resolved() {
        return resolved;
    }

    public List<CompletionIssue> issues() {
        return issues;
    }

    public List<CompletionIssue> issues(CompletionIssue.Kind kind) {
        return issues.stream().filter(issue -> issue.kind() == kind).toList();
    }

    public boolean isComplete() {
        return issues.isEmpty();
    }

    static Builder builder(String context) {
        return new Builder(context);
    }

    static final class Builder {
        private final String context;
        private final Map<String, Object> resolved = new LinkedHashMap<>();
        private final List<CompletionIssue> issues = new ArrayList<>();

        private Builder(String context) {
            this.context = context;
        }

        Builder resolved(String parameter, Object value) {
            resolved.put(parameter, value);
            return this;
        }

        Builder issue(CompletionIssue issue) {
            issues.add(issue);
            return this;
        }

        Builder merge(CompletionReport child) {
            issues.addAll(child.issues());
            return this;
        }

        CompletionReport build() {
            return new CompletionReport(context, resolved, issues);
        }
    }
}
