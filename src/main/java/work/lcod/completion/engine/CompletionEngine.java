package work.lcod.completion.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.completion.attributes.AttributeChange;
import work.lcod.completion.attributes.AttributeListener;
import work.lcod.completion.attributes.AttributeSchema;
import work.lcod.completion.attributes.AttributeSet;
import work.lcod.completion.attributes.AttributeSetFactory;
import work.lcod.completion.attributes.ProcessAttributes;
import work.lcod.completion.process.Node;
import work.lcod.completion.process.Pipeline;
import work.lcod.completion.process.Process;
import work.lcod.completion.runtime.Category;
import work.lcod.completion.runtime.CompletionContext;
import work.lcod.completion.runtime.ImplementationNotFoundException;

/**
 * Completes the parameters of one process from a set of attributes.
 *
 * <p>The base engine does no path building by itself: for a pipeline it merges the attributes of the child nodes
 * and pushes its own attribute values down to them, then asks the configured {@link PathResolver} for the values of
 * its own parameters. Data organization schemes specialize the attribute sets and path resolvers through the
 * {@link work.lcod.completion.runtime.ResolverRegistry}.
 *
 * <p>Typical use:
 * <pre>{@code
 * var engine = CompletionEngine.forProcess(pipeline, null);
 * engine.getAttributeValues().set("subject", "s1");
 * engine.completeParameters();
 * }</pre>
 * Note that {@link #forProcess} attaches the engine to the process for good.
 */
public class CompletionEngine {
    /** Key of the attribute sub-map inside the inputs given to {@link #completeParameters(Map)}. */
    public static final String ATTRIBUTES_KEY = "__lcod_attributes__";

    private static final Logger log = LoggerFactory.getLogger(CompletionEngine.class);
    private static final CompletionEngineFactory DEFAULT_FACTORY = new BuiltinCompletionEngineFactory();

    private final Process process;
    private final String name;
    private final AttributeListener changeHandler = this::attributesChanged;
    private final List<CompletionIssue> attributeIssues = new ArrayList<>();
    private ProcessAttributes attributes;
    private boolean completionOngoing;

    public CompletionEngine(Process process) {
        this(process, null);
    }

    public CompletionEngine(Process process, String name) {
        this.process = Objects.requireNonNull(process, "process");
        this.name = name;
    }

    /**
     * Returns the completion engine of {@code process} using the configured engine factory, and attaches it to the
     * process. Calling it again for the same process returns the same engine.
     */
    public static CompletionEngine forProcess(Process process, String name) {
        var ctx = process.completionContext();
        CompletionEngineFactory factory = null;
        if (ctx.config().attributesEnabled()) {
            try {
                factory = ctx.registry().get(Category.PROCESS_COMPLETION, ctx.config().processCompletion());
            } catch (ImplementationNotFoundException ex) {
                log.debug("{}; using the builtin engine factory", ex.getMessage());
            }
        }
        if (factory == null) {
            factory = DEFAULT_FACTORY;
        }
        var engine = factory.getCompletionEngine(process, name);
        if (engine != null) {
            ctx.engines().attach(process, engine);
        }
        return engine;
    }

    public Process process() {
        return process;
    }

    public String name() {
        return name;
    }

    public boolean isCompletionOngoing() {
        return completionOngoing;
    }

    /**
     * Child failures recorded while the attribute set was built.
     */
    public List<CompletionIssue> attributeIssues() {
        return Collections.unmodifiableList(attributeIssues);
    }

    /**
     * Returns the attribute set of the process, building it on first call.
     *
     * <p>A specialized implementation is looked up by contextual name, then by process name. Without one, a pipeline
     * gets the union of its children's attributes, with their current values; the first child declaring a name wins.
     * A specialized implementation of a pipeline may ask for the same union on top of its own declarations.
     */
    public ProcessAttributes getAttributeValues() {
        if (attributes != null) {
            return attributes;
        }
        var ctx = process.completionContext();
        var schemas = resolveSchemas(ctx);
        var factory = findAttributeSetFactory(ctx);
        attributes = factory.isPresent()
            ? factory.get().create(process, schemas)
            : new ProcessAttributes(process, schemas);
        if (process instanceof Pipeline pipeline && factory.map(AttributeSetFactory::includesChildAttributes).orElse(true)) {
            mergeChildAttributes(pipeline, attributes);
        }
        return attributes;
    }

    public CompletionReport completeParameters() {
        return completeParameters(Map.of());
    }

    /**
     * Completes the parameters of the process.
     *
     * <p>{@code processInputs} may hold plain parameters of the process and, under {@link #ATTRIBUTES_KEY}, attribute
     * values. For a pipeline every child node is completed first, in topological order, with this engine's attribute
     * values; then the parameters of the process itself are resolved. Parameters may therefore be written several
     * times, the pipeline having the last word.
     *
     * <p>Children whose attributes could not be merged are reported on every pass.
     *
     * @throws CompletionMisuseException on configuration errors; other failures are reported, not thrown
     */
    public CompletionReport completeParameters(Map<String, ?> processInputs) {
        var report = CompletionReport.builder(displayName());
        setParameters(processInputs);
        attributeIssues.forEach(report::issue);
        if (process instanceof Pipeline pipeline) {
            var exported = getAttributeValues().exportToMap();
            for (var node : pipeline.workflowGraph().topologicalOrder()) {
                completeChild(node, exported, report);
            }
        }
        var current = getAttributeValues();
        for (var parameter : process.parameterNames()) {
            try {
                var value = attributesToPath(parameter, current);
                if (value != null) {
                    process.setParameter(parameter, value);
                    report.resolved(parameter, value);
                }
            } catch (CompletionMisuseException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                log.debug("Could not resolve {}.{}: {}", displayName(), parameter, ex.getMessage());
                report.issue(new CompletionIssue(CompletionIssue.Kind.PARAMETER_RESOLUTION, displayName(), parameter, ex));
            }
        }
        return report.build();
    }

    /**
     * Builds the value of {@code parameter} with the path resolver of this engine.
     */
    public Object attributesToPath(String parameter, AttributeSet attributes) {
        return getPathResolver().attributesToPath(process, parameter, attributes);
    }

    /**
     * Assigns attribute values (only those already declared) then plain parameters of the process.
     */
    public void setParameters(Map<String, ?> processInputs) {
        var target = getAttributeValues();
        if (processInputs == null || processInputs.isEmpty()) {
            return;
        }
        var given = processInputs.get(ATTRIBUTES_KEY);
        if (given != null && !(given instanceof Map<?, ?>)) {
            throw new IllegalArgumentException(ATTRIBUTES_KEY + " must be a map of attribute values");
        }
        if (given instanceof Map<?, ?> values && !values.isEmpty()) {
            var known = new LinkedHashMap<String, Object>();
            for (var entry : values.entrySet()) {
                var key = String.valueOf(entry.getKey());
                if (target.has(key)) {
                    known.put(key, entry.getValue());
                }
            }
            target.importFromMap(known);
        }
        var plain = new LinkedHashMap<String, Object>();
        for (var entry : processInputs.entrySet()) {
            if (!ATTRIBUTES_KEY.equals(entry.getKey())) {
                plain.put(entry.getKey(), entry.getValue());
            }
        }
        process.importParameters(plain);
    }

    /**
     * Attribute listener re-running completion for the changed attribute. Changes made while a pass triggered here
     * is running are ignored.
     */
    public void attributesChanged(AttributeChange change) {
        if (change.isStructural() || completionOngoing) {
            return;
        }
        completionOngoing = true;
        try {
            var report = completeParameters(Map.of(ATTRIBUTES_KEY, Collections.singletonMap(change.name(), change.newValue())));
            if (!report.isComplete()) {
                log.debug("Completion of {} after change of {} left {} issue(s)", displayName(), change.name(), report.issues().size());
            }
        } finally {
            completionOngoing = false;
        }
    }

    /**
     * Re-runs completion whenever an attribute of this engine changes.
     */
    public void bindAttributeChanges() {
        getAttributeValues().addListener(changeHandler);
    }

    public void unbindAttributeChanges() {
        if (attributes != null) {
            attributes.removeListener(changeHandler);
        }
    }

    /**
     * Path resolver for this engine's process, from the configured {@code path_completion} factory.
     *
     * @throws CompletionMisuseException when no path completion is configured
     */
    public PathResolver getPathResolver() {
        var ctx = process.completionContext();
        PathResolverFactory factory = null;
        if (ctx.config().attributesEnabled()) {
            try {
                factory = ctx.registry().get(Category.PATH_COMPLETION, ctx.config().pathCompletion());
            } catch (ImplementationNotFoundException ex) {
                log.trace("{}", ex.getMessage());
            }
        }
        if (factory == null) {
            factory = UnconfiguredPathResolverFactory.INSTANCE;
        }
        return factory.getPathResolver(process);
    }

    /**
     * Engine used when the engine of a child cannot be obtained or fails. Subclasses return their own type.
     */
    protected CompletionEngine newEngine(Process child) {
        return new CompletionEngine(child);
    }

    protected Map<String, AttributeSchema> resolveSchemas(CompletionContext ctx) {
        var config = ctx.config();
        if (!config.attributesEnabled() || config.attributesSchemas().isEmpty()) {
            return Map.of();
        }
        var schemas = new LinkedHashMap<String, AttributeSchema>();
        config.attributesSchemas().forEach((directory, schemaName) -> {
            var schema = ctx.registry().find(Category.SCHEMA, schemaName);
            if (schema.isPresent()) {
                schemas.put(directory, schema.get());
            } else {
                log.debug("No attribute schema '{}' registered for {}", schemaName, directory);
            }
        });
        return schemas;
    }

    private Optional<AttributeSetFactory> findAttributeSetFactory(CompletionContext ctx) {
        if (!ctx.config().attributesEnabled()) {
            return Optional.empty();
        }
        var names = new ArrayList<String>();
        if (process.contextName() != null) {
            names.add(process.contextName());
        }
        names.add(process.name());
        for (var candidate : names) {
            var factory = ctx.registry().find(Category.PROCESS_ATTRIBUTES, candidate);
            if (factory.isPresent()) {
                return factory;
            }
        }
        return Optional.empty();
    }

    private void mergeChildAttributes(Pipeline pipeline, ProcessAttributes target) {
        for (var node : pipeline.nodes().values()) {
            var child = node.process();
            var childName = qualify(node.name());
            ProcessAttributes childAttributes;
            try {
                childAttributes = forProcess(child, childName).getAttributeValues();
            } catch (CompletionMisuseException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                try {
                    childAttributes = newEngine(child).getAttributeValues();
                } catch (CompletionMisuseException retryEx) {
                    throw retryEx;
                } catch (RuntimeException retryEx) {
                    log.debug("Skipping attributes of {}: {}", childName, retryEx.getMessage());
                    attributeIssues.add(new CompletionIssue(CompletionIssue.Kind.CHILD_CONSTRUCTION, childName, null, retryEx));
                    continue;
                }
            }
            for (var definition : childAttributes.definitions().values()) {
                if (!target.has(definition.name())) {
                    target.declare(definition, childAttributes.get(definition.name()));
                }
            }
        }
    }

    private void completeChild(Node node, Map<String, Object> exported, CompletionReport.Builder report) {
        var child = node.process();
        var childName = qualify(node.name());
        Map<String, Object> inputs = Map.of(ATTRIBUTES_KEY, exported);
        try {
            report.merge(forProcess(child, childName).completeParameters(inputs));
        } catch (CompletionMisuseException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            try {
                report.merge(newEngine(child).completeParameters(inputs));
            } catch (CompletionMisuseException retryEx) {
                throw retryEx;
            } catch (RuntimeException retryEx) {
                log.debug("Skipping completion of {}: {}", childName, retryEx.getMessage());
                report.issue(new CompletionIssue(CompletionIssue.Kind.CHILD_COMPLETION, childName, null, retryEx));
            }
        }
    }

    private String qualify(String nodeName) {
        return process.name() + "." + nodeName;
    }

    private String displayName() {
        return name != null ? name : process.name();
    }
}
