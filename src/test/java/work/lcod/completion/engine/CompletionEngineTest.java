package work.lcod.completion.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.completion.support.CompletionTestSupport.attributes;
import static work.lcod.completion.support.CompletionTestSupport.declareAttributes;
import static work.lcod.completion.support.CompletionTestSupport.process;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.completion.api.CompletionRunner;
import work.lcod.completion.attributes.AttributeDefinition;
import work.lcod.completion.attributes.ProcessAttributes;
import work.lcod.completion.config.CompletionConfig;
import work.lcod.completion.process.ParameterSpec;
import work.lcod.completion.process.Pipeline;
import work.lcod.completion.process.Process;
import work.lcod.completion.runtime.Category;
import work.lcod.completion.runtime.CompletionContext;
import work.lcod.completion.runtime.Registries;
import work.lcod.completion.support.CompletionTestSupport;
import work.lcod.completion.support.CompletionTestSupport.RecordingResolver;

class CompletionEngineTest {
    @Test
    void completesLinkedPipelineEndToEnd() {
        var ctx = CompletionTestSupport.context(new RecordingResolver());
        var pipeline = CompletionTestSupport.producerConsumer(ctx);

        var report = CompletionEngine.forProcess(pipeline, null).completeParameters(attributes(Map.of("subject", "s1")));

        assertTrue(report.isComplete());
        var node1 = pipeline.node("node1").process();
        var node2 = pipeline.node("node2").process();
        assertEquals("/data/s1/out.ext", node1.getParameter("output"));
        assertEquals("/data/s1/out.ext", node2.getParameter("input"));
    }

    @Test
    void completesNestedPipelines() {
        var ctx = CompletionTestSupport.context(new RecordingResolver());
        declareAttributes(ctx, "leaf", AttributeDefinition.string("subject", null));
        var leaf = process("leaf", ctx, ParameterSpec.outputFile("output"));
        var inner = new Pipeline("inner", ctx);
        inner.add("step", leaf);
        var outer = new Pipeline("outer", ctx);
        outer.add("sub", inner);
        var engine = CompletionEngine.forProcess(outer, null);

        assertEquals(List.of("subject"), List.copyOf(engine.getAttributeValues().names()));

        var report = engine.completeParameters(attributes(Map.of("subject", "s9")));

        assertTrue(report.isComplete());
        assertEquals("s9", CompletionEngine.forProcess(inner, null).getAttributeValues().get("subject"));
        assertEquals("s9", CompletionEngine.forProcess(leaf, null).getAttributeValues().get("subject"));
        assertEquals("/data/s9/out.ext", leaf.getParameter("output"));
        assertEquals("outer.sub.step", leaf.contextName());
    }

    @Test
    void completionIsIdempotent() {
        var ctx = CompletionTestSupport.context(new RecordingResolver());
        var pipeline = CompletionTestSupport.producerConsumer(ctx);
        var engine = CompletionEngine.forProcess(pipeline, null);
        var inputs = attributes(Map.of("subject", "s1"));

        engine.completeParameters(inputs);
        var first = CompletionRunner.collectParameters(pipeline);
        engine.completeParameters(inputs);

        assertEquals(first, CompletionRunner.collectParameters(pipeline));
        assertEquals(Map.of("subject", "s1"), engine.getAttributeValues().exportToMap());
    }

    @Test
    void firstChildDeclaringAnAttributeWins() {
        var ctx = CompletionTestSupport.context("null");
        declareAttributes(ctx, "c1", AttributeDefinition.string("A", "from-c1"));
        declareAttributes(ctx, "c2", AttributeDefinition.string("A", "from-c2"), AttributeDefinition.string("B", "b"));
        var pipeline = new Pipeline("main", ctx);
        pipeline.add("first", process("c1", ctx));
        pipeline.add("second", process("c2", ctx));

        var attributes = CompletionEngine.forProcess(pipeline, null).getAttributeValues();

        assertEquals(List.of("A", "B"), List.copyOf(attributes.names()));
        assertEquals("from-c1", attributes.get("A"));
        assertEquals("b", attributes.get("B"));
    }

    @Test
    void mergeUsesCurrentChildValues() {
        var ctx = CompletionTestSupport.context("null");
        declareAttributes(ctx, "c1", AttributeDefinition.string("subject", null));
        var child = process("c1", ctx);
        var pipeline = new Pipeline("main", ctx);
        pipeline.add("only", child);
        CompletionEngine.forProcess(child, "main.only").getAttributeValues().set("subject", "s7");

        assertEquals("s7", CompletionEngine.forProcess(pipeline, null).getAttributeValues().get("subject"));
    }

    @Test
    void attributesFlowDownwardOnly() {
        var ctx = CompletionTestSupport.context(new RecordingResolver());
        var pipeline = CompletionTestSupport.producerConsumer(ctx);
        var engine = CompletionEngine.forProcess(pipeline, null);
        engine.completeParameters(attributes(Map.of("subject", "s1")));

        var child = pipeline.node("node1").process();
        var childEngine = CompletionEngine.forProcess(child, null);
        assertEquals("s1", childEngine.getAttributeValues().get("subject"));

        childEngine.completeParameters(attributes(Map.of("subject", "s2")));
        assertEquals("/data/s2/out.ext", child.getParameter("output"));
        assertEquals("s1", engine.getAttributeValues().get("subject"));

        engine.completeParameters();
        assertEquals("s1", childEngine.getAttributeValues().get("subject"));
        assertEquals("/data/s1/out.ext", child.getParameter("output"));
    }

    @Test
    void unknownAttributesAreDropped() {
        var ctx = CompletionTestSupport.context(new RecordingResolver());
        var pipeline = CompletionTestSupport.producerConsumer(ctx);
        var engine = CompletionEngine.forProcess(pipeline, null);

        var report = engine.completeParameters(attributes(Map.of("subject", "s1", "acquisition", "x")));

        assertTrue(report.isComplete());
        assertFalse(engine.getAttributeValues().has("acquisition"));
        assertEquals("/data/s1/out.ext", pipeline.node("node1").process().getParameter("output"));
    }

    @Test
    void attributeChangesTriggeredDuringCompletionAreIgnored() {
        var resolver = new RecordingResolver();
        var ctx = CompletionTestSupport.context(resolver);
        declareAttributes(ctx, "producer", AttributeDefinition.string("subject", null));
        var producer = process("producer", ctx, ParameterSpec.outputFile("output"));
        var engine = CompletionEngine.forProcess(producer, null);
        var attributes = engine.getAttributeValues();
        engine.bindAttributeChanges();
        producer.addParameterListener((process, name, oldValue, newValue) -> {
            if ("/data/s1/out.ext".equals(newValue)) {
                attributes.set("subject", "s2");
            }
        });

        attributes.set("subject", "s1");

        assertEquals(1, resolver.count());
        assertEquals("s2", attributes.get("subject"));
        assertEquals("/data/s1/out.ext", producer.getParameter("output"));
        assertFalse(engine.isCompletionOngoing());

        attributes.set("subject", "s3");
        assertEquals(2, resolver.count());
        assertEquals("/data/s3/out.ext", producer.getParameter("output"));

        engine.unbindAttributeChanges();
        attributes.set("subject", "s4");
        assertEquals(2, resolver.count());
    }

    @Test
    void failingChildDoesNotStopSiblings() {
        var ctx = CompletionTestSupport.context(new RecordingResolver());
        declareAttributes(ctx, "p1", AttributeDefinition.string("subject", null));
        declareAttributes(ctx, "p3", AttributeDefinition.string("subject", null));
        ctx.registry().register(Category.PROCESS_ATTRIBUTES, "broken", (process, schemas) -> {
            throw new IllegalStateException("broken attributes");
        });
        var pipeline = new Pipeline("main", ctx);
        pipeline.add("child1", process("p1", ctx, ParameterSpec.outputFile("output")));
        pipeline.add("child2", process("broken", ctx, ParameterSpec.outputFile("output")));
        pipeline.add("child3", process("p3", ctx, ParameterSpec.outputFile("output")));

        var report = CompletionEngine.forProcess(pipeline, null).completeParameters(attributes(Map.of("subject", "s1")));

        assertFalse(report.isComplete());
        assertEquals(1, report.issues(CompletionIssue.Kind.CHILD_CONSTRUCTION).size());
        var failed = report.issues(CompletionIssue.Kind.CHILD_COMPLETION);
        assertEquals(1, failed.size());
        assertEquals("main.child2", failed.get(0).context());
        assertEquals("broken attributes", failed.get(0).message());
        assertEquals("/data/s1/out.ext", pipeline.node("child1").process().getParameter("output"));
        assertNull(pipeline.node("child2").process().getParameter("output"));
        assertEquals("/data/s1/out.ext", pipeline.node("child3").process().getParameter("output"));
    }

    @Test
    void failingParameterIsReported() {
        var ctx = CompletionTestSupport.context((process, parameter, attrs) -> {
            if ("bad".equals(parameter)) {
                throw new IllegalArgumentException("cannot build " + parameter);
            }
            return "/data/" + parameter;
        });
        var producer = process("producer", ctx, ParameterSpec.outputFile("bad"), ParameterSpec.outputFile("good"));

        var report = CompletionEngine.forProcess(producer, null).completeParameters();

        var issues = report.issues(CompletionIssue.Kind.PARAMETER_RESOLUTION);
        assertEquals(1, issues.size());
        assertEquals("bad", issues.get(0).parameter());
        assertEquals(Map.of("good", "/data/good"), report.resolved());
        assertEquals("/data/good", producer.getParameter("good"));
    }

    @Test
    void nullResolverLeavesParametersUntouched() {
        var ctx = CompletionTestSupport.context(Registries.NULL_PATH_RESOLVER);
        var pipeline = CompletionTestSupport.producerConsumer(ctx);

        var report = CompletionEngine.forProcess(pipeline, null).completeParameters(attributes(Map.of("subject", "s1")));

        assertTrue(report.isComplete());
        assertTrue(report.resolved().isEmpty());
        assertNull(pipeline.node("node1").process().getParameter("output"));
        assertNull(pipeline.node("node2").process().getParameter("input"));
    }

    @Test
    void plainInputsAreAssignedBeforeResolution() {
        var ctx = CompletionTestSupport.context(Registries.NULL_PATH_RESOLVER);
        var producer = process("producer", ctx, ParameterSpec.value("level"), ParameterSpec.outputFile("output"));

        CompletionEngine.forProcess(producer, null).completeParameters(Map.of("level", 3));

        assertEquals(3, producer.getParameter("level"));
    }

    @Test
    void attributeInputsMustBeAMap() {
        var ctx = CompletionTestSupport.context(Registries.NULL_PATH_RESOLVER);
        var engine = CompletionEngine.forProcess(process("producer", ctx), null);
        assertThrows(IllegalArgumentException.class,
            () -> engine.setParameters(Map.of(CompletionEngine.ATTRIBUTES_KEY, "subject=s1")));
    }

    @Test
    void forProcessReturnsTheAttachedEngine() {
        var ctx = CompletionTestSupport.context(Registries.NULL_PATH_RESOLVER);
        var producer = process("producer", ctx);

        var first = CompletionEngine.forProcess(producer, "main.node1");
        var second = CompletionEngine.forProcess(producer, null);

        assertSame(first, second);
        assertEquals("main.node1", second.name());
        assertSame(first, ctx.engines().find(producer).orElseThrow());
        assertEquals(1, ctx.engines().size());
    }

    @Test
    void configuredEngineFactoryIsUsed() {
        var config = CompletionConfig.builder()
            .attributesEnabled(true)
            .processCompletion("custom")
            .pathCompletion(Registries.NULL_PATH_RESOLVER)
            .build();
        var ctx = new CompletionContext(config, Registries.builtins());
        ctx.registry().register(Category.PROCESS_COMPLETION, "custom", CustomEngine::new);

        var engine = CompletionEngine.forProcess(process("producer", ctx), "custom-name");

        assertInstanceOf(CustomEngine.class, engine);
        assertEquals("custom-name", engine.name());
    }

    @Test
    void unknownEngineFactoryFallsBackToBuiltin() {
        var config = CompletionConfig.builder()
            .attributesEnabled(true)
            .processCompletion("missing")
            .pathCompletion(Registries.NULL_PATH_RESOLVER)
            .build();
        var ctx = new CompletionContext(config, Registries.builtins());

        var engine = CompletionEngine.forProcess(process("producer", ctx), null);

        assertEquals(CompletionEngine.class, engine.getClass());
    }

    @Test
    void specializedAttributeSetReplacesMerge() {
        var ctx = CompletionTestSupport.context(Registries.NULL_PATH_RESOLVER);
        declareAttributes(ctx, "c1", AttributeDefinition.string("A", "a"));
        declareAttributes(ctx, "main", AttributeDefinition.string("Z", "z"));
        var pipeline = new Pipeline("main", ctx);
        pipeline.add("first", process("c1", ctx));

        var attributes = CompletionEngine.forProcess(pipeline, null).getAttributeValues();

        assertEquals(List.of("Z"), List.copyOf(attributes.names()));
        assertInstanceOf(ProcessAttributes.class, attributes);
        assertSame(pipeline, attributes.process());
    }

    @Test
    void missingPathCompletionIsAMisuse() {
        var config = CompletionConfig.builder().attributesEnabled(true).build();
        var ctx = new CompletionContext(config, Registries.builtins());
        var pipeline = new Pipeline("main", ctx);
        pipeline.add("node1", process("producer", ctx, ParameterSpec.outputFile("output")));

        var engine = CompletionEngine.forProcess(pipeline, null);

        assertThrows(CompletionMisuseException.class, engine::completeParameters);
        assertThrows(CompletionMisuseException.class, engine::getPathResolver);
    }

    @Test
    void disabledAttributesStillRequirePathCompletion() {
        var ctx = new CompletionContext(CompletionConfig.defaults(), Registries.builtins());
        var producer = process("producer", ctx, ParameterSpec.outputFile("output"));

        var engine = CompletionEngine.forProcess(producer, null);

        assertTrue(engine.getAttributeValues().names().isEmpty());
        assertThrows(CompletionMisuseException.class, engine::completeParameters);
    }

    @Test
    void missingSchemasAreSkipped() {
        var config = CompletionConfig.builder()
            .attributesEnabled(true)
            .pathCompletion(Registries.NULL_PATH_RESOLVER)
            .schema("input", "unknown")
            .build();
        var ctx = new CompletionContext(config, Registries.builtins());

        var attributes = CompletionEngine.forProcess(process("producer", ctx), null).getAttributeValues();

        assertTrue(attributes.schemas().isEmpty());
    }

    static final class CustomEngine extends CompletionEngine {
        CustomEngine(Process process, String name) {
            super(process, name);
        }
    }
}
