package work.lcod.completion.process;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.completion.runtime.CompletionContext;
import work.lcod.completion.support.CompletionTestSupport;

class PipelineTest {
    private final CompletionContext ctx = CompletionTestSupport.context("null");

    @Test
    void qualifiesChildContextNames() {
        var inner = new Pipeline("inner", ctx);
        var leaf = CompletionTestSupport.process("leaf", ctx, ParameterSpec.inputFile("input"));
        inner.add("step", leaf);
        assertEquals("inner.step", leaf.contextName());

        var outer = new Pipeline("outer", ctx);
        var node = outer.add("sub", inner);

        assertInstanceOf(SubPipelineNode.class, node);
        assertEquals("outer.sub", inner.contextName());
        assertEquals("outer.sub.step", leaf.contextName());
        assertNull(outer.contextName());
    }

    @Test
    void rejectsInvalidNodes() {
        var pipeline = new Pipeline("main", ctx);
        var process = CompletionTestSupport.process("p", ctx);
        pipeline.add("a", process);

        assertThrows(IllegalArgumentException.class, () -> pipeline.add("a", CompletionTestSupport.process("q", ctx)));
        assertThrows(IllegalArgumentException.class, () -> pipeline.add("a.b", CompletionTestSupport.process("q", ctx)));
        assertThrows(IllegalArgumentException.class, () -> pipeline.add("self", pipeline));
        assertThrows(IllegalArgumentException.class, () -> pipeline.node("missing"));
    }

    @Test
    void linksPropagateCurrentAndLaterValues() {
        var pipeline = new Pipeline("main", ctx);
        pipeline.declare(ParameterSpec.inputFile("source"));
        var first = CompletionTestSupport.process("first", ctx, ParameterSpec.inputFile("input"), ParameterSpec.outputFile("output"));
        var second = CompletionTestSupport.process("second", ctx, ParameterSpec.inputFile("input"));
        pipeline.add("first", first);
        pipeline.add("second", second);

        first.setParameter("output", "/tmp/a.ext");
        pipeline.link("first.output", "second.input");
        pipeline.link("source", "first.input");
        assertEquals("/tmp/a.ext", second.getParameter("input"));

        first.setParameter("output", Path.of("/tmp/b.ext"));
        pipeline.setParameter("source", "/raw/s1.ext");
        assertEquals("/tmp/b.ext", second.getParameter("input"));
        assertEquals("/raw/s1.ext", first.getParameter("input"));
        assertEquals(2, pipeline.links().size());
    }

    @Test
    void linksRequireDeclaredParameters() {
        var pipeline = new Pipeline("main", ctx);
        pipeline.add("a", CompletionTestSupport.process("a", ctx, ParameterSpec.outputFile("output")));
        assertThrows(IllegalArgumentException.class, () -> pipeline.link("a.output", "a.missing"));
        assertThrows(IllegalArgumentException.class, () -> pipeline.link("b.output", "a.output"));
    }

    @Test
    void emptyPathUnsetsParameter() {
        var process = CompletionTestSupport.process("p", ctx, ParameterSpec.inputFile("input"), ParameterSpec.value("level"));
        process.setParameter("input", "/tmp/x");
        process.setParameter("input", "");
        assertNull(process.getParameter("input"));
        assertThrows(IllegalArgumentException.class, () -> process.setParameter("input", 12));
        process.setParameter("level", 3);
        assertEquals(3, process.getParameter("level"));
        assertThrows(IllegalArgumentException.class, () -> process.setParameter("unknown", 1));
    }

    @Test
    void exportsInputsAndOutputsSeparately() {
        var process = CompletionTestSupport.process("p", ctx, ParameterSpec.inputFile("input"), ParameterSpec.outputFile("output"));
        process.importParameters(Map.of("input", "/in", "output", "/out"));
        assertEquals(Map.of("input", "/in"), process.inputs());
        assertEquals(Map.of("output", "/out"), process.outputs());
        assertEquals(List.of("input", "output"), List.copyOf(process.exportParameters().keySet()));
    }
}
