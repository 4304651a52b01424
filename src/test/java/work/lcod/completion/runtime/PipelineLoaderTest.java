package work.lcod.completion.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.completion.process.ParameterKind;
import work.lcod.completion.process.Pipeline;
import work.lcod.completion.process.SubPipelineNode;
import work.lcod.completion.support.CompletionTestSupport;

class PipelineLoaderTest {
    private final CompletionContext ctx = CompletionTestSupport.context("null");

    @Test
    void loadsNodesParametersAndLinks() {
        var path = Path.of("src", "test", "resources", "pipelines", "preprocessing.yaml").toAbsolutePath();
        var pipeline = PipelineLoader.loadFromLocalFile(path, ctx);

        assertEquals("preprocessing", pipeline.name());
        assertEquals("Denoise then normalize one subject.", pipeline.description());
        assertEquals(List.of("node1", "node2"), List.copyOf(pipeline.nodes().keySet()));

        var denoise = pipeline.node("node1").process();
        assertEquals("denoise", denoise.name());
        assertEquals("preprocessing.node1", denoise.contextName());
        assertEquals(ParameterKind.FILE, denoise.parameter("input").orElseThrow().kind());
        assertTrue(denoise.parameter("output").orElseThrow().output());
        assertTrue(pipeline.node("node2").process().parameter("strength").orElseThrow().optional());
        assertEquals(2, pipeline.links().size());
        assertEquals("raw acquisition", pipeline.parameter("source").orElseThrow().description());
    }

    @Test
    void buildsNestedPipelines() throws Exception {
        var yaml = String.join("\n",
            "pipeline:",
            "  name: outer",
            "  nodes:",
            "    - name: sub",
            "      pipeline:",
            "        name: inner",
            "        nodes:",
            "          - {name: step, parameters: [{name: output, kind: file, output: true}]}",
            "");
        var pipeline = PipelineLoader.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), ctx);

        var node = assertInstanceOf(SubPipelineNode.class, pipeline.node("sub"));
        var inner = assertInstanceOf(Pipeline.class, node.process());
        assertEquals("outer.sub.step", inner.node("step").process().contextName());
        assertEquals("step", inner.node("step").process().name());
    }

    @Test
    void rejectsDescriptionsWithoutPipeline() {
        var yaml = "name: nothing\n";
        assertThrows(IllegalArgumentException.class,
            () -> PipelineLoader.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), ctx));
    }

    @Test
    void reportsMissingFiles() {
        assertThrows(IllegalStateException.class,
            () -> PipelineLoader.loadFromLocalFile(Path.of("does-not-exist.yaml"), ctx));
    }
}
