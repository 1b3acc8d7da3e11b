package io.github.sparkrew.cpgslice.udf_slicer;

import io.github.sparkrew.cpgslice.udf_slicer.model.EdgeRecord;
import io.github.sparkrew.cpgslice.udf_slicer.model.Graph;
import io.github.sparkrew.cpgslice.udf_slicer.model.SliceResult;
import io.github.sparkrew.cpgslice.udf_slicer.model.VerificationReport;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for UdfFilter class.
 */
class UdfFilterTest {

    private static Graph subgraph() {
        Graph original = GraphParser.parse(SampleGraphs.EXPORT);
        return GraphParser.parse(SubgraphExtractor.render(SubgraphExtractor.extract(original, List.of("CFG", "CALL"))));
    }

    @Test
    void testFilter_UdfWithBodyAndExternalCallee() {
        SliceResult result = UdfFilter.filter(subgraph());

        assertEquals(Set.of("1"), result.seedIds());
        assertEquals(Set.of("1", "3"), result.keptNodeIds());
        assertEquals(List.of("1->3:CFG", "3->1:CFG"), result.keptEdges().stream().map(EdgeRecord::signature).toList());
        assertEquals(2, result.countEdges("CFG"));
        assertEquals(0, result.countEdges("CALL"));
        assertTrue(result.missingNodeIds().isEmpty());
    }

    @Test
    void testFilter_CallBetweenUdfsKept() {
        String text = """
                "1" [label = "METHOD" NAME = "main" FILENAME = "a.c"];
                "2" [label = "CALL" CODE = "helper()"];
                "3" [label = "METHOD" NAME = "helper" FILENAME = "a.c"];
                "4" [label = "RETURN"];
                "1" -> "2" [label = "CFG"];
                "2" -> "3" [label = "CALL"];
                "3" -> "4" [label = "CFG"];
                """;

        SliceResult result = UdfFilter.filter(GraphParser.parse(text));

        assertEquals(Set.of("1", "3"), result.seedIds());
        assertEquals(Set.of("1", "2", "3", "4"), result.keptNodeIds());
        assertEquals(1, result.countEdges("CALL"));
    }

    @Test
    void testFilter_NoUdfs() {
        String text = """
                "1" [label = "METHOD" NAME = "printf" FILENAME = "<empty>" IS_EXTERNAL = "true"];
                "2" [label = "BLOCK"];
                "1" -> "2" [label = "CFG"];
                """;

        SliceResult result = UdfFilter.filter(GraphParser.parse(text));

        assertTrue(result.seedIds().isEmpty());
        assertTrue(result.keptNodeIds().isEmpty());
        assertTrue(result.keptEdges().isEmpty());
    }

    @Test
    void testFilter_ReachableUndeclaredNodeMissing() {
        String text = """
                "1" [label = "METHOD" NAME = "main" FILENAME = "a.c"];
                "1" -> "77" [label = "CFG"];
                """;
        Graph graph = GraphParser.parse(text);

        SliceResult result = UdfFilter.filter(graph);

        assertEquals(Set.of("1", "77"), result.keptNodeIds());
        assertEquals(Set.of("77"), result.missingNodeIds());
        String rendered = UdfFilter.render(graph, result, "a");
        assertTrue(rendered.contains("// Nodes: 1, Edges: 1"));
    }

    @Test
    void testRender_OnlyKeptDeclarations() {
        Graph graph = subgraph();
        SliceResult result = UdfFilter.filter(graph);

        String text = UdfFilter.render(graph, result, "CFG_CALL_original");

        assertTrue(text.startsWith("digraph udf_CFG_CALL_original {\n"));
        assertTrue(text.contains("  // UDF-filtered subgraph\n"));
        assertTrue(text.contains("  " + SampleGraphs.UDF_NODE + "\n"));
        assertFalse(text.contains("printf"));
        assertFalse(text.contains("CALL\"]"));
    }

    @Test
    void testFilter_OutputPassesVerification() {
        Graph graph = subgraph();
        SliceResult result = UdfFilter.filter(graph);
        Graph filtered = GraphParser.parse(UdfFilter.render(graph, result, "CFG_CALL_original"));

        VerificationReport report = UdfFilterVerifier.verify(graph, filtered, 50);

        assertTrue(report.overallPassed(), () -> report.categories().toString());
        assertTrue(report.category(UdfFilterVerifier.EDGE_FILTERING).passed());
    }
}
