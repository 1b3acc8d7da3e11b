package io.github.sparkrew.cpgslice.udf_slicer;

import io.github.sparkrew.cpgslice.udf_slicer.model.EdgeRecord;
import io.github.sparkrew.cpgslice.udf_slicer.model.ExtractionResult;
import io.github.sparkrew.cpgslice.udf_slicer.model.Graph;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SubgraphExtractor class.
 */
class SubgraphExtractorTest {

    @Test
    void testExtract_KeepsOnlyRequestedTypes() {
        Graph graph = GraphParser.parse(SampleGraphs.EXPORT);

        ExtractionResult result = SubgraphExtractor.extract(graph, List.of("CFG", "CALL"));

        assertEquals(3, result.keptEdges().size());
        assertTrue(result.keptEdges().stream().noneMatch(e -> e.edgeType().equals("AST")));
        assertEquals(Set.of("1", "2", "3"), result.keptNodes().keySet());
        assertTrue(result.missingNodeIds().isEmpty());
    }

    @Test
    void testExtract_SingleType() {
        Graph graph = GraphParser.parse(SampleGraphs.EXPORT);

        ExtractionResult result = SubgraphExtractor.extract(graph, List.of("CALL"));

        assertEquals(List.of("1->2:CALL"), result.keptEdges().stream().map(EdgeRecord::signature).toList());
        assertEquals(Set.of("1", "2"), result.keptNodes().keySet());
    }

    @Test
    void testExtract_IsolatedNodesDropped() {
        String text = SampleGraphs.EXPORT.replace("}\n", "") + "\"4\" [label = \"LOCAL\"];\n}\n";
        Graph graph = GraphParser.parse(text);

        ExtractionResult result = SubgraphExtractor.extract(graph, List.of("CFG", "CALL"));

        assertTrue(graph.hasNode("4"));
        assertFalse(result.keptNodes().containsKey("4"));
    }

    @Test
    void testExtract_DanglingEndpointReported() {
        String text = """
                "1" [label = "METHOD"];
                "1" -> "99" [label = "CFG"];
                """;

        ExtractionResult result = SubgraphExtractor.extract(GraphParser.parse(text), List.of("CFG", "CALL"));

        assertEquals(1, result.keptEdges().size());
        assertEquals(Set.of("99"), result.missingNodeIds());
        assertEquals(Set.of("1", "99"), result.referencedNodeIds());
        assertFalse(result.keptNodes().containsKey("99"));
    }

    @Test
    void testRender_HeaderAndRawText() {
        Graph graph = GraphParser.parse(SampleGraphs.EXPORT);
        ExtractionResult result = SubgraphExtractor.extract(graph, List.of("CFG", "CALL"));

        String text = SubgraphExtractor.render(result);

        assertTrue(text.startsWith("digraph subgraph_CFG_CALL {\n"));
        assertTrue(text.contains("  // Direct extraction from original DOT file\n"));
        assertTrue(text.contains("  // Edge types: CFG, CALL\n"));
        assertTrue(text.contains("  // Nodes: 3, Edges: 3\n"));
        assertTrue(text.contains("  " + SampleGraphs.UDF_NODE + "\n"));
        assertTrue(text.contains("  \"3\" [label = \"BLOCK\" CODE = \"{\n  int x = 1;\n}\"];\n"));
        assertFalse(text.contains("AST"));
        assertTrue(text.endsWith("}\n"));
    }

    @Test
    void testRender_ReparsesToSameDeclarations() {
        Graph graph = GraphParser.parse(SampleGraphs.EXPORT);
        ExtractionResult result = SubgraphExtractor.extract(graph, List.of("CFG", "CALL"));

        Graph reparsed = GraphParser.parse(SubgraphExtractor.render(result));

        assertTrue(reparsed.diagnostics().isEmpty());
        for (String id : result.keptNodes().keySet()) {
            assertEquals(graph.node(id).rawText(), reparsed.node(id).rawText());
            assertEquals(graph.node(id).attributes(), reparsed.node(id).attributes());
        }
        assertEquals(result.keptEdges().stream().map(EdgeRecord::rawText).toList(),
                reparsed.edges().stream().map(EdgeRecord::rawText).toList());
    }
}
