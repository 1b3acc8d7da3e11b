package io.github.sparkrew.cpgslice.udf_slicer;

import io.github.sparkrew.cpgslice.udf_slicer.model.EdgeRecord;
import io.github.sparkrew.cpgslice.udf_slicer.model.Graph;
import io.github.sparkrew.cpgslice.udf_slicer.model.VerificationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for UdfFilterVerifier class.
 */
class UdfFilterVerifierTest {

    private Graph subgraph;
    private String filteredText;

    @BeforeEach
    void setUp() {
        Graph original = GraphParser.parse(SampleGraphs.EXPORT);
        String subgraphText = SubgraphExtractor.render(SubgraphExtractor.extract(original, List.of("CFG", "CALL")));
        subgraph = GraphParser.parse(subgraphText);
        filteredText = UdfFilter.render(subgraph, UdfFilter.filter(subgraph), "CFG_CALL_original");
    }

    private String writeWith(List<String> nodeIds, List<EdgeRecord> edges) {
        Map<String, String> nodes = new LinkedHashMap<>();
        for (String id : nodeIds) {
            nodes.put(id, subgraph.node(id).rawText());
        }
        return DotWriter.write("udf_test", List.of(), nodes, edges);
    }

    private EdgeRecord edge(String signature) {
        return subgraph.edges().stream().filter(e -> e.signature().equals(signature)).findFirst().orElseThrow();
    }

    @Test
    void testVerify_FilterOutputPasses() {
        VerificationReport report = UdfFilterVerifier.verify(subgraph, GraphParser.parse(filteredText), 50);

        assertTrue(report.overallPassed(), () -> report.categories().toString());
        assertEquals(List.of(UdfFilterVerifier.UDF_IDENTIFICATION, UdfFilterVerifier.CFG_REACHABILITY,
                        UdfFilterVerifier.EDGE_FILTERING, UdfFilterVerifier.NODE_INTEGRITY),
                List.copyOf(report.categories().keySet()));
    }

    @Test
    void testVerify_SingleCharacterMutation() {
        String mutated = filteredText.replace("int x = 1;", "int x = 2;");

        VerificationReport report = UdfFilterVerifier.verify(subgraph, GraphParser.parse(mutated), 50);

        List<String> issues = report.category(UdfFilterVerifier.NODE_INTEGRITY).issues();
        assertEquals(1, issues.size());
        assertTrue(issues.get(0).startsWith("Node 3 definition differs"), issues.get(0));
        assertTrue(report.category(UdfFilterVerifier.UDF_IDENTIFICATION).passed());
        assertTrue(report.category(UdfFilterVerifier.CFG_REACHABILITY).passed());
        assertTrue(report.category(UdfFilterVerifier.EDGE_FILTERING).passed());
        assertFalse(report.overallPassed());
    }

    @Test
    void testVerify_NonUdfMethodLeaked() {
        String leaky = writeWith(List.of("1", "2", "3"), List.of(edge("1->3:CFG"), edge("3->1:CFG")));

        VerificationReport report = UdfFilterVerifier.verify(subgraph, GraphParser.parse(leaky), 50);

        assertEquals(List.of("Non-UDF method 2 (printf) present in output"),
                report.category(UdfFilterVerifier.UDF_IDENTIFICATION).issues());
        assertEquals(List.of("Node 2 is not CFG-reachable from any UDF"),
                report.category(UdfFilterVerifier.CFG_REACHABILITY).issues());
        assertTrue(report.category(UdfFilterVerifier.NODE_INTEGRITY).passed());
    }

    @Test
    void testVerify_MissingUdf() {
        String missing = writeWith(List.of("3"), List.of());

        VerificationReport report = UdfFilterVerifier.verify(subgraph, GraphParser.parse(missing), 50);

        assertEquals(List.of("Missing UDF method 1"), report.category(UdfFilterVerifier.UDF_IDENTIFICATION).issues());
        assertEquals(List.of("Missing CFG-reachable node 1"),
                report.category(UdfFilterVerifier.CFG_REACHABILITY).issues());
        assertEquals(List.of("Missing retained edge 1->3:CFG", "Missing retained edge 3->1:CFG"),
                report.category(UdfFilterVerifier.EDGE_FILTERING).issues());
    }

    @Test
    void testVerify_CallToNonUdfRetained() {
        String wrong = writeWith(List.of("1", "3"), List.of(edge("1->3:CFG"), edge("3->1:CFG"), edge("1->2:CALL")));

        VerificationReport report = UdfFilterVerifier.verify(subgraph, GraphParser.parse(wrong), 50);

        assertEquals(List.of("CALL edge 1->2:CALL targets a non-UDF node"),
                report.category(UdfFilterVerifier.EDGE_FILTERING).issues());
        assertTrue(report.category(UdfFilterVerifier.CFG_REACHABILITY).passed());
    }

    @Test
    void testVerify_RetainedEdgeDropped() {
        String dropped = writeWith(List.of("1", "3"), List.of(edge("1->3:CFG")));

        VerificationReport report = UdfFilterVerifier.verify(subgraph, GraphParser.parse(dropped), 50);

        assertEquals(List.of("Missing retained edge 3->1:CFG"),
                report.category(UdfFilterVerifier.EDGE_FILTERING).issues());
    }

    @Test
    void testVerify_UnexpectedEdgeType() {
        String text = writeWith(List.of("1", "3"), List.of(edge("1->3:CFG"), edge("3->1:CFG"))).replace("}\n", "")
                + "  \"1\" -> \"3\" [label = \"AST\"];\n}\n";

        VerificationReport report = UdfFilterVerifier.verify(subgraph, GraphParser.parse(text), 50);

        assertEquals(List.of("Unexpected edge 1->3:AST in output"),
                report.category(UdfFilterVerifier.EDGE_FILTERING).issues());
    }

    @Test
    void testVerify_NodeNotInPreFilterGraph() {
        String text = writeWith(List.of("1", "3"), List.of(edge("1->3:CFG"), edge("3->1:CFG")))
                .replace("  // Node definitions\n", "  // Node definitions\n  \"50\" [label = \"LOCAL\"];\n");

        VerificationReport report = UdfFilterVerifier.verify(subgraph, GraphParser.parse(text), 50);

        assertEquals(List.of("Node 50 not found in pre-filter graph"),
                report.category(UdfFilterVerifier.NODE_INTEGRITY).issues());
    }

    @Test
    void testVerify_FromText() {
        String subgraphText = SubgraphExtractor.render(
                SubgraphExtractor.extract(GraphParser.parse(SampleGraphs.EXPORT), List.of("CFG", "CALL")));

        VerificationReport report = UdfFilterVerifier.verify(subgraphText, filteredText, 50);

        assertTrue(report.overallPassed());
    }
}
