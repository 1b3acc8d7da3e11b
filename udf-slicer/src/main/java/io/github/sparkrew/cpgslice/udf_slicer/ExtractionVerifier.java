package io.github.sparkrew.cpgslice.udf_slicer;

import io.github.sparkrew.cpgslice.udf_slicer.model.EdgeRecord;
import io.github.sparkrew.cpgslice.udf_slicer.model.Graph;
import io.github.sparkrew.cpgslice.udf_slicer.model.NodeRecord;
import io.github.sparkrew.cpgslice.udf_slicer.model.VerificationReport;
import io.github.sparkrew.cpgslice.udf_slicer.utils.IssueLists;
import io.github.sparkrew.cpgslice.udf_slicer.utils.VerificationLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Checks an extracted subgraph against the graph it was extracted from. Expectations are recomputed from the
 * original graph; nothing produced by {@link SubgraphExtractor} is reused.
 */
public class ExtractionVerifier {

    public static final String EDGES = "edges";
    public static final String NODES = "nodes";
    public static final String ATTRIBUTES = "attributes";

    private static final Logger log = LoggerFactory.getLogger(ExtractionVerifier.class);

    /**
     * Parse both texts with full attribute decoding and verify.
     */
    public static VerificationReport verify(String originalText, String extractedText, List<String> edgeTypes,
                                            int maxIssues) {
        return verify(GraphParser.parse(originalText), GraphParser.parse(extractedText), edgeTypes, maxIssues);
    }

    /**
     * Run every extraction check. No check stops the others.
     *
     * @param original  the full graph
     * @param extracted the produced subgraph
     * @param edgeTypes the edge types that were requested
     * @param maxIssues cap on listed issues per kind of problem; non-positive means no cap
     */
    public static VerificationReport verify(Graph original, Graph extracted, List<String> edgeTypes, int maxIssues) {
        Set<String> wanted = new HashSet<>(edgeTypes);
        List<EdgeRecord> expectedEdges = original.edges().stream()
                .filter(e -> wanted.contains(e.edgeType()))
                .toList();
        log.info("Original: {} edges, {} nodes", original.edges().size(), original.nodes().size());
        log.info("Extracted: {} edges, {} nodes", extracted.edges().size(), extracted.nodes().size());

        VerificationReport.Builder report = VerificationReport.builder()
                .category(EDGES)
                .category(NODES)
                .category(ATTRIBUTES);
        checkEdges(report, expectedEdges, extracted, edgeTypes, wanted, maxIssues);
        checkNodes(report, expectedEdges, original, extracted, maxIssues);
        checkAttributes(report, original, extracted, maxIssues);

        VerificationReport result = report.build();
        VerificationLog.logSummary(log, "Subgraph extraction verification", result);
        return result;
    }

    private static void checkEdges(VerificationReport.Builder report, List<EdgeRecord> expectedEdges, Graph extracted,
                                   List<String> edgeTypes, Set<String> wanted, int maxIssues) {
        Map<String, Integer> expectedByType = countByType(expectedEdges);
        Map<String, Integer> extractedByType = countByType(extracted.edges());
        for (String edgeType : edgeTypes) {
            int expected = expectedByType.getOrDefault(edgeType, 0);
            int actual = extractedByType.getOrDefault(edgeType, 0);
            log.info("{} edges: {} original -> {} extracted", edgeType, expected, actual);
            if (expected != actual) {
                report.issue(EDGES, edgeType + ": count mismatch (" + expected + " vs " + actual + ")");
            }
        }
        for (Map.Entry<String, Integer> entry : extractedByType.entrySet()) {
            if (!wanted.contains(entry.getKey())) {
                report.issue(EDGES, "Unwanted edge type " + describeType(entry.getKey()) + ": "
                        + entry.getValue() + " edges");
            }
        }

        SortedSet<String> expectedSignatures = signatures(expectedEdges);
        SortedSet<String> extractedSignatures = signatures(extracted.edges());
        List<String> missing = new ArrayList<>();
        for (String signature : expectedSignatures) {
            if (!extractedSignatures.contains(signature)) {
                missing.add("Missing edge " + signature);
            }
        }
        List<String> extra = new ArrayList<>();
        for (String signature : extractedSignatures) {
            if (!expectedSignatures.contains(signature)) {
                extra.add("Extra edge " + signature);
            }
        }
        report.issues(EDGES, IssueLists.capped(missing, maxIssues));
        report.issues(EDGES, IssueLists.capped(extra, maxIssues));
    }

    private static void checkNodes(VerificationReport.Builder report, List<EdgeRecord> expectedEdges, Graph original,
                                   Graph extracted, int maxIssues) {
        SortedSet<String> expectedNodes = new TreeSet<>();
        for (EdgeRecord edge : expectedEdges) {
            expectedNodes.add(edge.sourceId());
            expectedNodes.add(edge.targetId());
        }
        Set<String> actualNodes = extracted.nodes().keySet();
        log.info("Expected nodes: {}, extracted nodes: {}", expectedNodes.size(), actualNodes.size());

        List<String> missing = new ArrayList<>();
        for (String id : expectedNodes) {
            if (!actualNodes.contains(id)) {
                missing.add(original.hasNode(id)
                        ? "Missing node " + id
                        : "Missing node " + id + " (no declaration in original graph)");
            }
        }
        List<String> extra = new ArrayList<>();
        for (String id : new TreeSet<>(actualNodes)) {
            if (!expectedNodes.contains(id)) {
                extra.add("Extra node " + id);
            }
        }
        report.issues(NODES, IssueLists.capped(missing, maxIssues));
        report.issues(NODES, IssueLists.capped(extra, maxIssues));
    }

    private static void checkAttributes(VerificationReport.Builder report, Graph original, Graph extracted,
                                        int maxIssues) {
        List<String> mismatches = new ArrayList<>();
        for (String id : new TreeSet<>(extracted.nodes().keySet())) {
            NodeRecord originalNode = original.node(id);
            if (originalNode == null) {
                continue;
            }
            Map<String, String> expected = originalNode.attributes();
            Map<String, String> actual = extracted.node(id).attributes();
            if (expected.equals(actual)) {
                continue;
            }
            for (String key : new TreeSet<>(expected.keySet())) {
                if (!actual.containsKey(key)) {
                    mismatches.add("Node " + id + ": attribute " + key + " missing");
                } else if (!expected.get(key).equals(actual.get(key))) {
                    mismatches.add("Node " + id + ": value of " + key + " differs");
                }
            }
            for (String key : new TreeSet<>(actual.keySet())) {
                if (!expected.containsKey(key)) {
                    mismatches.add("Node " + id + ": unexpected attribute " + key);
                }
            }
        }
        report.issues(ATTRIBUTES, IssueLists.capped(mismatches, maxIssues));
    }

    private static Map<String, Integer> countByType(List<EdgeRecord> edges) {
        Map<String, Integer> counts = new TreeMap<>();
        for (EdgeRecord edge : edges) {
            counts.merge(edge.edgeType(), 1, Integer::sum);
        }
        return counts;
    }

    private static SortedSet<String> signatures(List<EdgeRecord> edges) {
        SortedSet<String> signatures = new TreeSet<>();
        for (EdgeRecord edge : edges) {
            signatures.add(edge.signature());
        }
        return signatures;
    }

    private static String describeType(String edgeType) {
        return edgeType.isEmpty() ? "(unlabeled)" : edgeType;
    }
}
