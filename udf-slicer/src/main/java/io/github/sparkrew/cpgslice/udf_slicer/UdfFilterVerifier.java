package io.github.sparkrew.cpgslice.udf_slicer;

import io.github.sparkrew.cpgslice.udf_slicer.model.EdgeRecord;
import io.github.sparkrew.cpgslice.udf_slicer.model.Graph;
import io.github.sparkrew.cpgslice.udf_slicer.model.NodeRecord;
import io.github.sparkrew.cpgslice.udf_slicer.model.VerificationReport;
import io.github.sparkrew.cpgslice.udf_slicer.utils.IssueLists;
import io.github.sparkrew.cpgslice.udf_slicer.utils.VerificationLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Checks a UDF-filtered graph against the graph it was filtered from.
 * <p>
 * The UDF predicate, the CFG closure and the edge rules are deliberately re-implemented here instead of calling
 * {@link UdfClassifier}, {@link ReachabilitySlicer} and {@link EdgeRetentionFilter}, so that a bug in the filter
 * does not hide itself by also shaping the expectation.
 */
public class UdfFilterVerifier {

    public static final String UDF_IDENTIFICATION = "udf_identification";
    public static final String CFG_REACHABILITY = "cfg_reachability";
    public static final String EDGE_FILTERING = "edge_filtering";
    public static final String NODE_INTEGRITY = "node_integrity";

    private static final Logger log = LoggerFactory.getLogger(UdfFilterVerifier.class);

    public static VerificationReport verify(String preFilterText, String filteredText, int maxIssues) {
        return verify(GraphParser.parse(preFilterText), GraphParser.parse(filteredText), maxIssues);
    }

    /**
     * Run every UDF filtering check. No check stops the others.
     *
     * @param preFilter the CFG+CALL subgraph that was filtered
     * @param filtered  the produced UDF graph
     * @param maxIssues cap on listed issues per kind of problem; non-positive means no cap
     */
    public static VerificationReport verify(Graph preFilter, Graph filtered, int maxIssues) {
        log.info("Original: {} edges, {} nodes", preFilter.edges().size(), preFilter.nodes().size());
        log.info("Filtered: {} edges, {} nodes", filtered.edges().size(), filtered.nodes().size());

        SortedSet<String> udfs = new TreeSet<>();
        for (NodeRecord node : preFilter.nodes().values()) {
            if (isUserDefinedMethod(node.attributes())) {
                udfs.add(node.id());
            }
        }
        SortedSet<String> expectedNodes = cfgReachable(preFilter, udfs);

        VerificationReport.Builder report = VerificationReport.builder()
                .category(UDF_IDENTIFICATION)
                .category(CFG_REACHABILITY)
                .category(EDGE_FILTERING)
                .category(NODE_INTEGRITY);
        checkUdfIdentification(report, udfs, filtered, maxIssues);
        checkReachability(report, expectedNodes, preFilter, filtered, maxIssues);
        checkEdges(report, udfs, expectedNodes, preFilter, filtered, maxIssues);
        checkIntegrity(report, preFilter, filtered, maxIssues);

        VerificationReport result = report.build();
        VerificationLog.logSummary(log, "UDF filtering verification", result);
        return result;
    }

    private static void checkUdfIdentification(VerificationReport.Builder report, Set<String> udfs, Graph filtered,
                                               int maxIssues) {
        log.info("Original UDF METHODs: {}", udfs.size());
        List<String> missing = new ArrayList<>();
        for (String id : udfs) {
            if (!filtered.hasNode(id)) {
                missing.add("Missing UDF method " + id);
            }
        }
        List<String> leaked = new ArrayList<>();
        for (NodeRecord node : sortedNodes(filtered)) {
            if ("METHOD".equals(node.attributes().get("label")) && !udfs.contains(node.id())) {
                leaked.add("Non-UDF method " + node.id() + " (" + node.attributes().getOrDefault("NAME", "UNKNOWN")
                        + ") present in output");
            }
        }
        report.issues(UDF_IDENTIFICATION, IssueLists.capped(missing, maxIssues));
        report.issues(UDF_IDENTIFICATION, IssueLists.capped(leaked, maxIssues));
    }

    private static void checkReachability(VerificationReport.Builder report, Set<String> expectedNodes,
                                          Graph preFilter, Graph filtered, int maxIssues) {
        Set<String> actualNodes = filtered.nodes().keySet();
        log.info("Expected CFG-reachable nodes: {}, actual filtered nodes: {}", expectedNodes.size(),
                actualNodes.size());
        List<String> missing = new ArrayList<>();
        for (String id : expectedNodes) {
            if (!actualNodes.contains(id)) {
                missing.add(preFilter.hasNode(id)
                        ? "Missing CFG-reachable node " + id
                        : "Missing CFG-reachable node " + id + " (no declaration in pre-filter graph)");
            }
        }
        List<String> extra = new ArrayList<>();
        for (String id : new TreeSet<>(actualNodes)) {
            if (!expectedNodes.contains(id)) {
                extra.add("Node " + id + " is not CFG-reachable from any UDF");
            }
        }
        report.issues(CFG_REACHABILITY, IssueLists.capped(missing, maxIssues));
        report.issues(CFG_REACHABILITY, IssueLists.capped(extra, maxIssues));
    }

    private static void checkEdges(VerificationReport.Builder report, Set<String> udfs, Set<String> expectedNodes,
                                   Graph preFilter, Graph filtered, int maxIssues) {
        Set<String> outputNodes = filtered.nodes().keySet();
        List<String> invalid = new ArrayList<>();
        SortedSet<String> actualSignatures = new TreeSet<>();
        int cfgCount = 0;
        int callCount = 0;
        for (EdgeRecord edge : filtered.edges()) {
            actualSignatures.add(edge.signature());
            switch (edge.edgeType()) {
                case "CFG" -> {
                    cfgCount++;
                    if (!outputNodes.contains(edge.sourceId()) || !outputNodes.contains(edge.targetId())) {
                        invalid.add("CFG edge " + edge.signature() + " has an endpoint outside the output nodes");
                    }
                }
                case "CALL" -> {
                    callCount++;
                    if (!outputNodes.contains(edge.sourceId())) {
                        invalid.add("CALL edge " + edge.signature() + " starts outside the output nodes");
                    } else if (!udfs.contains(edge.targetId())) {
                        invalid.add("CALL edge " + edge.signature() + " targets a non-UDF node");
                    }
                }
                default -> invalid.add("Unexpected edge " + edge.signature() + " in output");
            }
        }
        log.info("CFG edges: {} kept, CALL edges: {} kept", cfgCount, callCount);

        // Edges the filter should have kept but did not.
        List<String> dropped = new ArrayList<>();
        for (EdgeRecord edge : preFilter.edges()) {
            boolean shouldKeep = switch (edge.edgeType()) {
                case "CFG" -> expectedNodes.contains(edge.sourceId()) && expectedNodes.contains(edge.targetId());
                case "CALL" -> expectedNodes.contains(edge.sourceId()) && udfs.contains(edge.targetId());
                default -> false;
            };
            if (shouldKeep && !actualSignatures.contains(edge.signature())) {
                dropped.add("Missing retained edge " + edge.signature());
            }
        }
        report.issues(EDGE_FILTERING, IssueLists.capped(invalid, maxIssues));
        report.issues(EDGE_FILTERING, IssueLists.capped(new ArrayList<>(new TreeSet<>(dropped)), maxIssues));
    }

    private static void checkIntegrity(VerificationReport.Builder report, Graph preFilter, Graph filtered,
                                       int maxIssues) {
        List<String> corrupted = new ArrayList<>();
        for (NodeRecord node : sortedNodes(filtered)) {
            NodeRecord original = preFilter.node(node.id());
            if (original == null) {
                corrupted.add("Node " + node.id() + " not found in pre-filter graph");
                continue;
            }
            String expected = original.rawText();
            String actual = node.rawText();
            if (!expected.equals(actual)) {
                int offset = firstDifference(expected, actual);
                corrupted.add("Node " + node.id() + " definition differs from pre-filter graph at offset " + offset
                        + " (length " + expected.length() + " vs " + actual.length() + ")");
            }
        }
        report.issues(NODE_INTEGRITY, IssueLists.capped(corrupted, maxIssues));
    }

    private static boolean isUserDefinedMethod(Map<String, String> attrs) {
        if (!"METHOD".equals(attrs.getOrDefault("label", ""))) {
            return false;
        }
        if (attrs.getOrDefault("IS_EXTERNAL", "false").equalsIgnoreCase("true")) {
            return false;
        }
        String name = attrs.getOrDefault("NAME", "");
        String fullName = attrs.getOrDefault("FULL_NAME", "");
        String filename = attrs.getOrDefault("FILENAME", "");
        String astParent = attrs.getOrDefault("AST_PARENT_FULL_NAME", "");
        if (name.startsWith("<operator>") || fullName.startsWith("<operator>")) {
            return false;
        }
        if (name.equals("<clinit>") || name.equals("<global>")) {
            return false;
        }
        if (filename.equals("<includes>") || filename.equals("<empty>") || filename.isEmpty()) {
            return false;
        }
        return !astParent.contains("<includes>");
    }

    // Closure computed one UDF at a time and unioned.
    private static SortedSet<String> cfgReachable(Graph graph, Set<String> udfs) {
        Map<String, List<String>> adjacency = new HashMap<>();
        for (EdgeRecord edge : graph.edges()) {
            if ("CFG".equals(edge.edgeType())) {
                adjacency.computeIfAbsent(edge.sourceId(), k -> new ArrayList<>()).add(edge.targetId());
            }
        }
        SortedSet<String> reachable = new TreeSet<>();
        for (String udf : udfs) {
            Set<String> visited = new TreeSet<>();
            Deque<String> queue = new ArrayDeque<>();
            visited.add(udf);
            queue.add(udf);
            while (!queue.isEmpty()) {
                String current = queue.poll();
                for (String neighbor : adjacency.getOrDefault(current, List.of())) {
                    if (visited.add(neighbor)) {
                        queue.add(neighbor);
                    }
                }
            }
            reachable.addAll(visited);
        }
        return reachable;
    }

    private static List<NodeRecord> sortedNodes(Graph graph) {
        return new TreeSet<>(graph.nodes().keySet()).stream().map(graph::node).toList();
    }

    private static int firstDifference(String a, String b) {
        int limit = Math.min(a.length(), b.length());
        for (int i = 0; i < limit; i++) {
            if (a.charAt(i) != b.charAt(i)) {
                return i;
            }
        }
        return limit;
    }
}
