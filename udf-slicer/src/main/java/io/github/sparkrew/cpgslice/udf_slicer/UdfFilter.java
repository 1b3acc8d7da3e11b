package io.github.sparkrew.cpgslice.udf_slicer;

import io.github.sparkrew.cpgslice.udf_slicer.model.EdgeRecord;
import io.github.sparkrew.cpgslice.udf_slicer.model.Graph;
import io.github.sparkrew.cpgslice.udf_slicer.model.NodeRecord;
import io.github.sparkrew.cpgslice.udf_slicer.model.SliceResult;
import io.github.sparkrew.cpgslice.udf_slicer.utils.CpgNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Reduces a CFG+CALL subgraph to the user-defined functions, their CFG bodies and the calls between them.
 */
public class UdfFilter {

    private static final Logger log = LoggerFactory.getLogger(UdfFilter.class);

    /**
     * Keep every UDF METHOD node, everything CFG-reachable from one, CFG edges between kept nodes and CALL edges from
     * a kept node to a UDF.
     */
    public static SliceResult filter(Graph graph) {
        long methodCount = graph.nodes().values().stream()
                .filter(n -> CpgNames.METHOD.equals(n.label()))
                .count();
        SortedSet<String> seeds = UdfClassifier.seeds(graph);
        log.info("Found {} METHOD nodes, {} are UDFs", methodCount, seeds.size());
        if (log.isDebugEnabled() && !seeds.isEmpty()) {
            log.debug("UDF methods: {}", String.join(", ", seeds.stream().limit(5).toList()));
        }

        List<EdgeRecord> cfgEdges = graph.edgesOfType(CpgNames.CFG);
        log.info("Found {} CFG edges and {} CALL edges", cfgEdges.size(), graph.edgesOfType(CpgNames.CALL).size());

        SortedSet<String> keptNodes = ReachabilitySlicer.slice(cfgEdges, seeds);
        List<EdgeRecord> keptEdges = EdgeRetentionFilter.retain(graph.edges(), keptNodes, seeds);
        SortedSet<String> missing = new TreeSet<>();
        for (String id : keptNodes) {
            if (!graph.hasNode(id)) {
                missing.add(id);
            }
        }
        SliceResult result = new SliceResult(seeds, keptNodes, keptEdges, missing);

        log.info("Filtering results: nodes {} -> {}, edges {} -> {}",
                graph.nodes().size(), keptNodes.size() - missing.size(), graph.edges().size(), keptEdges.size());
        log.info("  CFG edges kept: {}", result.countEdges(CpgNames.CFG));
        log.info("  CALL edges kept: {}", result.countEdges(CpgNames.CALL));
        if (!missing.isEmpty()) {
            log.warn("{} kept nodes are referenced by edges but not defined", missing.size());
        }
        return result;
    }

    /**
     * Write the filtered graph. Only declared nodes are written; their text is copied from {@code graph}.
     *
     * @param graph    the graph the result was computed from
     * @param result   the filtering result
     * @param baseName name of the input, used for the graph name
     */
    public static String render(Graph graph, SliceResult result, String baseName) {
        Map<String, String> nodeTexts = new LinkedHashMap<>();
        for (String id : result.keptNodeIds()) {
            NodeRecord node = graph.node(id);
            if (node != null) {
                nodeTexts.put(id, node.rawText());
            }
        }
        return DotWriter.write(
                "udf_" + baseName,
                List.of("UDF-filtered subgraph", "Only user-defined functions and their bodies"),
                nodeTexts,
                result.keptEdges());
    }
}
