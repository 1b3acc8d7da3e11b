package io.github.sparkrew.cpgslice.udf_slicer;

import io.github.sparkrew.cpgslice.udf_slicer.model.EdgeRecord;
import io.github.sparkrew.cpgslice.udf_slicer.model.ExtractionResult;
import io.github.sparkrew.cpgslice.udf_slicer.model.Graph;
import io.github.sparkrew.cpgslice.udf_slicer.model.NodeRecord;
import io.github.sparkrew.cpgslice.udf_slicer.utils.CpgNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Keeps the edges of the requested types and the nodes they touch. Declarations are carried over as raw text.
 */
public class SubgraphExtractor {

    private static final Logger log = LoggerFactory.getLogger(SubgraphExtractor.class);
    private static final int MAX_LOGGED_MISSING = 5;

    /**
     * @param graph     the full graph
     * @param edgeTypes edge types to keep, e.g. CFG and CALL
     * @return kept edges in source order, kept nodes by id and the referenced ids that have no declaration
     */
    public static ExtractionResult extract(Graph graph, List<String> edgeTypes) {
        Set<String> wanted = new HashSet<>(edgeTypes);
        List<EdgeRecord> keptEdges = new ArrayList<>();
        Set<String> referenced = new LinkedHashSet<>();
        for (EdgeRecord edge : graph.edges()) {
            if (wanted.contains(edge.edgeType())) {
                keptEdges.add(edge);
                referenced.add(edge.sourceId());
                referenced.add(edge.targetId());
            }
        }
        log.info("Found {} edges of types {} connecting {} nodes", keptEdges.size(), edgeTypes, referenced.size());

        SortedMap<String, NodeRecord> keptNodes = new TreeMap<>();
        SortedSet<String> missing = new TreeSet<>();
        for (String id : referenced) {
            NodeRecord node = graph.node(id);
            if (node != null) {
                keptNodes.put(id, node);
            } else {
                missing.add(id);
            }
        }
        log.info("Found definitions for {} out of {} nodes", keptNodes.size(), referenced.size());
        if (!missing.isEmpty()) {
            log.warn("Missing node definitions: {} nodes", missing.size());
            missing.stream().limit(MAX_LOGGED_MISSING).forEach(id -> log.warn("  - {}", id));
            if (missing.size() > MAX_LOGGED_MISSING) {
                log.warn("  - ... and {} more", missing.size() - MAX_LOGGED_MISSING);
            }
        }
        return new ExtractionResult(edgeTypes, keptEdges, keptNodes, missing);
    }

    /**
     * Write an extraction result as graph text.
     */
    public static String render(ExtractionResult result) {
        Map<String, String> nodeTexts = new LinkedHashMap<>();
        result.keptNodes().forEach((id, node) -> nodeTexts.put(id, node.rawText()));
        return DotWriter.write(
                "subgraph_" + CpgNames.joinEdgeTypes(result.edgeTypes()),
                List.of("Direct extraction from original DOT file",
                        "Edge types: " + String.join(", ", result.edgeTypes())),
                nodeTexts,
                result.keptEdges());
    }
}
