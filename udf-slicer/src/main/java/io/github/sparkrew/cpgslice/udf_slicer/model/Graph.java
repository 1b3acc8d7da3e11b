package io.github.sparkrew.cpgslice.udf_slicer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed graph: declared nodes by id, edges in source order, and the diagnostics collected while parsing.
 */
public record Graph(Map<String, NodeRecord> nodes, List<EdgeRecord> edges, List<ScanDiagnostic> diagnostics) {

    public Graph {
        nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        edges = List.copyOf(edges);
        diagnostics = List.copyOf(diagnostics);
    }

    public NodeRecord node(String id) {
        return nodes.get(id);
    }

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    public List<EdgeRecord> edgesOfType(String edgeType) {
        return edges.stream().filter(e -> e.edgeType().equals(edgeType)).toList();
    }
}
