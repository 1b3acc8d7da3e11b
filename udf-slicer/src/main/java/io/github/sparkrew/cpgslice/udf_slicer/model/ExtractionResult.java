package io.github.sparkrew.cpgslice.udf_slicer.model;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Result of an edge-type extraction. Kept nodes are sorted by id; missing ids are endpoints without a declaration.
 */
public record ExtractionResult(
        List<String> edgeTypes,
        List<EdgeRecord> keptEdges,
        SortedMap<String, NodeRecord> keptNodes,
        SortedSet<String> missingNodeIds
) {

    public ExtractionResult {
        edgeTypes = List.copyOf(edgeTypes);
        keptEdges = List.copyOf(keptEdges);
        keptNodes = Collections.unmodifiableSortedMap(new TreeMap<>(keptNodes));
        missingNodeIds = Collections.unmodifiableSortedSet(new TreeSet<>(missingNodeIds));
    }

    /**
     * All ids referenced by kept edges, declared or not.
     */
    public Set<String> referencedNodeIds() {
        Set<String> ids = new TreeSet<>(keptNodes.keySet());
        ids.addAll(missingNodeIds);
        return ids;
    }
}
