package io.github.sparkrew.cpgslice.udf_slicer.model;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of UDF filtering over one graph.
 *
 * @param seedIds        ids classified as user-defined methods
 * @param keptNodeIds    seeds plus everything reachable from them over CFG edges
 * @param keptEdges      edges that survive the retention rule, in source order
 * @param missingNodeIds kept ids that have no declaration in the graph
 */
public record SliceResult(
        SortedSet<String> seedIds,
        SortedSet<String> keptNodeIds,
        List<EdgeRecord> keptEdges,
        SortedSet<String> missingNodeIds
) {

    public SliceResult {
        seedIds = Collections.unmodifiableSortedSet(new TreeSet<>(seedIds));
        keptNodeIds = Collections.unmodifiableSortedSet(new TreeSet<>(keptNodeIds));
        keptEdges = List.copyOf(keptEdges);
        missingNodeIds = Collections.unmodifiableSortedSet(new TreeSet<>(missingNodeIds));
    }

    public long countEdges(String edgeType) {
        return keptEdges.stream().filter(e -> e.edgeType().equals(edgeType)).count();
    }
}
