package io.github.sparkrew.cpgslice.udf_slicer;

import io.github.sparkrew.cpgslice.udf_slicer.model.EdgeRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Computes the forward closure of a seed set over directed edges.
 */
public class ReachabilitySlicer {

    /**
     * Breadth-first traversal from every seed with one visited set shared across seeds, so overlapping regions are
     * only walked once. There is no depth bound; cycles end at already visited nodes.
     *
     * @param edges edges to follow from source to target (the CFG edges of a graph)
     * @param seeds start nodes; each one is part of the result even without outgoing edges
     * @return the seeds plus every node reachable from them
     */
    public static SortedSet<String> slice(Collection<EdgeRecord> edges, Collection<String> seeds) {
        Map<String, List<String>> successors = new HashMap<>();
        for (EdgeRecord edge : edges) {
            successors.computeIfAbsent(edge.sourceId(), k -> new ArrayList<>()).add(edge.targetId());
        }
        SortedSet<String> visited = new TreeSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String seed : seeds) {
            if (visited.add(seed)) {
                queue.add(seed);
            }
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : successors.getOrDefault(current, Collections.emptyList())) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return visited;
    }
}
