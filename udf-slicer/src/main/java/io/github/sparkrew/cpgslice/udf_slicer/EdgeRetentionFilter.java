package io.github.sparkrew.cpgslice.udf_slicer;

import io.github.sparkrew.cpgslice.udf_slicer.model.EdgeRecord;
import io.github.sparkrew.cpgslice.udf_slicer.utils.CpgNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Decides which edges survive UDF filtering.
 * <p>
 * CFG edges stay when both ends are kept. CALL edges stay when the call site is kept and the callee is a UDF seed.
 * The callee is checked against the seeds, not the kept nodes, so a call into some other CFG-reachable node that is
 * not a UDF is dropped. Every other edge type is dropped.
 */
public class EdgeRetentionFilter {

    public static List<EdgeRecord> retain(List<EdgeRecord> edges, Set<String> keptNodes, Set<String> seeds) {
        List<EdgeRecord> retained = new ArrayList<>();
        for (EdgeRecord edge : edges) {
            if (isRetained(edge, keptNodes, seeds)) {
                retained.add(edge);
            }
        }
        return retained;
    }

    static boolean isRetained(EdgeRecord edge, Set<String> keptNodes, Set<String> seeds) {
        return switch (edge.edgeType()) {
            case CpgNames.CFG -> keptNodes.contains(edge.sourceId()) && keptNodes.contains(edge.targetId());
            case CpgNames.CALL -> keptNodes.contains(edge.sourceId()) && seeds.contains(edge.targetId());
            default -> false;
        };
    }
}
