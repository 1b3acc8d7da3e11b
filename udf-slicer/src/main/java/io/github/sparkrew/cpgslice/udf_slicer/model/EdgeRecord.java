package io.github.sparkrew.cpgslice.udf_slicer.model;

import java.util.Map;

/**
 * An edge declaration. Endpoints are not required to resolve to declared nodes.
 * Parallel edges between the same pair are kept as distinct records.
 */
public record EdgeRecord(String sourceId, String targetId, String edgeType, Map<String, String> attributes,
                         String rawText) {

    public EdgeRecord {
        attributes = Map.copyOf(attributes);
    }

    /**
     * Signature used to compare edges across graphs, e.g. {@code 12->34:CFG}.
     */
    public String signature() {
        return sourceId + "->" + targetId + ":" + edgeType;
    }
}
