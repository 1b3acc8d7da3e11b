package io.github.sparkrew.cpgslice.udf_slicer.model;

import java.util.Map;

/**
 * A node declaration. The raw text is the exact source span and is never rebuilt from the attributes.
 */
public record NodeRecord(String id, Map<String, String> attributes, String rawText) {

    public NodeRecord {
        attributes = Map.copyOf(attributes);
    }

    /**
     * The semantic node type (e.g. METHOD, BLOCK), or an empty string when the node has no label.
     */
    public String label() {
        return attributes.getOrDefault("label", "");
    }
}
