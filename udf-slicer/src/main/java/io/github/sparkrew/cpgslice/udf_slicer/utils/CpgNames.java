package io.github.sparkrew.cpgslice.udf_slicer.utils;

import java.util.List;
import java.util.Set;

/**
 * Attribute keys, node labels and edge types of the exported code property graph that this tool relies on.
 */
public final class CpgNames {

    public static final String LABEL = "label";
    public static final String NAME = "NAME";
    public static final String FULL_NAME = "FULL_NAME";
    public static final String FILENAME = "FILENAME";
    public static final String AST_PARENT_FULL_NAME = "AST_PARENT_FULL_NAME";
    public static final String IS_EXTERNAL = "IS_EXTERNAL";

    public static final String METHOD = "METHOD";

    public static final String CFG = "CFG";
    public static final String CALL = "CALL";

    /**
     * Edge types extracted when the caller does not ask for others.
     */
    public static final List<String> DEFAULT_EDGE_TYPES = List.of(CFG, CALL);

    /**
     * The only attributes needed to classify a node as a user-defined method.
     */
    public static final Set<String> CLASSIFICATION_KEYS =
            Set.of(LABEL, NAME, FULL_NAME, FILENAME, AST_PARENT_FULL_NAME, IS_EXTERNAL);

    private CpgNames() {
    }

    /**
     * Name fragment used for files and graph names, e.g. {@code CFG_CALL}.
     */
    public static String joinEdgeTypes(List<String> edgeTypes) {
        return String.join("_", edgeTypes);
    }
}
