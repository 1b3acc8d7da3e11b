package io.github.sparkrew.cpgslice.udf_slicer;

import io.github.sparkrew.cpgslice.udf_slicer.model.Graph;
import io.github.sparkrew.cpgslice.udf_slicer.model.NodeRecord;

import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import static io.github.sparkrew.cpgslice.udf_slicer.utils.CpgNames.AST_PARENT_FULL_NAME;
import static io.github.sparkrew.cpgslice.udf_slicer.utils.CpgNames.FILENAME;
import static io.github.sparkrew.cpgslice.udf_slicer.utils.CpgNames.FULL_NAME;
import static io.github.sparkrew.cpgslice.udf_slicer.utils.CpgNames.IS_EXTERNAL;
import static io.github.sparkrew.cpgslice.udf_slicer.utils.CpgNames.LABEL;
import static io.github.sparkrew.cpgslice.udf_slicer.utils.CpgNames.METHOD;
import static io.github.sparkrew.cpgslice.udf_slicer.utils.CpgNames.NAME;

/**
 * Decides whether a node is a user-defined function (UDF): a METHOD that the analyzed program declares itself, as
 * opposed to external library methods, operator pseudo-methods and compiler-synthesized methods.
 */
public class UdfClassifier {

    private static final String OPERATOR_PREFIX = "<operator>";
    private static final String INCLUDES = "<includes>";

    /**
     * A node is a UDF when it is a METHOD, is not external, is not an operator, is not a {@code <clinit>} or
     * {@code <global>} method, has a real file name and is not nested under {@code <includes>}. Missing attributes
     * count as empty strings, except IS_EXTERNAL which defaults to false.
     */
    public static boolean isUdf(Map<String, String> attributes) {
        if (!METHOD.equals(attributes.getOrDefault(LABEL, ""))) {
            return false;
        }
        if ("true".equalsIgnoreCase(attributes.getOrDefault(IS_EXTERNAL, "false"))) {
            return false;
        }
        String name = attributes.getOrDefault(NAME, "");
        String fullName = attributes.getOrDefault(FULL_NAME, "");
        String fileName = attributes.getOrDefault(FILENAME, "");
        String astParent = attributes.getOrDefault(AST_PARENT_FULL_NAME, "");
        if (name.startsWith(OPERATOR_PREFIX) || fullName.startsWith(OPERATOR_PREFIX)) {
            return false;
        }
        if (name.equals("<clinit>") || name.equals("<global>")) {
            return false;
        }
        if (fileName.isEmpty() || fileName.equals(INCLUDES) || fileName.equals("<empty>")) {
            return false;
        }
        return !astParent.contains(INCLUDES);
    }

    /**
     * Ids of all UDF nodes in the graph.
     */
    public static SortedSet<String> seeds(Graph graph) {
        SortedSet<String> seeds = new TreeSet<>();
        for (NodeRecord node : graph.nodes().values()) {
            if (isUdf(node.attributes())) {
                seeds.add(node.id());
            }
        }
        return seeds;
    }
}
