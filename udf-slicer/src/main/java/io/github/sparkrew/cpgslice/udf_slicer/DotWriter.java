package io.github.sparkrew.cpgslice.udf_slicer;

import io.github.sparkrew.cpgslice.udf_slicer.model.EdgeRecord;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes node and edge declarations back out by copying their raw text.
 * <p>
 * Nodes are written sorted by id, edges in the order given. The first line of every declaration gets a two-space
 * indent; continuation lines of multi-line nodes are copied untouched. The same input always yields the same text.
 */
public class DotWriter {

    static final String INDENT = "  ";

    /**
     * @param graphName   name written after {@code digraph}; characters that are not letters, digits or underscores
     *                    are replaced by underscores
     * @param description comment lines written at the top of the graph
     * @param nodeTexts   raw declaration text by node id
     * @param edges       edges to write, in output order
     * @return the graph text
     */
    public static String write(String graphName, List<String> description, Map<String, String> nodeTexts,
                               List<EdgeRecord> edges) {
        StringBuilder out = new StringBuilder();
        out.append("digraph ").append(sanitizeName(graphName)).append(" {\n");
        for (String line : description) {
            out.append(INDENT).append("// ").append(line).append('\n');
        }
        out.append(INDENT).append("// Nodes: ").append(nodeTexts.size())
                .append(", Edges: ").append(edges.size()).append("\n\n");

        out.append(INDENT).append("// Node definitions\n");
        for (String rawText : new TreeMap<>(nodeTexts).values()) {
            appendDeclaration(out, rawText);
        }

        out.append('\n').append(INDENT).append("// Edge definitions\n");
        for (EdgeRecord edge : edges) {
            appendDeclaration(out, edge.rawText());
        }
        out.append("}\n");
        return out.toString();
    }

    static String sanitizeName(String name) {
        String sanitized = name.replaceAll("[^A-Za-z0-9_]", "_");
        return sanitized.isEmpty() ? "graph" : sanitized;
    }

    private static void appendDeclaration(StringBuilder out, String rawText) {
        // Only the first physical line is indented.
        out.append(INDENT).append(rawText).append('\n');
    }
}
