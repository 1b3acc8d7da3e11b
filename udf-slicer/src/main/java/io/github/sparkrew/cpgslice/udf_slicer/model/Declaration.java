package io.github.sparkrew.cpgslice.udf_slicer.model;

/**
 * One raw declaration span found by the scanner.
 *
 * @param kind          NODE or EDGE
 * @param id            the node id, or the source id of an edge
 * @param targetId      the target id of an edge; null for nodes
 * @param rawText       the declaration from its opening quote through the terminating semicolon
 * @param attributeText the text between the opening bracket and the closing bracket, trailing whitespace removed
 * @param lineNumber    1-based line on which the declaration starts
 */
public record Declaration(DeclarationKind kind, String id, String targetId, String rawText, String attributeText,
                          int lineNumber) {

    public static Declaration node(String id, String rawText, String attributeText, int lineNumber) {
        return new Declaration(DeclarationKind.NODE, id, null, rawText, attributeText, lineNumber);
    }

    public static Declaration edge(String sourceId, String targetId, String rawText, String attributeText,
                                   int lineNumber) {
        return new Declaration(DeclarationKind.EDGE, sourceId, targetId, rawText, attributeText, lineNumber);
    }
}
