package io.github.sparkrew.cpgslice.udf_slicer.model;

/**
 * The two kinds of declarations that appear in an exported graph.
 */
public enum DeclarationKind {
    NODE,
    EDGE
}
