package io.github.sparkrew.cpgslice.udf_slicer.model;

/**
 * A recoverable problem found while scanning or decoding graph text.
 */
public record ScanDiagnostic(int lineNumber, Kind kind, String message) {

    public enum Kind {
        MALFORMED_DECLARATION,
        UNTERMINATED_BLOCK,
        MALFORMED_ATTRIBUTE
    }

    @Override
    public String toString() {
        return String.format("line %d: %s (%s)", lineNumber, message, kind);
    }
}
