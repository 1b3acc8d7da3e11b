package io.github.sparkrew.cpgslice.udf_slicer;

/**
 * An output artifact (graph text or report) could not be written.
 */
public class GraphOutputException extends RuntimeException {

    public GraphOutputException(String target, Throwable cause) {
        super("Cannot write " + target, cause);
    }
}
