package io.github.sparkrew.cpgslice.udf_slicer;

/**
 * The text of a graph could not be obtained. Fatal for the graph being processed, and only for that graph.
 */
public class GraphInputUnavailableException extends RuntimeException {

    public GraphInputUnavailableException(String source, Throwable cause) {
        super("Cannot read graph from " + source, cause);
    }

    public GraphInputUnavailableException(String message) {
        super(message);
    }
}
