package io.github.sparkrew.cpgslice.udf_slicer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * The persisted form of a verification run. Field names are part of the output format.
 */
@JsonPropertyOrder({"files", "counts", "verification_results", "overall_passed"})
public record VerificationDocument(
        @JsonProperty("files") Map<String, String> files,
        @JsonProperty("counts") Counts counts,
        @JsonProperty("verification_results") Map<String, CategoryResult> verificationResults,
        @JsonProperty("overall_passed") boolean overallPassed
) {

    @JsonPropertyOrder({"original_nodes", "original_edges", "filtered_nodes", "filtered_edges"})
    public record Counts(
            @JsonProperty("original_nodes") int originalNodes,
            @JsonProperty("original_edges") int originalEdges,
            @JsonProperty("filtered_nodes") int filteredNodes,
            @JsonProperty("filtered_edges") int filteredEdges
    ) {
    }
}
