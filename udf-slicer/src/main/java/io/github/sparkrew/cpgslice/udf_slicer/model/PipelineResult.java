package io.github.sparkrew.cpgslice.udf_slicer.model;

/**
 * Everything one pipeline run produced for a single graph.
 * <p>
 * The reports are null when verification was skipped.
 */
public record PipelineResult(
        String sourceName,
        String subgraphText,
        String filteredText,
        ExtractionResult extraction,
        SliceResult slice,
        VerificationReport extractionReport,
        VerificationReport udfReport
) {

    public boolean verified() {
        return extractionReport != null && udfReport != null;
    }

    /**
     * True when verification ran and both reports passed.
     */
    public boolean passed() {
        return verified() && extractionReport.overallPassed() && udfReport.overallPassed();
    }
}
