package io.github.sparkrew.cpgslice.udf_slicer;

import io.github.sparkrew.cpgslice.udf_slicer.model.ExtractionResult;
import io.github.sparkrew.cpgslice.udf_slicer.model.Graph;
import io.github.sparkrew.cpgslice.udf_slicer.model.PipelineResult;
import io.github.sparkrew.cpgslice.udf_slicer.model.SliceResult;
import io.github.sparkrew.cpgslice.udf_slicer.model.VerificationReport;
import io.github.sparkrew.cpgslice.udf_slicer.utils.CpgNames;
import io.github.sparkrew.cpgslice.udf_slicer.utils.IssueLists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Runs extraction, UDF filtering and both verifications for one exported graph and lays the results out on disk.
 * <p>
 * Every invocation works on its own input and output directory and shares no state with other invocations, so
 * callers may run several graphs in parallel.
 */
public class SlicePipeline {

    public static final String SUBGRAPH_DIR = "subgraph";
    public static final String UDF_DIR = "udf";
    public static final String EXTRACTION_REPORT = "extraction_verification.json";
    public static final String UDF_REPORT = "udf_verification.json";

    private static final Logger log = LoggerFactory.getLogger(SlicePipeline.class);

    /**
     * Process one graph.
     *
     * @param source    supplies the full graph text
     * @param outputDir directory receiving the {@code subgraph} and {@code udf} folders
     * @param edgeTypes edge types to extract
     * @param verify    whether to run and write both verifications
     * @param maxIssues cap on listed issues per kind of problem
     * @return the produced texts, stage results and reports
     * @throws GraphInputUnavailableException if the source cannot be read
     * @throws GraphOutputException           if an output file cannot be written
     */
    public static PipelineResult process(GraphTextSource source, Path outputDir, List<String> edgeTypes,
                                         boolean verify, int maxIssues) {
        log.info("Processing {}", source.describe());
        String originalText = read(source);
        String baseName = CpgNames.joinEdgeTypes(edgeTypes) + "_original";

        // Extraction copies raw text only, attributes are needed for the attribute check alone.
        Graph original = GraphParser.parse(originalText, verify ? null : Set.of());
        ExtractionResult extraction = SubgraphExtractor.extract(original, edgeTypes);
        String subgraphText = SubgraphExtractor.render(extraction);
        Path subgraphPath = outputDir.resolve(SUBGRAPH_DIR).resolve(baseName + ".dot");
        writeText(subgraphPath, subgraphText);
        log.info("Subgraph written to: {}", subgraphPath);

        Graph subgraph = GraphParser.parse(subgraphText, verify ? null : CpgNames.CLASSIFICATION_KEYS);
        SliceResult slice = UdfFilter.filter(subgraph);
        String filteredText = UdfFilter.render(subgraph, slice, baseName);
        Path filteredPath = outputDir.resolve(UDF_DIR).resolve(baseName + "_udf_filtered.dot");
        writeText(filteredPath, filteredText);
        log.info("UDF-filtered graph written to: {}", filteredPath);

        if (!verify) {
            log.info("Verification skipped for {}", source.describe());
            return new PipelineResult(source.describe(), subgraphText, filteredText, extraction, slice, null, null);
        }

        VerificationReport extractionReport = ExtractionVerifier.verify(original, subgraph, edgeTypes, maxIssues);
        ReportWriter.write(outputDir.resolve(SUBGRAPH_DIR).resolve(EXTRACTION_REPORT),
                ReportWriter.document(source.describe(), subgraphPath.toString(), original, subgraph,
                        extractionReport));

        Graph filtered = GraphParser.parse(filteredText);
        VerificationReport udfReport = UdfFilterVerifier.verify(subgraph, filtered, maxIssues);
        ReportWriter.write(outputDir.resolve(UDF_DIR).resolve(UDF_REPORT),
                ReportWriter.document(subgraphPath.toString(), filteredPath.toString(), subgraph, filtered,
                        udfReport));

        if (!extractionReport.overallPassed() || !udfReport.overallPassed()) {
            log.warn("Verification FAILED for {}: extraction {}, udf {}", source.describe(),
                    extractionReport.failedCategories(), udfReport.failedCategories());
        }
        return new PipelineResult(source.describe(), subgraphText, filteredText, extraction, slice,
                extractionReport, udfReport);
    }

    /**
     * Process one graph with the default edge types, verification on and the default issue cap.
     */
    public static PipelineResult process(GraphTextSource source, Path outputDir) {
        return process(source, outputDir, CpgNames.DEFAULT_EDGE_TYPES, true, IssueLists.DEFAULT_MAX_ISSUES);
    }

    /**
     * Read a graph source, turning I/O failures into {@link GraphInputUnavailableException}.
     */
    public static String read(GraphTextSource source) {
        try {
            return source.read();
        } catch (IOException e) {
            log.error("Failed to read graph from {}", source.describe(), e);
            throw new GraphInputUnavailableException(source.describe(), e);
        }
    }

    /**
     * Write graph text as UTF-8, creating parent directories as needed.
     */
    public static void writeText(Path target, String text) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to write {}", target, e);
            throw new GraphOutputException(target.toString(), e);
        }
    }
}
