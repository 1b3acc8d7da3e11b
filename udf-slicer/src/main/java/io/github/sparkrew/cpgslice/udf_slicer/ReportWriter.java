package io.github.sparkrew.cpgslice.udf_slicer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.sparkrew.cpgslice.udf_slicer.model.Graph;
import io.github.sparkrew.cpgslice.udf_slicer.model.VerificationDocument;
import io.github.sparkrew.cpgslice.udf_slicer.model.VerificationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes verification reports as indented JSON.
 */
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);
    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Assemble the persisted form of a report.
     *
     * @param originalPath path of the graph the check started from
     * @param producedPath path of the graph that was checked
     */
    public static VerificationDocument document(String originalPath, String producedPath, Graph original,
                                                Graph produced, VerificationReport report) {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("original_dot", originalPath);
        files.put("filtered_dot", producedPath);
        VerificationDocument.Counts counts = new VerificationDocument.Counts(
                original.nodes().size(), original.edges().size(),
                produced.nodes().size(), produced.edges().size());
        return new VerificationDocument(files, counts, report.categories(), report.overallPassed());
    }

    public static String toJson(VerificationDocument document) {
        try {
            return mapper.writeValueAsString(document);
        } catch (IOException e) {
            throw new IllegalStateException("Verification document cannot be serialized", e);
        }
    }

    /**
     * Write a document, creating parent directories as needed.
     *
     * @throws GraphOutputException if the file cannot be written
     */
    public static void write(Path target, VerificationDocument document) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(target.toFile(), document);
            log.info("Verification report written to: {}", target);
        } catch (IOException e) {
            log.error("Failed to write verification report to {}", target, e);
            throw new GraphOutputException(target.toString(), e);
        }
    }
}
