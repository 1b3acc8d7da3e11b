package io.github.sparkrew.cpgslice.udf_slicer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.sparkrew.cpgslice.udf_slicer.model.Graph;
import io.github.sparkrew.cpgslice.udf_slicer.model.VerificationDocument;
import io.github.sparkrew.cpgslice.udf_slicer.model.VerificationReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReportWriter class.
 */
class ReportWriterTest {

    @TempDir
    Path tempDir;

    private static VerificationDocument sampleDocument() {
        Graph original = GraphParser.parse(SampleGraphs.EXPORT);
        Graph extracted = GraphParser.parse(
                SubgraphExtractor.render(SubgraphExtractor.extract(original, List.of("CFG", "CALL"))));
        VerificationReport report = VerificationReport.builder()
                .category("edges")
                .category("nodes")
                .issue("nodes", "Missing node 7")
                .build();
        return ReportWriter.document("export.dot", "CFG_CALL_original.dot", original, extracted, report);
    }

    @Test
    void testDocument_Counts() {
        VerificationDocument document = sampleDocument();

        assertEquals(3, document.counts().originalNodes());
        assertEquals(4, document.counts().originalEdges());
        assertEquals(3, document.counts().filteredNodes());
        assertEquals(3, document.counts().filteredEdges());
        assertFalse(document.overallPassed());
    }

    @Test
    void testWrite_FieldNames() throws IOException {
        Path target = tempDir.resolve("reports").resolve("verification.json");

        ReportWriter.write(target, sampleDocument());

        assertTrue(Files.exists(target));
        JsonNode root = new ObjectMapper().readTree(target.toFile());
        assertEquals("export.dot", root.get("files").get("original_dot").asText());
        assertEquals("CFG_CALL_original.dot", root.get("files").get("filtered_dot").asText());
        assertEquals(2, root.get("files").size());
        assertEquals(3, root.get("counts").get("original_nodes").asInt());
        assertEquals(4, root.get("counts").get("original_edges").asInt());
        assertEquals(3, root.get("counts").get("filtered_edges").asInt());
        assertTrue(root.get("verification_results").get("edges").get("passed").asBoolean());
        assertFalse(root.get("verification_results").get("nodes").get("passed").asBoolean());
        assertEquals("Missing node 7", root.get("verification_results").get("nodes").get("issues").get(0).asText());
        assertFalse(root.get("overall_passed").asBoolean());
    }

    @Test
    void testToJson_Indented() {
        String json = ReportWriter.toJson(sampleDocument());

        assertTrue(json.startsWith("{\n") || json.startsWith("{\r\n"));
        assertTrue(json.indexOf("\"files\"") < json.indexOf("\"overall_passed\""));
    }

    @Test
    void testWrite_UnwritableTarget() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        assertThrows(GraphOutputException.class,
                () -> ReportWriter.write(blocker.resolve("report.json"), sampleDocument()));
    }
}
