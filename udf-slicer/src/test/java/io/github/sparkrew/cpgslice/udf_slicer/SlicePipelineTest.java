package io.github.sparkrew.cpgslice.udf_slicer;

import io.github.sparkrew.cpgslice.udf_slicer.model.PipelineResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for SlicePipeline class.
 */
@ExtendWith(MockitoExtension.class)
class SlicePipelineTest {

    @TempDir
    Path tempDir;

    @Test
    void testProcess_WritesLayout() throws IOException {
        Path input = tempDir.resolve("export.dot");
        Files.writeString(input, SampleGraphs.EXPORT);
        Path out = tempDir.resolve("out");

        PipelineResult result = SlicePipeline.process(GraphTextSource.ofPath(input), out, List.of("CFG", "CALL"),
                true, 50);

        assertTrue(result.verified());
        assertTrue(result.passed());
        Path subgraph = out.resolve("subgraph").resolve("CFG_CALL_original.dot");
        Path filtered = out.resolve("udf").resolve("CFG_CALL_original_udf_filtered.dot");
        assertEquals(result.subgraphText(), Files.readString(subgraph));
        assertEquals(result.filteredText(), Files.readString(filtered));
        assertTrue(Files.exists(out.resolve("subgraph").resolve("extraction_verification.json")));
        assertTrue(Files.exists(out.resolve("udf").resolve("udf_verification.json")));
        assertTrue(result.filteredText().startsWith("digraph udf_CFG_CALL_original {"));
        assertEquals(2, result.slice().keptNodeIds().size());
        assertEquals(3, result.extraction().keptNodes().size());
    }

    @Test
    void testProcess_SkipVerification() {
        Path out = tempDir.resolve("out");

        PipelineResult result = SlicePipeline.process(GraphTextSource.ofString(SampleGraphs.EXPORT, "sample"), out,
                List.of("CFG", "CALL"), false, 50);

        assertFalse(result.verified());
        assertFalse(result.passed());
        assertNull(result.extractionReport());
        assertTrue(Files.exists(out.resolve("udf").resolve("CFG_CALL_original_udf_filtered.dot")));
        assertFalse(Files.exists(out.resolve("udf").resolve("udf_verification.json")));
        assertEquals(2, result.slice().keptEdges().size());
    }

    @Test
    void testProcess_SameOutputWithAndWithoutVerification() {
        PipelineResult verified = SlicePipeline.process(GraphTextSource.ofString(SampleGraphs.EXPORT, "a"),
                tempDir.resolve("a"));
        PipelineResult unverified = SlicePipeline.process(GraphTextSource.ofString(SampleGraphs.EXPORT, "b"),
                tempDir.resolve("b"), List.of("CFG", "CALL"), false, 50);

        assertEquals(verified.subgraphText(), unverified.subgraphText());
        assertEquals(verified.filteredText(), unverified.filteredText());
    }

    @Test
    void testProcess_UnreadableSource() throws IOException {
        GraphTextSource source = mock(GraphTextSource.class);
        when(source.read()).thenThrow(new IOException("disk gone"));

        GraphInputUnavailableException ex = assertThrows(GraphInputUnavailableException.class,
                () -> SlicePipeline.process(source, tempDir, List.of("CFG", "CALL"), true, 50));

        assertInstanceOf(IOException.class, ex.getCause());
        verify(source).read();
        assertFalse(Files.exists(tempDir.resolve("subgraph")));
    }

    @Test
    void testProcess_MissingFile() {
        GraphTextSource source = GraphTextSource.ofPath(tempDir.resolve("nope.dot"));

        assertThrows(GraphInputUnavailableException.class,
                () -> SlicePipeline.process(source, tempDir, List.of("CFG", "CALL"), true, 50));
    }

    @Test
    void testProcess_UnwritableOutput() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "file, not a directory");

        assertThrows(GraphOutputException.class,
                () -> SlicePipeline.process(GraphTextSource.ofString(SampleGraphs.EXPORT, "sample"), blocker,
                        List.of("CFG", "CALL"), true, 50));
    }
}
