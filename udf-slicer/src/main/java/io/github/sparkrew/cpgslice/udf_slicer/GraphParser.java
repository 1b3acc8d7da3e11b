package io.github.sparkrew.cpgslice.udf_slicer;

import io.github.sparkrew.cpgslice.udf_slicer.model.DecodedAttributes;
import io.github.sparkrew.cpgslice.udf_slicer.model.Declaration;
import io.github.sparkrew.cpgslice.udf_slicer.model.DeclarationKind;
import io.github.sparkrew.cpgslice.udf_slicer.model.EdgeRecord;
import io.github.sparkrew.cpgslice.udf_slicer.model.Graph;
import io.github.sparkrew.cpgslice.udf_slicer.model.NodeRecord;
import io.github.sparkrew.cpgslice.udf_slicer.model.ScanDiagnostic;
import io.github.sparkrew.cpgslice.udf_slicer.model.ScanResult;
import io.github.sparkrew.cpgslice.udf_slicer.utils.CpgNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link Graph} from exported graph text.
 */
public class GraphParser {

    private static final Logger log = LoggerFactory.getLogger(GraphParser.class);
    private static final int MAX_LOGGED_DIAGNOSTICS = 5;

    /**
     * Parse a graph and decode every node attribute.
     */
    public static Graph parse(String text) {
        return parse(text, null);
    }

    /**
     * Parse a graph.
     *
     * @param text     the graph text
     * @param nodeKeys node attributes to decode, or null for all of them. Edge attributes are always fully decoded.
     * @return the graph; a node id declared twice keeps its later declaration
     */
    public static Graph parse(String text, Set<String> nodeKeys) {
        ScanResult scan = GraphScanner.scan(text);
        List<ScanDiagnostic> diagnostics = new ArrayList<>(scan.diagnostics());
        Map<String, NodeRecord> nodes = new LinkedHashMap<>();
        List<EdgeRecord> edges = new ArrayList<>();
        int duplicates = 0;
        for (Declaration declaration : scan.declarations()) {
            if (declaration.kind() == DeclarationKind.NODE) {
                DecodedAttributes attributes = AttributeDecoder.decode(declaration.attributeText(), nodeKeys);
                recordSkipped(declaration, attributes, diagnostics);
                NodeRecord previous = nodes.put(declaration.id(),
                        new NodeRecord(declaration.id(), attributes.values(), declaration.rawText()));
                if (previous != null) {
                    duplicates++;
                    log.debug("Node {} declared again on line {}, the later declaration wins",
                            declaration.id(), declaration.lineNumber());
                }
            } else {
                DecodedAttributes attributes = AttributeDecoder.decode(declaration.attributeText(), null);
                recordSkipped(declaration, attributes, diagnostics);
                edges.add(new EdgeRecord(
                        declaration.id(),
                        declaration.targetId(),
                        attributes.values().getOrDefault(CpgNames.LABEL, ""),
                        attributes.values(),
                        declaration.rawText()));
            }
        }
        if (duplicates > 0) {
            log.debug("{} duplicate node declaration(s) superseded", duplicates);
        }
        if (!diagnostics.isEmpty()) {
            log.warn("Skipped {} malformed fragment(s) while parsing", diagnostics.size());
            diagnostics.stream().limit(MAX_LOGGED_DIAGNOSTICS).forEach(d -> log.warn("  - {}", d));
        }
        return new Graph(nodes, edges, diagnostics);
    }

    private static void recordSkipped(Declaration declaration, DecodedAttributes attributes,
                                      List<ScanDiagnostic> diagnostics) {
        for (String fragment : attributes.skippedFragments()) {
            diagnostics.add(new ScanDiagnostic(declaration.lineNumber(), ScanDiagnostic.Kind.MALFORMED_ATTRIBUTE,
                    "skipped attribute fragment '" + abbreviate(fragment) + "'"));
        }
    }

    private static String abbreviate(String fragment) {
        return fragment.length() <= 40 ? fragment : fragment.substring(0, 37) + "...";
    }
}
