package io.github.sparkrew.cpgslice.udf_slicer;

import io.github.sparkrew.cpgslice.udf_slicer.model.Declaration;
import io.github.sparkrew.cpgslice.udf_slicer.model.ScanDiagnostic;
import io.github.sparkrew.cpgslice.udf_slicer.model.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits exported graph text into raw node and edge declarations.
 * <p>
 * A declaration starts on a line whose first non-blank character is a double quote. Edge declarations
 * ({@code "a" -> "b" [...];}) always fit on one physical line. Node declarations may span many lines because quoted
 * attribute values can hold real newlines, so the end of a node block is found with a small state machine that
 * tracks quotes and backslash escapes across line boundaries.
 * <p>
 * Nothing in here throws on bad input. A fragment that cannot be scanned becomes a {@link ScanDiagnostic} and
 * scanning resumes on the line after the fragment's first line.
 */
public class GraphScanner {

    private static final Logger log = LoggerFactory.getLogger(GraphScanner.class);

    /**
     * States of the block scanner. OUTSIDE is the line-level state between declarations.
     */
    enum State {
        OUTSIDE,
        IN_NODE_BLOCK,
        IN_QUOTED_STRING,
        IN_QUOTED_STRING_ESCAPE
    }

    /**
     * Position of the closing bracket of an attribute block and of the semicolon that terminates the declaration.
     */
    record BlockEnd(int closingBracket, int semicolon) {
    }

    /**
     * Scan the complete text of one graph.
     *
     * @param text the graph text
     * @return the declarations in source order plus diagnostics for everything that was skipped
     */
    public static ScanResult scan(String text) {
        List<Declaration> declarations = new ArrayList<>();
        List<ScanDiagnostic> diagnostics = new ArrayList<>();
        int length = text.length();
        int pos = 0;
        int lineNumber = 1;
        while (pos < length) {
            int lineEnd = lineEnd(text, pos);
            int start = skipBlanks(text, pos, lineEnd);
            // Index of the last line break consumed by this iteration (or the end of the text).
            int consumedUpTo = lineEnd;
            if (start < lineEnd && text.charAt(start) == '"') {
                if (isEdgeLine(text, start, lineEnd)) {
                    scanEdge(text, start, lineEnd, lineNumber, declarations, diagnostics);
                } else {
                    int end = scanNode(text, start, lineEnd, lineNumber, declarations, diagnostics);
                    if (end > 0) {
                        consumedUpTo = lineEnd(text, end);
                    }
                }
            }
            lineNumber += countLineBreaks(text, pos, Math.min(consumedUpTo + 1, length));
            pos = consumedUpTo + 1;
        }
        if (!diagnostics.isEmpty()) {
            log.debug("Scanner skipped {} malformed fragment(s)", diagnostics.size());
        }
        return new ScanResult(declarations, diagnostics);
    }

    /**
     * Run the block state machine from just after an opening bracket until a closing bracket that is outside any
     * quoted string and is followed, after optional whitespace, by a semicolon.
     *
     * @param text  the text to scan
     * @param from  index just after the opening bracket
     * @param limit exclusive upper bound of the scan
     * @return the terminating positions, or null when the block does not end before {@code limit}
     */
    static BlockEnd findBlockEnd(String text, int from, int limit) {
        State state = State.IN_NODE_BLOCK;
        for (int i = from; i < limit; i++) {
            char c = text.charAt(i);
            switch (state) {
                case IN_NODE_BLOCK -> {
                    if (c == '"') {
                        state = State.IN_QUOTED_STRING;
                    } else if (c == ']') {
                        int next = skipWhitespace(text, i + 1, limit);
                        if (next < limit && text.charAt(next) == ';') {
                            return new BlockEnd(i, next);
                        }
                    }
                }
                case IN_QUOTED_STRING -> {
                    if (c == '\\') {
                        state = State.IN_QUOTED_STRING_ESCAPE;
                    } else if (c == '"') {
                        state = State.IN_NODE_BLOCK;
                    }
                }
                case IN_QUOTED_STRING_ESCAPE -> state = State.IN_QUOTED_STRING;
                default -> throw new IllegalStateException("Unexpected scanner state " + state);
            }
        }
        return null;
    }

    /**
     * A line is an edge when it contains an arrow before its first opening bracket.
     */
    static boolean isEdgeLine(String text, int start, int lineEnd) {
        String line = text.substring(start, lineEnd);
        int arrow = line.indexOf("->");
        int bracket = line.indexOf('[');
        return arrow >= 0 && (bracket < 0 || arrow < bracket);
    }

    private static int scanNode(String text, int start, int lineEnd, int lineNumber,
                                List<Declaration> declarations, List<ScanDiagnostic> diagnostics) {
        int idEnd = closingQuote(text, start, lineEnd);
        if (idEnd < 0) {
            diagnostics.add(new ScanDiagnostic(lineNumber, ScanDiagnostic.Kind.MALFORMED_DECLARATION,
                    "node id has no closing quote"));
            return -1;
        }
        int bracket = skipBlanks(text, idEnd + 1, lineEnd);
        if (bracket >= lineEnd || text.charAt(bracket) != '[') {
            diagnostics.add(new ScanDiagnostic(lineNumber, ScanDiagnostic.Kind.MALFORMED_DECLARATION,
                    "expected '[' after node id"));
            return -1;
        }
        BlockEnd end = findBlockEnd(text, bracket + 1, text.length());
        if (end == null) {
            diagnostics.add(new ScanDiagnostic(lineNumber, ScanDiagnostic.Kind.UNTERMINATED_BLOCK,
                    "attribute block of node " + text.substring(start, idEnd + 1) + " is never closed"));
            return -1;
        }
        String id = text.substring(start + 1, idEnd);
        String attributeText = text.substring(bracket + 1, end.closingBracket()).stripTrailing();
        String rawText = text.substring(start, end.semicolon() + 1);
        declarations.add(Declaration.node(id, rawText, attributeText, lineNumber));
        return end.semicolon() + 1;
    }

    private static void scanEdge(String text, int start, int lineEnd, int lineNumber,
                                 List<Declaration> declarations, List<ScanDiagnostic> diagnostics) {
        int sourceEnd = closingQuote(text, start, lineEnd);
        int arrow = sourceEnd < 0 ? lineEnd : skipBlanks(text, sourceEnd + 1, lineEnd);
        if (arrow + 1 >= lineEnd || !text.startsWith("->", arrow)) {
            diagnostics.add(new ScanDiagnostic(lineNumber, ScanDiagnostic.Kind.MALFORMED_DECLARATION,
                    "edge source is not followed by '->'"));
            return;
        }
        int targetStart = skipBlanks(text, arrow + 2, lineEnd);
        int targetEnd = targetStart < lineEnd && text.charAt(targetStart) == '"'
                ? closingQuote(text, targetStart, lineEnd)
                : -1;
        if (targetEnd < 0) {
            diagnostics.add(new ScanDiagnostic(lineNumber, ScanDiagnostic.Kind.MALFORMED_DECLARATION,
                    "edge target is not a quoted id"));
            return;
        }
        int bracket = skipBlanks(text, targetEnd + 1, lineEnd);
        if (bracket >= lineEnd || text.charAt(bracket) != '[') {
            diagnostics.add(new ScanDiagnostic(lineNumber, ScanDiagnostic.Kind.MALFORMED_DECLARATION,
                    "expected '[' after edge target"));
            return;
        }
        BlockEnd end = findBlockEnd(text, bracket + 1, lineEnd);
        if (end == null) {
            diagnostics.add(new ScanDiagnostic(lineNumber, ScanDiagnostic.Kind.MALFORMED_DECLARATION,
                    "edge declaration does not end with '];' on its line"));
            return;
        }
        declarations.add(Declaration.edge(
                text.substring(start + 1, sourceEnd),
                text.substring(targetStart + 1, targetEnd),
                text.substring(start, end.semicolon() + 1),
                text.substring(bracket + 1, end.closingBracket()).stripTrailing(),
                lineNumber));
    }

    /**
     * Find the quote closing the quoted token that opens at {@code openQuote}, honouring backslash escapes.
     *
     * @return index of the closing quote, or -1 if there is none before {@code limit}
     */
    private static int closingQuote(String text, int openQuote, int limit) {
        boolean escaped = false;
        for (int i = openQuote + 1; i < limit; i++) {
            char c = text.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '"') {
                return i;
            }
        }
        return -1;
    }

    private static int lineEnd(String text, int from) {
        int newline = text.indexOf('\n', from);
        return newline < 0 ? text.length() : newline;
    }

    // Blanks stop at the end of the line, whitespace does not.
    private static int skipBlanks(String text, int from, int limit) {
        int i = from;
        while (i < limit && text.charAt(i) != '\n' && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int skipWhitespace(String text, int from, int limit) {
        int i = from;
        while (i < limit && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int countLineBreaks(String text, int from, int to) {
        int count = 0;
        for (int i = from; i < to; i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
